package cloud.signet.combiner;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.signet.combiner.crypto.DleqThresholdScheme;
import cloud.signet.combiner.crypto.ThresholdCryptoModule;
import cloud.signet.combiner.crypto.ThresholdSignatureAccumulator;
import cloud.signet.combiner.fanout.HttpSignerFanout;
import cloud.signet.combiner.fanout.SignerCall;
import cloud.signet.combiner.fanout.SignerFanout;
import cloud.signet.combiner.protocol.SigningProtocol;
import cloud.signet.combiner.validation.ResponseValidator;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Combines partial signatures from a fixed set of signers into one threshold signature. A combiner is immutable and
 * thread-safe; every request gets its own {@link SigningSession}.
 * </p>
 *
 * <h2>Request flow</h2>
 * <ol>
 *   <li>Rejects requests declaring a key version other than the configured one, and bodies the protocol refuses,
 *       before any signer is contacted.</li>
 *   <li>Fans the request out to every signer with the configured key version attached.</li>
 *   <li>Validates each response as it arrives and accumulates verified partial signatures.</li>
 *   <li>As soon as the threshold is reached, cancels the calls still in flight and combines once.</li>
 *   <li>Otherwise answers with the error derived from the signers' majority status code.</li>
 * </ol>
 *
 * <p>
 * The per-domain behaviour (input check, blinded message and signature fields, discrepancy logging) comes from the
 * {@link SigningProtocol}; signing and domain-restricted combiners share this class and differ only in the protocol
 * they are built with.
 * </p>
 */
public final class QuorumCombiner {

    private static final Logger LOGGER = Logger.getLogger(QuorumCombiner.class.getName());

    private final CombinerConfig config;
    private final SigningProtocol protocol;
    private final SignerFanout fanout;
    private final ThresholdCryptoModule.Factory cryptoFactory;
    private final ResponseValidator validator;

    /**
     * Builds a combiner talking to the configured signers over HTTP and verifying shares against the configured key.
     *
     * @throws IllegalArgumentException when the key material is malformed or its degree does not match the threshold.
     */
    public QuorumCombiner(CombinerConfig config, SigningProtocol protocol) {
        this(config, protocol,
            new HttpSignerFanout(config.getHttpClient(), config.getSignerTimeout()),
            ThresholdSignatureAccumulator.factory(schemeFor(config)));
    }

    public QuorumCombiner(CombinerConfig config, SigningProtocol protocol, SignerFanout fanout,
                          ThresholdCryptoModule.Factory cryptoFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.fanout = Objects.requireNonNull(fanout, "fanout");
        this.cryptoFactory = Objects.requireNonNull(cryptoFactory, "cryptoFactory");
        this.validator = new ResponseValidator(config.getKeyVersion(), protocol);
    }

    /**
     * Signs {@code request} and blocks until an outcome is known.
     *
     * @throws CombinerApiException for every client-visible failure (bad key header, bad input, insufficient quorum).
     * @throws CombinerException    when interrupted while waiting.
     */
    public CombinedSignature sign(SigningRequest request) throws CombinerException {
        return start(request).await();
    }

    /**
     * Validates {@code request} and starts the fan-out without waiting for signers.
     *
     * @throws CombinerApiException with status 400 when the request is rejected before fan-out.
     */
    public SigningSession start(SigningRequest request) throws CombinerApiException {
        Objects.requireNonNull(request, "request");
        checkKeyVersion(request.declaredKeyVersion());

        JsonNode body = request.body();
        protocol.checkInput(body);

        ThresholdCryptoModule crypto;
        try {
            byte[] blindedMessage = Base64.getDecoder().decode(protocol.blindedMessage(body).trim());
            crypto = cryptoFactory.open(blindedMessage);
        } catch (IllegalArgumentException ex) {
            throw new CombinerApiException(400, ErrorCode.INVALID_INPUT, "blinded message: " + ex.getMessage());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(CombinerConfig.KEY_VERSION_HEADER, Integer.toString(config.getKeyVersion()));
        headers.put(CombinerConfig.AUTHORIZATION_HEADER, request.authorization());
        SignerCall call = new SignerCall(protocol.signerPath(), request.rawBody(), headers);

        SigningSession session = new SigningSession(protocol, validator, crypto, config.getSigners().size(),
            config.getVersion());
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[combiner] %s request fanned out to %d signers (threshold %d, key version %d)",
            protocol.name(), config.getSigners().size(), crypto.threshold(), config.getKeyVersion()));
        session.start(fanout, call, config.getSigners());
        return session;
    }

    public SigningProtocol protocol() {
        return protocol;
    }

    private void checkKeyVersion(String declared) throws CombinerApiException {
        if (declared == null) {
            return;
        }
        boolean matches;
        try {
            matches = Integer.parseInt(declared) == config.getKeyVersion();
        } catch (NumberFormatException ex) {
            matches = false;
        }
        if (!matches) {
            LOGGER.warning(() -> "[combiner] request declared key version " + declared + ", serving "
                + config.getKeyVersion());
            throw new CombinerApiException(400, ErrorCode.INVALID_KEY_HEADER);
        }
    }

    private static DleqThresholdScheme schemeFor(CombinerConfig config) {
        DleqThresholdScheme scheme = DleqThresholdScheme.fromEpoch(config.getKeys());
        if (scheme.threshold() != config.getThreshold()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                "verification polynomial has %d coefficients but threshold is %d",
                scheme.threshold(), config.getThreshold()));
        }
        return scheme;
    }
}
