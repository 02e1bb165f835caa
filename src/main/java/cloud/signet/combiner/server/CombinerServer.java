package cloud.signet.combiner.server;

import cloud.signet.combiner.CombinedSignature;
import cloud.signet.combiner.CombinerApiException;
import cloud.signet.combiner.CombinerConfig;
import cloud.signet.combiner.CombinerException;
import cloud.signet.combiner.ErrorCode;
import cloud.signet.combiner.QuorumCombiner;
import cloud.signet.combiner.SigningRequest;
import cloud.signet.combiner.internal.HttpUtil;
import cloud.signet.combiner.protocol.BlindedMessageProtocol;
import cloud.signet.combiner.protocol.DomainSignatureProtocol;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front end exposing one endpoint per signing protocol and a {@code /status} endpoint.
 */
public final class CombinerServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(CombinerServer.class.getName());

    private final CombinerConfig config;
    private final HttpServer server;
    private final ExecutorService executor;
    private final Instant startedAt = Instant.now();

    public CombinerServer(CombinerConfig config, List<QuorumCombiner> combiners) throws IOException {
        this.config = Objects.requireNonNull(config, "config");
        this.server = HttpServer.create(new InetSocketAddress(config.getPort()), 0);
        this.executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        for (QuorumCombiner combiner : combiners) {
            server.createContext(combiner.protocol().combinerPath(), new SigningHandler(combiner));
        }
        server.createContext("/status", new StatusHandler());
    }

    /**
     * Creates a server serving both the blinded-message and the domain-restricted protocols.
     */
    public static CombinerServer create(CombinerConfig config) throws IOException {
        return new CombinerServer(config, List.of(
            new QuorumCombiner(config, new BlindedMessageProtocol()),
            new QuorumCombiner(config, new DomainSignatureProtocol())
        ));
    }

    public void start() {
        server.start();
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[combiner] listening on port %d with %d signers, threshold %d, key version %d",
            port(), config.getSigners().size(), config.getThreshold(), config.getKeyVersion()));
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            System.err.println("usage: CombinerServer <combiner.properties>");
            System.exit(2);
        }
        Properties properties = new Properties();
        try (InputStream stream = Files.newInputStream(Path.of(args[0]))) {
            properties.load(stream);
        }
        CombinerServer server = create(CombinerConfig.fromProperties(properties));
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "combiner-shutdown"));
        server.start();
    }

    private final class SigningHandler implements HttpHandler {

        private final QuorumCombiner combiner;

        private SigningHandler(QuorumCombiner combiner) {
            this.combiner = combiner;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    respondWithError(exchange, new CombinerApiException(405, ErrorCode.METHOD_NOT_ALLOWED));
                    return;
                }
                try {
                    SigningRequest request = SigningRequest.of(
                        HttpUtil.readBody(exchange),
                        exchange.getRequestHeaders().getFirst(CombinerConfig.KEY_VERSION_HEADER),
                        exchange.getRequestHeaders().getFirst(CombinerConfig.AUTHORIZATION_HEADER));
                    CombinedSignature signature = combiner.sign(request);
                    HttpUtil.writeJson(exchange, 200,
                        new SignatureResponse(true, signature.combinedSignature(), signature.version()));
                } catch (CombinerApiException ex) {
                    respondWithError(exchange, ex);
                } catch (CombinerException | RuntimeException ex) {
                    LOGGER.log(Level.SEVERE, "[combiner] " + combiner.protocol().name() + " request failed", ex);
                    respondWithError(exchange, new CombinerApiException(500, ErrorCode.UNKNOWN_ERROR));
                }
            } finally {
                exchange.close();
            }
        }
    }

    private final class StatusHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                HttpUtil.writeJson(exchange, 200, new StatusResponse(
                    config.getVersion(),
                    config.getKeyVersion(),
                    config.getThreshold(),
                    config.getSigners().size(),
                    startedAt));
            } finally {
                exchange.close();
            }
        }
    }

    private void respondWithError(HttpExchange exchange, CombinerApiException error) throws IOException {
        LOGGER.info(() -> String.format(Locale.ROOT, "[combiner] responding %d %s",
            error.getStatusCode(), error.getCode()));
        HttpUtil.writeJson(exchange, error.getStatusCode(),
            new ErrorResponse(false, error.getCode().name(), error.getMessage(), config.getVersion()));
    }

    record SignatureResponse(boolean success, String combinedSignature, String version) {
    }

    record ErrorResponse(boolean success, String error, String message, String version) {
    }

    record StatusResponse(String version, int keyVersion, int threshold, int signers, Instant startedAt) {
    }
}
