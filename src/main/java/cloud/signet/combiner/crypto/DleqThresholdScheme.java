package cloud.signet.combiner.crypto;

import cloud.signet.combiner.KeyEpoch;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Threshold Diffie-Hellman signatures over secp256k1.
 *
 * <p>
 * The key {@code x} is shared with a polynomial {@code f} of degree {@code t - 1}; signer {@code i} holds {@code f(i)}.
 * The verification polynomial publishes {@code C_j = a_j * G} for every coefficient, so the public share of signer
 * {@code i} is {@code Y_i = sum(i^j * C_j)} and {@code C_0} is the public key.
 * </p>
 *
 * <p>
 * A partial signature over a blinded point {@code M} is {@code S_i = f(i) * M} followed by a Chaum-Pedersen proof
 * {@code (c, s)} that {@code S_i} and {@code Y_i} share the same discrete log. Encoding:
 * {@code S_i (33 bytes compressed) || c (32 bytes) || s (32 bytes)}. The combined signature is the compressed
 * encoding of {@code x * M}, obtained by Lagrange interpolation at zero.
 * </p>
 */
public final class DleqThresholdScheme implements ThresholdScheme {

    static final X9ECParameters CURVE = CustomNamedCurves.getByName("secp256k1");
    static final int POINT_LENGTH = 33;
    static final int SCALAR_LENGTH = 32;
    static final int SHARE_LENGTH = POINT_LENGTH + 2 * SCALAR_LENGTH;

    private static final byte[] CHALLENGE_TAG = "signet-dleq-v1".getBytes(StandardCharsets.US_ASCII);

    private final ECPoint publicKey;
    private final List<ECPoint> commitments;

    private DleqThresholdScheme(ECPoint publicKey, List<ECPoint> commitments) {
        this.publicKey = publicKey;
        this.commitments = commitments;
    }

    /**
     * Builds the scheme for a key epoch.
     *
     * @throws IllegalArgumentException when the key material cannot be decoded or the public key does not match the
     *                                  polynomial's constant term.
     */
    public static DleqThresholdScheme fromEpoch(KeyEpoch epoch) {
        ECPoint publicKey = decodePoint(decodeHex(epoch.publicKey(), "publicKey"), "publicKey");
        byte[] polynomial = decodeHex(epoch.verificationPolynomial(), "verificationPolynomial");
        if (polynomial.length == 0 || polynomial.length % POINT_LENGTH != 0) {
            throw new IllegalArgumentException("verificationPolynomial must be a non-empty sequence of compressed points");
        }

        List<ECPoint> commitments = new ArrayList<>(polynomial.length / POINT_LENGTH);
        for (int offset = 0; offset < polynomial.length; offset += POINT_LENGTH) {
            byte[] encoded = Arrays.copyOfRange(polynomial, offset, offset + POINT_LENGTH);
            commitments.add(decodePoint(encoded, "verificationPolynomial"));
        }
        if (!commitments.get(0).equals(publicKey)) {
            throw new IllegalArgumentException("publicKey does not match the verification polynomial");
        }
        return new DleqThresholdScheme(publicKey, Collections.unmodifiableList(commitments));
    }

    @Override
    public int threshold() {
        return commitments.size();
    }

    public ECPoint publicKey() {
        return publicKey;
    }

    /**
     * Evaluates the verification polynomial in the exponent at {@code index}.
     */
    public ECPoint publicShare(int index) {
        BigInteger x = BigInteger.valueOf(index);
        BigInteger power = BigInteger.ONE;
        ECPoint acc = CURVE.getCurve().getInfinity();
        for (ECPoint commitment : commitments) {
            acc = acc.add(commitment.multiply(power));
            power = power.multiply(x).mod(CURVE.getN());
        }
        return acc.normalize();
    }

    @Override
    public void validateMessage(byte[] blindedMessage) {
        decodePoint(blindedMessage, "blinded message");
    }

    @Override
    public boolean verifyShare(int signerIndex, byte[] blindedMessage, byte[] partialSignature) {
        if (signerIndex < 1 || partialSignature == null || partialSignature.length != SHARE_LENGTH) {
            return false;
        }
        ECPoint message;
        ECPoint share;
        try {
            message = decodePoint(blindedMessage, "blinded message");
            share = decodePoint(Arrays.copyOfRange(partialSignature, 0, POINT_LENGTH), "partial signature");
        } catch (IllegalArgumentException ex) {
            return false;
        }

        BigInteger n = CURVE.getN();
        BigInteger c = BigIntegers.fromUnsignedByteArray(partialSignature, POINT_LENGTH, SCALAR_LENGTH);
        BigInteger s = BigIntegers.fromUnsignedByteArray(partialSignature, POINT_LENGTH + SCALAR_LENGTH, SCALAR_LENGTH);
        if (c.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            return false;
        }

        ECPoint g = CURVE.getG();
        ECPoint publicShare = publicShare(signerIndex);
        ECPoint a1 = g.multiply(s).add(publicShare.multiply(c));
        ECPoint a2 = message.multiply(s).add(share.multiply(c));
        return challenge(g, publicShare, message, share, a1, a2).equals(c);
    }

    @Override
    public byte[] reconstruct(SortedMap<Integer, byte[]> partialSignatures) throws CombinationUnavailableException {
        if (partialSignatures.size() < threshold()) {
            throw new CombinationUnavailableException(
                "need " + threshold() + " partial signatures, got " + partialSignatures.size());
        }

        BigInteger n = CURVE.getN();
        ECPoint acc = CURVE.getCurve().getInfinity();
        for (Map.Entry<Integer, byte[]> entry : partialSignatures.entrySet()) {
            byte[] encoded = Arrays.copyOfRange(entry.getValue(), 0, POINT_LENGTH);
            ECPoint share = decodePoint(encoded, "partial signature");
            BigInteger lambda = lagrangeAtZero(entry.getKey(), partialSignatures.keySet(), n);
            acc = acc.add(share.multiply(lambda));
        }
        acc = acc.normalize();
        if (acc.isInfinity()) {
            throw new CombinationUnavailableException("combined signature is the point at infinity");
        }
        return acc.getEncoded(true);
    }

    static BigInteger lagrangeAtZero(int index, Iterable<Integer> indices, BigInteger modulus) {
        BigInteger xi = BigInteger.valueOf(index);
        BigInteger numerator = BigInteger.ONE;
        BigInteger denominator = BigInteger.ONE;
        for (int other : indices) {
            if (other == index) {
                continue;
            }
            BigInteger xj = BigInteger.valueOf(other);
            numerator = numerator.multiply(xj).mod(modulus);
            denominator = denominator.multiply(xj.subtract(xi)).mod(modulus);
        }
        return numerator.multiply(denominator.modInverse(modulus)).mod(modulus);
    }

    static BigInteger challenge(ECPoint... points) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(CHALLENGE_TAG, 0, CHALLENGE_TAG.length);
        for (ECPoint point : points) {
            byte[] encoded = point.getEncoded(true);
            digest.update(encoded, 0, encoded.length);
        }
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return new BigInteger(1, out).mod(CURVE.getN());
    }

    static ECPoint decodePoint(byte[] encoded, String what) {
        if (encoded == null || encoded.length != POINT_LENGTH) {
            throw new IllegalArgumentException(what + " must be a " + POINT_LENGTH + "-byte compressed point");
        }
        ECPoint point = CURVE.getCurve().decodePoint(encoded);
        if (point.isInfinity() || !point.isValid()) {
            throw new IllegalArgumentException(what + " is not a valid curve point");
        }
        return point.normalize();
    }

    private static byte[] decodeHex(String value, String what) {
        String trimmed = value.trim();
        if (trimmed.startsWith("0x")) {
            trimmed = trimmed.substring(2);
        }
        try {
            return Hex.decode(trimmed);
        } catch (DecoderException ex) {
            throw new IllegalArgumentException(what + " is not valid hex", ex);
        }
    }
}
