package cloud.signet.combiner.crypto;

import cloud.signet.combiner.KeyEpoch;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Trusted dealer for tests: shares a random key and produces partial signatures the way signer nodes do.
 */
public final class TestDealer {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final BigInteger[] coefficients;
    private final int keyVersion;

    public TestDealer(int threshold, int keyVersion) {
        BigInteger n = DleqThresholdScheme.CURVE.getN();
        this.coefficients = new BigInteger[threshold];
        for (int i = 0; i < threshold; i++) {
            coefficients[i] = BigIntegers.createRandomInRange(BigInteger.ONE, n.subtract(BigInteger.ONE), RANDOM);
        }
        this.keyVersion = keyVersion;
    }

    public KeyEpoch epoch() {
        ByteArrayOutputStream polynomial = new ByteArrayOutputStream();
        for (BigInteger coefficient : coefficients) {
            polynomial.writeBytes(DleqThresholdScheme.CURVE.getG().multiply(coefficient).getEncoded(true));
        }
        String publicKey = Hex.toHexString(DleqThresholdScheme.CURVE.getG().multiply(coefficients[0]).getEncoded(true));
        return new KeyEpoch(publicKey, keyVersion, Hex.toHexString(polynomial.toByteArray()));
    }

    public BigInteger share(int index) {
        BigInteger n = DleqThresholdScheme.CURVE.getN();
        BigInteger x = BigInteger.valueOf(index);
        BigInteger result = BigInteger.ZERO;
        BigInteger power = BigInteger.ONE;
        for (BigInteger coefficient : coefficients) {
            result = result.add(coefficient.multiply(power)).mod(n);
            power = power.multiply(x).mod(n);
        }
        return result;
    }

    public static byte[] blindedMessage() {
        BigInteger n = DleqThresholdScheme.CURVE.getN();
        BigInteger r = BigIntegers.createRandomInRange(BigInteger.ONE, n.subtract(BigInteger.ONE), RANDOM);
        return DleqThresholdScheme.CURVE.getG().multiply(r).getEncoded(true);
    }

    public static String blindedMessageBase64() {
        return Base64.getEncoder().encodeToString(blindedMessage());
    }

    public byte[] partialSignature(int index, byte[] blindedMessage) {
        return prove(share(index), blindedMessage);
    }

    public String partialSignatureBase64(int index, String blindedMessageBase64) {
        return Base64.getEncoder().encodeToString(partialSignature(index, Base64.getDecoder().decode(blindedMessageBase64)));
    }

    /**
     * A well-formed partial signature computed with the wrong key share; its proof does not verify.
     */
    public byte[] forgedPartialSignature(int index, byte[] blindedMessage) {
        return prove(share(index).add(BigInteger.ONE), blindedMessage);
    }

    public String forgedPartialSignatureBase64(int index, String blindedMessageBase64) {
        return Base64.getEncoder().encodeToString(
            forgedPartialSignature(index, Base64.getDecoder().decode(blindedMessageBase64)));
    }

    public byte[] expectedSignature(byte[] blindedMessage) {
        ECPoint message = DleqThresholdScheme.decodePoint(blindedMessage, "blinded message");
        return message.multiply(coefficients[0]).normalize().getEncoded(true);
    }

    public String expectedSignatureBase64(String blindedMessageBase64) {
        return Base64.getEncoder().encodeToString(expectedSignature(Base64.getDecoder().decode(blindedMessageBase64)));
    }

    private static byte[] prove(BigInteger secret, byte[] blindedMessage) {
        BigInteger n = DleqThresholdScheme.CURVE.getN();
        ECPoint g = DleqThresholdScheme.CURVE.getG();
        ECPoint message = DleqThresholdScheme.decodePoint(blindedMessage, "blinded message");

        ECPoint publicShare = g.multiply(secret).normalize();
        ECPoint signature = message.multiply(secret).normalize();
        BigInteger k = BigIntegers.createRandomInRange(BigInteger.ONE, n.subtract(BigInteger.ONE), RANDOM);
        ECPoint a1 = g.multiply(k);
        ECPoint a2 = message.multiply(k);
        BigInteger c = DleqThresholdScheme.challenge(g, publicShare, message, signature, a1, a2);
        BigInteger s = k.subtract(c.multiply(secret)).mod(n);

        return Arrays.concatenate(
            signature.getEncoded(true),
            BigIntegers.asUnsignedByteArray(DleqThresholdScheme.SCALAR_LENGTH, c),
            BigIntegers.asUnsignedByteArray(DleqThresholdScheme.SCALAR_LENGTH, s));
    }
}
