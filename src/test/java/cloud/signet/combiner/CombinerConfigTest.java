package cloud.signet.combiner;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CombinerConfigTest {

    private static final KeyEpoch KEYS = new KeyEpoch("02aa", 1, "02aa");

    @Test
    void appliesDefaults() {
        CombinerConfig config = CombinerConfig.builder()
            .signers(List.of("https://signer-a.test/", "https://signer-b.test"))
            .threshold(2)
            .keys(KEYS)
            .build();

        assertEquals(List.of(
            new SignerEndpoint("https://signer-a.test", 1),
            new SignerEndpoint("https://signer-b.test", 2)), config.getSigners());
        assertEquals(CombinerConfig.DEFAULT_SIGNER_TIMEOUT, config.getSignerTimeout());
        assertEquals(CombinerConfig.DEFAULT_VERSION, config.getVersion());
        assertEquals(CombinerConfig.DEFAULT_PORT, config.getPort());
        assertEquals(1, config.getKeyVersion());
        assertNotNull(config.getHttpClient());
    }

    @Test
    void skipsBlankSignerEntries() {
        CombinerConfig config = CombinerConfig.builder()
            .signers(Arrays.asList(" ", "https://signer-a.test", null, "https://signer-b.test"))
            .threshold(1)
            .keys(KEYS)
            .build();

        assertEquals(2, config.getSigners().get(1).index());
    }

    @Test
    void rejectsInvalidTopology() {
        assertThrows(IllegalArgumentException.class, () -> CombinerConfig.builder()
            .threshold(1).keys(KEYS).build());
        assertThrows(IllegalArgumentException.class, () -> CombinerConfig.builder()
            .signers(List.of("https://a.test", "https://a.test/")).threshold(1).keys(KEYS).build());
        assertThrows(IllegalArgumentException.class, () -> CombinerConfig.builder()
            .signers(List.of("https://a.test", "https://b.test")).threshold(3).keys(KEYS).build());
        assertThrows(IllegalArgumentException.class, () -> CombinerConfig.builder()
            .signers(List.of("https://a.test")).threshold(0).keys(KEYS).build());
        assertThrows(IllegalArgumentException.class, () -> CombinerConfig.builder()
            .signers(List.of("https://a.test")).threshold(1).build());
        assertThrows(IllegalArgumentException.class, () -> CombinerConfig.builder()
            .signers(List.of("signer-without-scheme")).threshold(1).keys(KEYS).build());
    }

    @Test
    void fallsBackToDefaultTimeoutForNonPositiveValues() {
        CombinerConfig config = CombinerConfig.builder()
            .signers(List.of("https://a.test"))
            .threshold(1)
            .keys(KEYS)
            .signerTimeout(Duration.ZERO)
            .build();
        assertEquals(CombinerConfig.DEFAULT_SIGNER_TIMEOUT, config.getSignerTimeout());
    }

    @Test
    void loadsFromProperties() throws Exception {
        Properties properties = new Properties();
        try (InputStream stream = getClass().getResourceAsStream("/combiner-test.properties")) {
            properties.load(stream);
        }

        CombinerConfig config = CombinerConfig.fromProperties(properties);
        assertEquals(3, config.getSigners().size());
        assertEquals("http://signer-1.test", config.getSigners().get(0).url());
        assertEquals("http://signer-2.test", config.getSigners().get(1).url());
        assertEquals(2, config.getThreshold());
        assertEquals(3, config.getKeyVersion());
        assertEquals("02aa02bb", config.getKeys().verificationPolynomial());
        assertEquals(Duration.ofMillis(1500), config.getSignerTimeout());
        assertEquals("2.4.0", config.getVersion());
        assertEquals(0, config.getPort());
    }

    @Test
    void reportsMissingOrMalformedProperties() {
        Properties properties = new Properties();
        properties.setProperty(CombinerConfig.PROP_SIGNERS, "https://a.test");
        properties.setProperty(CombinerConfig.PROP_PUBLIC_KEY, "02aa");
        properties.setProperty(CombinerConfig.PROP_POLYNOMIAL, "02aa");
        properties.setProperty(CombinerConfig.PROP_THRESHOLD, "1");

        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
            () -> CombinerConfig.fromProperties(properties));
        assertEquals("Missing property combiner.keys.version", missing.getMessage());

        properties.setProperty(CombinerConfig.PROP_KEY_VERSION, "one");
        assertThrows(IllegalArgumentException.class, () -> CombinerConfig.fromProperties(properties));
    }
}
