package cloud.signet.combiner;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable configuration container used to bootstrap {@link QuorumCombiner} and the HTTP server.
 */
public final class CombinerConfig {

    public static final String KEY_VERSION_HEADER = "Key-Version";
    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final Duration DEFAULT_SIGNER_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final String DEFAULT_VERSION = "1.0.0";
    public static final int DEFAULT_PORT = 8080;

    static final String PROP_SIGNERS = "combiner.signers";
    static final String PROP_THRESHOLD = "combiner.threshold";
    static final String PROP_KEY_VERSION = "combiner.keys.version";
    static final String PROP_PUBLIC_KEY = "combiner.keys.publicKey";
    static final String PROP_POLYNOMIAL = "combiner.keys.polynomial";
    static final String PROP_SIGNER_TIMEOUT = "combiner.signerTimeoutMillis";
    static final String PROP_VERSION = "combiner.version";
    static final String PROP_PORT = "combiner.port";

    private final List<String> signerUrls;
    private final List<SignerEndpoint> signers;
    private final Integer threshold;
    private final KeyEpoch keys;
    private final HttpClient httpClient;
    private final Duration signerTimeout;
    private final String version;
    private final Integer port;

    private CombinerConfig(Builder builder) {
        this.signerUrls = builder.signerUrls == null ? null : new ArrayList<>(builder.signerUrls);
        this.signers = builder.signers;
        this.threshold = builder.threshold;
        this.keys = builder.keys;
        this.httpClient = builder.httpClient;
        this.signerTimeout = builder.signerTimeout;
        this.version = builder.version;
        this.port = builder.port;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from {@code combiner.*} properties.
     *
     * @throws IllegalArgumentException when a required property is missing or malformed.
     */
    public static CombinerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        String signers = required(properties, PROP_SIGNERS);
        KeyEpoch keys = new KeyEpoch(
            required(properties, PROP_PUBLIC_KEY),
            parseInt(properties, PROP_KEY_VERSION, null),
            required(properties, PROP_POLYNOMIAL)
        );

        Builder builder = builder()
            .signers(Arrays.asList(signers.split(",")))
            .threshold(parseInt(properties, PROP_THRESHOLD, null))
            .keys(keys)
            .version(properties.getProperty(PROP_VERSION));

        String timeout = properties.getProperty(PROP_SIGNER_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            builder.signerTimeout(Duration.ofMillis(parseInt(properties, PROP_SIGNER_TIMEOUT, null)));
        }
        String port = properties.getProperty(PROP_PORT);
        if (port != null && !port.isBlank()) {
            builder.port(parseInt(properties, PROP_PORT, null));
        }
        return builder.build();
    }

    public CombinerConfig withDefaults() {
        if (keys == null) {
            throw new IllegalArgumentException("Keys are required");
        }

        List<SignerEndpoint> resolvedSigners = new ArrayList<>();
        if (signerUrls != null) {
            for (String url : signerUrls) {
                String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
                if (trimmed.isEmpty()) {
                    continue;
                }
                resolvedSigners.add(new SignerEndpoint(sanitizeUrl(trimmed), resolvedSigners.size() + 1));
            }
        }
        if (resolvedSigners.isEmpty()) {
            throw new IllegalArgumentException("At least one signer is required");
        }
        long distinct = resolvedSigners.stream().map(SignerEndpoint::url).distinct().count();
        if (distinct != resolvedSigners.size()) {
            throw new IllegalArgumentException("Signer URLs must be unique");
        }

        if (threshold == null) {
            throw new IllegalArgumentException("Threshold is required");
        }
        if (threshold < 1 || threshold > resolvedSigners.size()) {
            throw new IllegalArgumentException(
                "Threshold must be between 1 and the number of signers (" + resolvedSigners.size() + ")");
        }

        Duration resolvedTimeout = Optional.ofNullable(signerTimeout).orElse(DEFAULT_SIGNER_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_SIGNER_TIMEOUT;
        }

        String resolvedVersion = Optional.ofNullable(version)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_VERSION);

        int resolvedPort = Optional.ofNullable(port).orElse(DEFAULT_PORT);
        if (resolvedPort < 0 || resolvedPort > 65535) {
            throw new IllegalArgumentException("Port out of range: " + resolvedPort);
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .build();
        }

        Builder builder = new Builder()
            .threshold(threshold)
            .keys(keys)
            .httpClient(resolvedClient)
            .signerTimeout(resolvedTimeout)
            .version(resolvedVersion)
            .port(resolvedPort);
        builder.signerUrls = resolvedSigners.stream().map(SignerEndpoint::url).toList();
        builder.signers = Collections.unmodifiableList(resolvedSigners);
        return builder.buildInternal();
    }

    private static String sanitizeUrl(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("Signer URL must include scheme and host: " + url);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid signer URL: " + url, ex);
        }
        if (url.endsWith("/")) {
            return url.substring(0, url.length() - 1);
        }
        return url;
    }

    private static String required(Properties properties, String name) {
        String value = properties.getProperty(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing property " + name);
        }
        return value.trim();
    }

    private static Integer parseInt(Properties properties, String name, Integer fallback) {
        String value = properties.getProperty(name);
        if (value == null || value.isBlank()) {
            if (fallback == null) {
                throw new IllegalArgumentException("Missing property " + name);
            }
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Property " + name + " must be an integer", ex);
        }
    }

    /**
     * @return signers in share-index order; empty until {@link #withDefaults()} resolved them.
     */
    public List<SignerEndpoint> getSigners() {
        return signers == null ? List.of() : signers;
    }

    public int getThreshold() {
        return threshold;
    }

    public KeyEpoch getKeys() {
        return keys;
    }

    public int getKeyVersion() {
        return keys.keyVersion();
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getSignerTimeout() {
        return signerTimeout;
    }

    public String getVersion() {
        return version;
    }

    public int getPort() {
        return port;
    }

    public static final class Builder {
        private List<String> signerUrls;
        private List<SignerEndpoint> signers;
        private Integer threshold;
        private KeyEpoch keys;
        private HttpClient httpClient;
        private Duration signerTimeout;
        private String version;
        private Integer port;

        private Builder() {
        }

        /**
         * Signer base URLs. List position defines each signer's share index, starting at 1.
         */
        public Builder signers(List<String> signerUrls) {
            this.signerUrls = signerUrls == null ? null : new ArrayList<>(signerUrls);
            return this;
        }

        public Builder threshold(Integer threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder keys(KeyEpoch keys) {
            this.keys = keys;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder signerTimeout(Duration signerTimeout) {
            this.signerTimeout = signerTimeout;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public CombinerConfig build() {
            return new CombinerConfig(this).withDefaults();
        }

        private CombinerConfig buildInternal() {
            return new CombinerConfig(this);
        }
    }
}
