package cloud.signet.combiner;

import java.util.Objects;

/**
 * A signer node taking part in the distributed key.
 *
 * @param url   base URL of the signer service, without trailing slash.
 * @param index 1-based position of the signer's share within the key's share set.
 */
public record SignerEndpoint(String url, int index) {

    public SignerEndpoint {
        Objects.requireNonNull(url, "url");
        if (index < 1) {
            throw new IllegalArgumentException("signer index must be positive: " + index);
        }
    }

    @Override
    public String toString() {
        return url + "#" + index;
    }
}
