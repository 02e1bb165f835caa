package cloud.signet.combiner.fanout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The outbound request sent identically to every signer.
 *
 * @param path    path appended to each signer's base URL.
 * @param body    JSON body.
 * @param headers protocol headers such as the key version; values may be {@code null} to omit the header.
 */
public record SignerCall(String path, byte[] body, Map<String, String> headers) {

    public SignerCall {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(body, "body");
        body = body.clone();
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    @Override
    public byte[] body() {
        return body.clone();
    }
}
