package cloud.signet.combiner.fanout;

import cloud.signet.combiner.CombinerConfig;
import cloud.signet.combiner.SignerEndpoint;
import cloud.signet.combiner.internal.HttpUtil;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * {@link SignerFanout} over the JDK {@link HttpClient}. Cancelling the future returned by
 * {@link HttpClient#sendAsync} aborts the underlying exchange, so both the raw exchange and the mapped response are
 * registered with the token.
 */
public final class HttpSignerFanout implements SignerFanout {

    private static final Logger LOGGER = Logger.getLogger(HttpSignerFanout.class.getName());

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpSignerFanout(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CompletableFuture<Void> dispatch(SignerCall call, List<SignerEndpoint> signers, CancellationToken token,
                                            FanoutListener listener) {
        List<CompletableFuture<Void>> deliveries = new ArrayList<>(signers.size());
        for (SignerEndpoint signer : signers) {
            HttpRequest request = HttpUtil.jsonPost(signer.url() + call.path(), call.body(), call.headers(), requestTimeout);
            LOGGER.fine(() -> String.format(Locale.ROOT, "[combiner] dispatching %s to %s", call.path(), signer));

            CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
            token.register(exchange);

            CompletableFuture<SignerResponse> response = exchange.thenApply(res -> new SignerResponse(
                signer,
                res.statusCode(),
                res.headers().firstValue(CombinerConfig.KEY_VERSION_HEADER).orElse(null),
                res.body()
            ));
            deliveries.add(FanoutDelivery.deliver(signer, response, token, listener));
        }
        return FanoutDelivery.concluded(deliveries);
    }
}
