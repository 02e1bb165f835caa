package cloud.signet.combiner.fanout;

import cloud.signet.combiner.SignerEndpoint;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes the outcome of individual signer calls to a {@link FanoutListener}.
 */
public final class FanoutDelivery {

    private static final Logger LOGGER = Logger.getLogger(FanoutDelivery.class.getName());

    private FanoutDelivery() {
    }

    /**
     * Registers {@code call} with {@code token} and forwards its outcome to {@code listener}.
     *
     * @return a future completing after the listener callback returned.
     */
    public static CompletableFuture<Void> deliver(SignerEndpoint signer, CompletableFuture<SignerResponse> call,
                                                  CancellationToken token, FanoutListener listener) {
        CompletableFuture<Void> delivered = call.handle((response, error) -> {
            try {
                if (error == null) {
                    listener.onResponse(response);
                    return null;
                }
                Throwable cause = unwrap(error);
                if (cause instanceof CancellationException) {
                    listener.onCancelled(signer);
                } else {
                    listener.onFailure(signer, cause);
                }
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "[combiner] listener failed handling outcome of " + signer, ex);
            }
            return null;
        });
        token.register(call);
        return delivered;
    }

    /**
     * @return a future completing once every delivery in {@code deliveries} has completed.
     */
    public static CompletableFuture<Void> concluded(List<CompletableFuture<Void>> deliveries) {
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture<?>[0]));
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
