package cloud.signet.combiner.fanout;

import cloud.signet.combiner.SignerEndpoint;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Issues one call per signer concurrently and streams the outcomes to a listener.
 */
public interface SignerFanout {

    /**
     * Dispatches {@code call} to every signer. Each call is registered with {@code token} before it starts, so firing
     * the token aborts every call still in flight.
     *
     * @return a future completing once every signer's outcome has been delivered to {@code listener}.
     */
    CompletableFuture<Void> dispatch(SignerCall call, List<SignerEndpoint> signers, CancellationToken token,
                                     FanoutListener listener);
}
