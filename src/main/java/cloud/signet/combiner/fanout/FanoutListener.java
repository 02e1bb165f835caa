package cloud.signet.combiner.fanout;

import cloud.signet.combiner.SignerEndpoint;

/**
 * Receives signer outcomes in arrival order. Callbacks may run concurrently on transport threads, and a callback
 * may run on the thread that fires the {@link CancellationToken}.
 */
public interface FanoutListener {

    /**
     * A signer answered, with any status code.
     */
    void onResponse(SignerResponse response);

    /**
     * The call failed at the transport level (connection error, timeout).
     */
    void onFailure(SignerEndpoint signer, Throwable cause);

    /**
     * The call was aborted by the cancellation token before it completed.
     */
    void onCancelled(SignerEndpoint signer);
}
