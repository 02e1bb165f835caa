package cloud.signet.combiner;

import cloud.signet.combiner.crypto.CombinationUnavailableException;
import cloud.signet.combiner.crypto.PartialSignatureShare;
import cloud.signet.combiner.crypto.ThresholdCryptoModule;
import cloud.signet.combiner.fanout.CancellationToken;
import cloud.signet.combiner.fanout.FanoutListener;
import cloud.signet.combiner.fanout.SignerCall;
import cloud.signet.combiner.fanout.SignerFanout;
import cloud.signet.combiner.fanout.SignerResponse;
import cloud.signet.combiner.protocol.SigningProtocol;
import cloud.signet.combiner.validation.ResponseRecord;
import cloud.signet.combiner.validation.ResponseValidator;
import cloud.signet.combiner.validation.SignerResponseException;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State of one signing request, from fan-out to the client-visible outcome.
 *
 * <p>
 * Every signer event (validate, accumulate, quorum check, cancellation, combination) runs under a single
 * {@link ReentrantLock}, so exactly one delivery can cross the threshold and combination is attempted at most once.
 * The lock is reentrant because firing the cancellation token delivers {@code onCancelled} callbacks on the firing
 * thread. Events arriving after the session left {@link State#COLLECTING} are ignored.
 * </p>
 */
public final class SigningSession {

    private static final Logger LOGGER = Logger.getLogger(SigningSession.class.getName());

    /**
     * Lifecycle of a session. {@code SUCCEEDED} and {@code FALLBACK_FAILED} are terminal.
     */
    public enum State {
        COLLECTING,
        COMBINING,
        SUCCEEDED,
        FALLBACK_FAILED
    }

    private final SigningProtocol protocol;
    private final ResponseValidator validator;
    private final ThresholdCryptoModule crypto;
    private final int signerCount;
    private final String version;

    private final ReentrantLock lock = new ReentrantLock();
    private final CancellationToken token = new CancellationToken();
    private final CompletableFuture<CombinedSignature> outcome = new CompletableFuture<>();
    private final List<ResponseRecord> records = new ArrayList<>();
    private final List<SignerEndpoint> cancelledSigners = new ArrayList<>();
    private State state = State.COLLECTING;
    private int resolved;
    private boolean quorumLost;

    SigningSession(SigningProtocol protocol, ResponseValidator validator, ThresholdCryptoModule crypto, int signerCount,
                   String version) {
        this.protocol = protocol;
        this.validator = validator;
        this.crypto = crypto;
        this.signerCount = signerCount;
        this.version = version;
    }

    void start(SignerFanout fanout, SignerCall call, List<SignerEndpoint> signers) {
        CompletableFuture<Void> concluded = fanout.dispatch(call, signers, token, new Listener());
        concluded.whenComplete((ignored, error) -> onConcluded());
    }

    /**
     * Blocks until the session reaches a terminal state.
     *
     * @return the combined signature.
     * @throws CombinerApiException when quorum was not reached or combination failed; carries the majority-derived
     *                              client error.
     * @throws CombinerException    when the wait was interrupted.
     */
    public CombinedSignature await() throws CombinerException {
        try {
            return outcome.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new CombinerException("signing interrupted", ex);
        } catch (ExecutionException ex) {
            throw unwrap(ex);
        }
    }

    /**
     * @return a future completing with the session's outcome; cancelling it does not affect the session.
     */
    public CompletableFuture<CombinedSignature> outcome() {
        return outcome.copy();
    }

    public State state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return snapshot of every response processed while collecting, in arrival order.
     */
    public List<ResponseRecord> records() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return signers whose calls were still in flight when the fan-out was cancelled.
     */
    public List<SignerEndpoint> cancelledSigners() {
        lock.lock();
        try {
            return List.copyOf(cancelledSigners);
        } finally {
            lock.unlock();
        }
    }

    private void onResponse(SignerResponse response) {
        lock.lock();
        try {
            if (state != State.COLLECTING) {
                LOGGER.fine(() -> "[combiner] ignoring response from " + response.signer() + " in state " + state);
                return;
            }
            resolved++;

            PartialSignatureShare share;
            try {
                share = validator.accept(response, records);
            } catch (SignerResponseException ex) {
                LOGGER.warning(() -> "[combiner] " + ex.getMessage());
                noteIfQuorumUnreachable();
                return;
            }

            addShare(share);
            if (crypto.hasQuorum()) {
                combine();
            } else {
                noteIfQuorumUnreachable();
            }
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(SignerEndpoint signer, Throwable cause) {
        lock.lock();
        try {
            if (state != State.COLLECTING) {
                LOGGER.fine(() -> "[combiner] ignoring failure of " + signer + " in state " + state);
                return;
            }
            resolved++;
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[combiner] signer %s request failed: %s", signer, cause));
            noteIfQuorumUnreachable();
        } finally {
            lock.unlock();
        }
    }

    private void onCancelled(SignerEndpoint signer) {
        lock.lock();
        try {
            cancelledSigners.add(signer);
            if (state == State.COLLECTING) {
                resolved++;
                noteIfQuorumUnreachable();
            }
        } finally {
            lock.unlock();
        }
    }

    private void onConcluded() {
        lock.lock();
        try {
            if (state == State.COLLECTING) {
                LOGGER.info(() -> String.format(Locale.ROOT,
                    "[combiner] fan-out concluded with %d of %d required signatures",
                    crypto.acceptedCount(), crypto.threshold()));
                fail();
            }
        } finally {
            lock.unlock();
        }
    }

    private void addShare(PartialSignatureShare share) {
        LOGGER.info(() -> "[combiner] adding signature from " + share.signer());
        long started = System.nanoTime();
        boolean accepted = crypto.addShare(share);
        long latencyMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        boolean sufficient = crypto.hasQuorum();
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[combiner] signer=%s accepted=%s hasSufficientSignatures=%s additionLatencyMs=%d",
            share.signer(), accepted, sufficient, latencyMillis));
    }

    /**
     * Quorum can no longer be reached, but the verdict still waits for the fan-out to conclude so the majority error
     * is taken over every signer's answer.
     */
    private void noteIfQuorumUnreachable() {
        if (quorumLost) {
            return;
        }
        int pending = signerCount - resolved;
        if (crypto.acceptedCount() + pending < crypto.threshold()) {
            quorumLost = true;
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[combiner] quorum unreachable: %d accepted, %d pending, %d required; awaiting remaining signers",
                crypto.acceptedCount(), pending, crypto.threshold()));
        }
    }

    private void combine() {
        state = State.COMBINING;
        token.cancel();

        byte[] signature;
        try {
            signature = crypto.combine();
        } catch (CombinationUnavailableException ex) {
            LOGGER.log(Level.WARNING, "[combiner] combining partial signatures failed", ex);
            fail();
            return;
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "[combiner] unexpected error combining partial signatures", ex);
            fail();
            return;
        }

        state = State.SUCCEEDED;
        protocol.logDiscrepancies(records);
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[combiner] %s signature combined from %d responses", protocol.name(), records.size()));
        outcome.complete(new CombinedSignature(Base64.getEncoder().encodeToString(signature), version));
    }

    private void fail() {
        state = State.FALLBACK_FAILED;
        token.cancel();
        protocol.logDiscrepancies(records);
        CombinerApiException error = ErrorAggregator.clientError(records);
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[combiner] %s request failed with %d %s", protocol.name(), error.getStatusCode(), error.getCode()));
        outcome.completeExceptionally(error);
    }

    private static CombinerException unwrap(ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof CombinerException combinerException) {
            return combinerException;
        }
        return new CombinerException("signing failed: " + cause, cause);
    }

    private final class Listener implements FanoutListener {

        @Override
        public void onResponse(SignerResponse response) {
            SigningSession.this.onResponse(response);
        }

        @Override
        public void onFailure(SignerEndpoint signer, Throwable cause) {
            SigningSession.this.onFailure(signer, cause);
        }

        @Override
        public void onCancelled(SignerEndpoint signer) {
            SigningSession.this.onCancelled(signer);
        }
    }
}
