package cloud.signet.combiner.fanout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;

/**
 * One-way abort signal shared by every call of a fan-out. Firing it is idempotent; calls registered after it fired
 * are cancelled on registration.
 */
public final class CancellationToken {

    private final Object lock = new Object();
    private final List<Future<?>> registrations = new ArrayList<>();
    private boolean cancelled;

    public void register(Future<?> call) {
        synchronized (lock) {
            if (!cancelled) {
                registrations.add(call);
                return;
            }
        }
        call.cancel(true);
    }

    /**
     * Cancels every registered call that has not completed yet. Cancellation callbacks run on the calling thread,
     * outside the token's lock.
     *
     * @return {@code true} for the call that fired the token, {@code false} if it had already fired.
     */
    public boolean cancel() {
        List<Future<?>> pending;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            pending = new ArrayList<>(registrations);
            registrations.clear();
        }
        for (Future<?> call : pending) {
            call.cancel(true);
        }
        return true;
    }

    public boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }
}
