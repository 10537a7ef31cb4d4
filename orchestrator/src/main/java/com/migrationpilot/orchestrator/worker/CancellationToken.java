package com.migrationpilot.orchestrator.worker;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal shared between whoever wants a run stopped
 * (an OS signal, a test) and whoever is doing the work.
 *
 * Listeners are registered for a scope and removed when the returned
 * {@link Registration} is closed, so repeated runs never pile up callbacks.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Flip the token and run every registered listener on the calling thread.
     * Later calls do nothing.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : listeners) {
                listener.run();
            }
        }
    }

    /**
     * Register a callback for as long as the returned registration is open.
     * Runs immediately if the token is already cancelled.
     */
    public Registration onCancel(Runnable listener) {
        // Wrap so two registrations of the same lambda are removed independently.
        Runnable entry = listener::run;
        listeners.add(entry);
        if (cancelled.get() && listeners.remove(entry)) {
            listener.run();
            return () -> {};
        }
        return () -> listeners.remove(entry);
    }

    int listenerCount() {
        return listeners.size();
    }

    /** A scoped subscription; closing it never throws. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
