package io.liarslie.lifecycle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way broadcast shared by an agent's accept loop and its connection handlers.
 * Firing is idempotent; listeners registered after the signal fired run immediately.
 */
public final class ShutdownSignal {
    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public boolean fire() {
        if (!fired.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isFired() {
        return fired.get();
    }

    public void onFire(Runnable listener) {
        listeners.add(listener);
        // Covers a fire() that raced with registration; listeners must tolerate a second call.
        if (fired.get()) {
            listener.run();
        }
    }
}
