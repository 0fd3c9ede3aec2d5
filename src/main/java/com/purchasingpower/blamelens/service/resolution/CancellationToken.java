package com.purchasingpower.blamelens.service.resolution;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation for one resolution request. Cancelling never aborts the underlying
 * network call; it only tells the engine that nobody is waiting for the answer any more.
 */
public class CancellationToken {

    private final List<Runnable> listeners = new ArrayList<>();
    private boolean cancelled;

    /**
     * A fresh token that nobody else holds, so it is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public synchronized boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * Runs {@code listener} once on cancellation, immediately if already cancelled.
     */
    public void onCancellationRequested(Runnable listener) {
        synchronized (this) {
            if (!cancelled) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }
}
