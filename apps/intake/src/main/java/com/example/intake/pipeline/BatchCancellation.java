package com.example.intake.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag for a running batch. Checked between files; a file already in flight
 * completes normally.
 */
public class BatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
