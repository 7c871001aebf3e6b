package com.adlanda.codeindex.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for an indexing run. The run checks it before each
 * file and periodically while writing chunks.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
