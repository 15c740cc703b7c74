package com.example.intake.pipeline;

@FunctionalInterface
public interface BatchProgressListener {

    void onProgress(BatchProgress progress);

    static BatchProgressListener noop() {
        return progress -> { };
    }
}
