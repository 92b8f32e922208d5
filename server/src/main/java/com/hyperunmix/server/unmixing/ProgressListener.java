package com.hyperunmix.server.unmixing;

public interface ProgressListener {

    ProgressListener NONE = (completed, total) -> {
    };

    void onProgress(int completed, int total);
}
