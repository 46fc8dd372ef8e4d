package com.sexprefs.corpus;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (processed, total) -> {
    };

    void onProgress(int processedFiles, int totalFiles);
}
