package com.sexprefs.corpus;

import java.nio.file.Path;

/**
 * Scratch copy of one file's text, scoped to a try-with-resources block. Closing drops the text
 * and runs the release hook exactly once.
 */
public class SourceBuffer implements AutoCloseable {
    private final Path path;
    private final Runnable onRelease;
    private String text;

    public SourceBuffer(Path path, String text) {
        this(path, text, () -> {
        });
    }

    public SourceBuffer(Path path, String text, Runnable onRelease) {
        this.path = path;
        this.text = text;
        this.onRelease = onRelease;
    }

    public Path path() {
        return path;
    }

    public String text() {
        if (text == null) {
            throw new IllegalStateException("Source buffer for " + path + " was already released");
        }
        return text;
    }

    public boolean isReleased() {
        return text == null;
    }

    @Override
    public void close() {
        if (text != null) {
            text = null;
            onRelease.run();
        }
    }
}
