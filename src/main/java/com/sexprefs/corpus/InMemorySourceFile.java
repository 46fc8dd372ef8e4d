package com.sexprefs.corpus;

import java.nio.file.Path;
import java.util.Objects;

record InMemorySourceFile(Path path, String text) implements SourceFile {

    InMemorySourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(text, "text");
    }

    @Override
    public SourceBuffer open() {
        return new SourceBuffer(path, text);
    }
}
