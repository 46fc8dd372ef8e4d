package com.sexprefs.corpus;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A file of the search corpus. Its text is only held while a {@link SourceBuffer} returned by
 * {@link #open()} is open.
 */
public interface SourceFile {

    Path path();

    SourceBuffer open() throws IOException;

    static SourceFile inMemory(Path path, String text) {
        return new InMemorySourceFile(path, text);
    }

    static SourceFile onDisk(Path path) {
        return new DiskSourceFile(path);
    }
}
