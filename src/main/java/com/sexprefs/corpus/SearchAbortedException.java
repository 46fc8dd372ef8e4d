package com.sexprefs.corpus;

import java.nio.file.Path;

import com.sexprefs.reader.SexpReadException;

/**
 * Raised when a corpus file cannot be read as Lisp. Ends the whole search.
 */
public class SearchAbortedException extends RuntimeException {
    private final Path path;
    private final int offset;

    public SearchAbortedException(Path path, SexpReadException cause) {
        super("search aborted: malformed input in " + path + " at offset " + cause.getOffset(), cause);
        this.path = path;
        this.offset = cause.getOffset();
    }

    public Path getPath() {
        return path;
    }

    public int getOffset() {
        return offset;
    }
}
