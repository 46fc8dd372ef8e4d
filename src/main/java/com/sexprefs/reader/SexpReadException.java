package com.sexprefs.reader;

public class SexpReadException extends RuntimeException {
    private final int offset;

    public SexpReadException(int offset, String message) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public SexpReadException(int offset, String message, Throwable cause) {
        super(message + " at offset " + offset, cause);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
