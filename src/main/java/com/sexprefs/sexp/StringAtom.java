package com.sexprefs.sexp;

public record StringAtom(String value) implements Form {

    @Override
    public String toString() {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
