package com.sexprefs.sexp;

public record NumberAtom(Number value) implements Form {

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
