package com.sexprefs.sexp;

/**
 * Character literal. The code point may carry Emacs modifier bits (meta, control, ...)
 * above the Unicode range.
 */
public record CharAtom(int codePoint) implements Form {

    @Override
    public String toString() {
        return "?" + codePoint;
    }
}
