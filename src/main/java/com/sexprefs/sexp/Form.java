package com.sexprefs.sexp;

/**
 * A value produced by the reader: an atom ({@link Symbol}, {@link NumberAtom}, {@link StringAtom},
 * {@link CharAtom}) or a compound ({@link ListForm}, {@link VectorForm}).
 */
public interface Form {

    default boolean isAtom() {
        return true;
    }
}
