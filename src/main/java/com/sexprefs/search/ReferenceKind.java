package com.sexprefs.search;

public enum ReferenceKind {
    FUNCTION,
    MACRO,
    SPECIAL_FORM,
    VARIABLE,
    /**
     * Every literal occurrence of the symbol, read straight from the reader's occurrence table.
     */
    SYMBOL;

    public boolean isStructural() {
        return this != SYMBOL;
    }
}
