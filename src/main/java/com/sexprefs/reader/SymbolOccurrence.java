package com.sexprefs.reader;

import com.sexprefs.sexp.Symbol;

/**
 * A leaf symbol read inside a top-level form. {@code offset} is relative to the start of that
 * form; {@code length} is the number of source characters the symbol was read from, which
 * differs from the name length for escaped names and quote shorthands.
 *
 * <p>{@code shorthand} marks an operator synthesized from a prefix such as {@code '} or
 * {@code #'}. Its span covers the prefix, not a written symbol name.
 */
public record SymbolOccurrence(Symbol symbol, int offset, int length, boolean shorthand) {

    public SymbolOccurrence(Symbol symbol, int offset, int length) {
        this(symbol, offset, length, false);
    }

    public Span spanFrom(int formStart) {
        return new Span(formStart + offset, formStart + offset + length);
    }
}
