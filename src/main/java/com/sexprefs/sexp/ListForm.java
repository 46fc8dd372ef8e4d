package com.sexprefs.sexp;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A cons chain. {@code tail} is {@code null} for a proper, nil-terminated list and holds the
 * final cdr of a dotted list otherwise.
 */
public record ListForm(List<Form> elements, Form tail) implements Form {

    public ListForm {
        elements = List.copyOf(elements);
        if (tail != null && elements.isEmpty()) {
            throw new IllegalArgumentException("dotted list needs at least one element before the tail");
        }
    }

    public static ListForm of(Form... elements) {
        return new ListForm(List.of(elements), null);
    }

    public static ListForm dotted(List<Form> elements, Form tail) {
        return new ListForm(elements, tail);
    }

    public boolean isProper() {
        return tail == null;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    public Form get(int index) {
        return elements.get(index);
    }

    /**
     * First element when it is a symbol, which is how the operator of a call is named.
     */
    public Symbol operator() {
        if (!elements.isEmpty() && elements.get(0) instanceof Symbol symbol) {
            return symbol;
        }
        return null;
    }

    @Override
    public boolean isAtom() {
        return false;
    }

    @Override
    public String toString() {
        String body = elements.stream().map(String::valueOf).collect(Collectors.joining(" "));
        return tail == null ? "(" + body + ")" : "(" + body + " . " + tail + ")";
    }
}
