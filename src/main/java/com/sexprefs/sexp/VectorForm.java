package com.sexprefs.sexp;

import java.util.List;
import java.util.stream.Collectors;

public record VectorForm(List<Form> elements) implements Form {

    public VectorForm {
        elements = List.copyOf(elements);
    }

    @Override
    public boolean isAtom() {
        return false;
    }

    @Override
    public String toString() {
        return elements.stream().map(String::valueOf).collect(Collectors.joining(" ", "[", "]"));
    }
}
