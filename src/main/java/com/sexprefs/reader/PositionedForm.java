package com.sexprefs.reader;

import java.util.List;

import com.sexprefs.sexp.Form;
import com.sexprefs.sexp.Symbol;

public record PositionedForm(Form form, Span span, List<SymbolOccurrence> occurrences) {

    public PositionedForm {
        occurrences = List.copyOf(occurrences);
    }

    public boolean mentions(Symbol symbol) {
        for (SymbolOccurrence occurrence : occurrences) {
            if (occurrence.symbol() == symbol) {
                return true;
            }
        }
        return false;
    }

    /**
     * Absolute spans of every occurrence of {@code symbol}, in reading order.
     */
    public List<Span> occurrenceSpans(Symbol symbol) {
        return occurrences.stream()
                .filter(occurrence -> occurrence.symbol() == symbol)
                .map(occurrence -> occurrence.spanFrom(span.start()))
                .toList();
    }

    /**
     * Like {@link #occurrenceSpans(Symbol)} but without quote shorthand prefixes, so every span
     * slices the symbol as written.
     */
    public List<Span> writtenSpans(Symbol symbol) {
        return occurrences.stream()
                .filter(occurrence -> occurrence.symbol() == symbol && !occurrence.shorthand())
                .map(occurrence -> occurrence.spanFrom(span.start()))
                .toList();
    }
}
