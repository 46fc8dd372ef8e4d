package com.sexprefs.search;

import com.sexprefs.sexp.Symbol;

/**
 * One ancestor frame: the operator of the enclosing list ({@code null} when its head is not a
 * symbol) and the index of the current form within it.
 */
public record PathEntry(Symbol operator, int index) {

    public boolean is(Symbol expectedOperator, int expectedIndex) {
        return operator == expectedOperator && index == expectedIndex;
    }
}
