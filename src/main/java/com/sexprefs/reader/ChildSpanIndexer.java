package com.sexprefs.reader;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the spans of a form's immediate children from its already-known span.
 *
 * <p>The reader only reports where each top-level form starts and ends. Child spans are
 * recovered by rescanning the parent's text one expression at a time, which the walker does
 * only for the few forms that can still contain the symbol it is looking for.
 */
public class ChildSpanIndexer {
    private final String text;
    private final SexpReader reader;

    public ChildSpanIndexer(String text) {
        this(text, new SexpReader());
    }

    public ChildSpanIndexer(String text, SexpReader reader) {
        this.text = text;
        this.reader = reader;
    }

    public List<Span> childSpans(Span parent) {
        int start = parent.start();
        if (parent.length() == 0 || parent.end() > text.length()) {
            return List.of();
        }
        char first = text.charAt(start);
        char second = start + 1 < parent.end() ? text.charAt(start + 1) : '\0';
        switch (first) {
            case '(':
            case '[':
                return delimitedChildren(start + 1, parent.end());
            case '\'':
            case '`':
                return prefixedChildren(parent, 1);
            case ',':
                return prefixedChildren(parent, second == '@' ? 2 : 1);
            case '#':
                return dispatchChildren(parent, second);
            default:
                return List.of();
        }
    }

    private List<Span> dispatchChildren(Span parent, char dispatch) {
        int start = parent.start();
        if (dispatch == '\'') {
            return prefixedChildren(parent, 2);
        }
        if (dispatch == '[') {
            return delimitedChildren(start + 2, parent.end());
        }
        if (dispatch == 's' && start + 2 < parent.end() && text.charAt(start + 2) == '(') {
            return delimitedChildren(start + 3, parent.end());
        }
        if (dispatch == '^') {
            int open = start + 2;
            if (open < parent.end() && text.charAt(open) == '^') {
                open++;
            }
            return delimitedChildren(open + 1, parent.end());
        }
        if (Character.isDigit(dispatch)) {
            int pos = start + 1;
            while (pos < parent.end() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            if (pos < parent.end() && text.charAt(pos) == '=') {
                Span labelled = reader.scanExpression(text, pos + 1);
                if (labelled != null && labelled.end() <= parent.end()) {
                    return childSpans(labelled);
                }
            }
        }
        return List.of();
    }

    // The prefix stands in for the operator the reader synthesised ('x reads as (quote x)).
    private List<Span> prefixedChildren(Span parent, int prefixLength) {
        int prefixEnd = parent.start() + prefixLength;
        Span quoted = reader.scanExpression(text, prefixEnd);
        if (quoted == null || quoted.end() > parent.end()) {
            return List.of(new Span(parent.start(), prefixEnd));
        }
        return List.of(new Span(parent.start(), prefixEnd), quoted);
    }

    private List<Span> delimitedChildren(int from, int parentEnd) {
        List<Span> children = new ArrayList<>();
        collectDelimited(from, parentEnd, children);
        return children;
    }

    private void collectDelimited(int from, int parentEnd, List<Span> children) {
        int pos = from;
        while (true) {
            pos = SexpReader.skipAtmosphere(text, pos);
            if (pos >= parentEnd) {
                return;
            }
            char ch = text.charAt(pos);
            if (ch == ')' || ch == ']') {
                return;
            }
            if (SexpReader.isDotToken(text, pos)) {
                collectDottedTail(pos + 1, parentEnd, children);
                return;
            }
            Span child = reader.scanExpression(text, pos);
            if (child == null || child.end() >= parentEnd) {
                return;
            }
            children.add(child);
            pos = child.end();
        }
    }

    // Mirrors the reader's normalisation: (a . (b c)) has children a, b and c, (a . 'b) has a,
    // the quote prefix and b, and (a . nil) has a.
    private void collectDottedTail(int from, int parentEnd, List<Span> children) {
        Span tail = reader.scanExpression(text, from);
        if (tail == null || tail.end() >= parentEnd || isVectorSyntax(tail.start())) {
            return;
        }
        children.addAll(childSpans(tail));
    }

    private boolean isVectorSyntax(int pos) {
        char first = text.charAt(pos);
        if (first == '[') {
            return true;
        }
        if (first != '#' || pos + 1 >= text.length()) {
            return false;
        }
        char dispatch = text.charAt(pos + 1);
        return dispatch == '[' || dispatch == 's' || dispatch == '^' || dispatch == '&';
    }
}
