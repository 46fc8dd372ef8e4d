package com.sexprefs.search;

import java.util.ArrayList;
import java.util.List;

import com.sexprefs.reader.ChildSpanIndexer;
import com.sexprefs.reader.PositionedForm;
import com.sexprefs.reader.Span;
import com.sexprefs.sexp.Form;
import com.sexprefs.sexp.ListForm;
import com.sexprefs.sexp.Symbol;

/**
 * Depth-first, left-to-right search for forms a {@link FormClassifier} accepts. A matching form
 * is reported whole and not descended into, so results from one root never overlap.
 */
public class FormWalker {
    private final ChildSpanIndexer indexer;

    public FormWalker(String text) {
        this(new ChildSpanIndexer(text));
    }

    public FormWalker(ChildSpanIndexer indexer) {
        this.indexer = indexer;
    }

    /**
     * Walks a top-level form. Forms whose occurrence table never mentions {@code target} are
     * rejected without looking at the text, and subtrees that contain none of the recorded
     * occurrences are never indexed.
     */
    public List<MatchResult> walk(PositionedForm positioned, Symbol target, FormClassifier classifier) {
        List<Span> occurrences = positioned.occurrenceSpans(target);
        if (occurrences.isEmpty()) {
            return List.of();
        }
        List<MatchResult> matches = new ArrayList<>();
        walk(positioned.form(), positioned.span(), target, classifier, PathContext.EMPTY, occurrences, matches);
        return matches;
    }

    public List<MatchResult> walk(Form form, Span span, Symbol target, FormClassifier classifier, PathContext path) {
        List<MatchResult> matches = new ArrayList<>();
        walk(form, span, target, classifier, path, null, matches);
        return matches;
    }

    private void walk(
            Form form,
            Span span,
            Symbol target,
            FormClassifier classifier,
            PathContext path,
            List<Span> occurrences,
            List<MatchResult> matches) {
        if (classifier.matches(target, form, path)) {
            matches.add(new MatchResult(span, form));
            return;
        }
        // Dotted tails, vectors and atoms are never descended into.
        if (!(form instanceof ListForm list) || !list.isProper() || !hasCandidateChild(list, target)) {
            return;
        }

        List<Span> childSpans = indexer.childSpans(span);
        int count = Math.min(list.size(), childSpans.size());
        Symbol operator = list.operator();
        for (int i = 0; i < count; i++) {
            Form child = list.get(i);
            Span childSpan = childSpans.get(i);
            if (child.isAtom() ? child != target : !containsAny(childSpan, occurrences)) {
                continue;
            }
            walk(child, childSpan, target, classifier, path.push(operator, i), occurrences, matches);
        }
    }

    private static boolean hasCandidateChild(ListForm list, Symbol target) {
        for (Form child : list.elements()) {
            if (!child.isAtom() || child == target) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(Span span, List<Span> occurrences) {
        if (occurrences == null) {
            return true;
        }
        for (Span occurrence : occurrences) {
            if (span.contains(occurrence)) {
                return true;
            }
        }
        return false;
    }
}
