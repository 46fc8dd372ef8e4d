package com.sexprefs.reader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ChildSpanIndexerTest {

    @Test
    void shouldIndexListChildrenOfEveryKind() {
        String text = "(foo (bar baz) \"s\" ?c)";

        List<Span> children = new ChildSpanIndexer(text).childSpans(new Span(0, text.length()));

        assertEquals(List.of(new Span(1, 4), new Span(5, 14), new Span(15, 18), new Span(19, 21)), children);
    }

    @Test
    void shouldSkipCommentsBetweenChildren() {
        String text = "(a ; note\n b)";

        List<Span> children = new ChildSpanIndexer(text).childSpans(new Span(0, text.length()));

        assertEquals(List.of(new Span(1, 2), new Span(11, 12)), children);
    }

    @Test
    void shouldTreatQuotePrefixAsTheFirstChild() {
        ChildSpanIndexer quote = new ChildSpanIndexer("'(a b)");
        ChildSpanIndexer function = new ChildSpanIndexer("#'foo");
        ChildSpanIndexer splice = new ChildSpanIndexer(",@xs");

        assertEquals(List.of(new Span(0, 1), new Span(1, 6)), quote.childSpans(new Span(0, 6)));
        assertEquals(List.of(new Span(0, 2), new Span(2, 5)), function.childSpans(new Span(0, 5)));
        assertEquals(List.of(new Span(0, 2), new Span(2, 4)), splice.childSpans(new Span(0, 4)));
    }

    @Test
    void shouldFollowDottedTailsTheWayTheReaderNormalizesThem() {
        String joined = "(a . (b c))";
        String pair = "(a . b)";

        assertEquals(
                List.of(new Span(1, 2), new Span(6, 7), new Span(8, 9)),
                new ChildSpanIndexer(joined).childSpans(new Span(0, joined.length())));
        assertEquals(List.of(new Span(1, 2)), new ChildSpanIndexer(pair).childSpans(new Span(0, pair.length())));
    }

    @Test
    void shouldSpliceQuotedDottedTailsTheWayTheReaderDoes() {
        String quoted = "(a . 'b)";
        String function = "(a . #'f)";
        String vector = "(a . [x])";

        assertEquals(
                List.of(new Span(1, 2), new Span(5, 6), new Span(6, 7)),
                new ChildSpanIndexer(quoted).childSpans(new Span(0, quoted.length())));
        assertEquals(
                List.of(new Span(1, 2), new Span(5, 7), new Span(7, 8)),
                new ChildSpanIndexer(function).childSpans(new Span(0, function.length())));
        assertEquals(List.of(new Span(1, 2)), new ChildSpanIndexer(vector).childSpans(new Span(0, vector.length())));
    }

    @Test
    void shouldStopBeforeAChildThatReachesTheParentEnd() {
        ChildSpanIndexer indexer = new ChildSpanIndexer("(a b c)");

        assertEquals(List.of(new Span(1, 2)), indexer.childSpans(new Span(0, 4)));
    }

    @Test
    void shouldIndexVectorsRecordsAndLabelledForms() {
        assertEquals(List.of(new Span(1, 2), new Span(3, 4)), new ChildSpanIndexer("[x y]").childSpans(new Span(0, 5)));
        assertEquals(List.of(new Span(3, 4), new Span(5, 6)), new ChildSpanIndexer("#s(r x)").childSpans(new Span(0, 7)));
        assertEquals(List.of(new Span(4, 5), new Span(6, 7)), new ChildSpanIndexer("#1=(a b)").childSpans(new Span(0, 8)));
        assertEquals(List.of(new Span(3, 4), new Span(5, 6)), new ChildSpanIndexer("#^[x y]").childSpans(new Span(0, 7)));
        assertEquals(List.of(new Span(4, 5)), new ChildSpanIndexer("#^^[x]").childSpans(new Span(0, 6)));
        assertTrue(new ChildSpanIndexer("#&3\"a\"").childSpans(new Span(0, 6)).isEmpty());
    }

    @Test
    void shouldReturnNoChildrenForAtoms() {
        assertTrue(new ChildSpanIndexer("foo").childSpans(new Span(0, 3)).isEmpty());
        assertTrue(new ChildSpanIndexer("\"(a)\"").childSpans(new Span(0, 5)).isEmpty());
        assertTrue(new ChildSpanIndexer("()").childSpans(new Span(0, 2)).isEmpty());
    }
}
