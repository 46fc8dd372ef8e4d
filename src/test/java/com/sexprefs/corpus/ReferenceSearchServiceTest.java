package com.sexprefs.corpus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.sexprefs.reader.SexpReadException;
import com.sexprefs.reader.Span;
import com.sexprefs.runtime.AppConfig;
import com.sexprefs.search.MatchResult;
import com.sexprefs.search.ReferenceKind;
import com.sexprefs.sexp.Symbol;

class ReferenceSearchServiceTest {

    private static final Symbol FOO = Symbol.intern("foo");

    @Test
    void shouldReportEveryLiteralOccurrenceInSymbolMode() {
        SourceFile file = SourceFile.inMemory(Path.of("a.el"), "(foo (bar foo) foo)");

        SearchReport report = new ReferenceSearchService().search(FOO, List.of(file), ReferenceKind.SYMBOL);

        List<Integer> starts = report.matchesIn(Path.of("a.el")).stream().map(match -> match.span().start()).toList();
        assertEquals(List.of(1, 10, 15), starts);
        assertEquals(3, report.totalMatches());
    }

    @Test
    void shouldReportOnlyWrittenSymbolsNotQuotePrefixes() {
        SourceFile file = SourceFile.inMemory(Path.of("q.el"), "'a (quote b) #'c");

        SearchReport quotes = new ReferenceSearchService().search(Symbol.QUOTE, List.of(file), ReferenceKind.SYMBOL);
        SearchReport functions = new ReferenceSearchService().search(Symbol.FUNCTION, List.of(file), ReferenceKind.SYMBOL);

        assertEquals(List.of(new Span(4, 9)),
                quotes.matchesIn(Path.of("q.el")).stream().map(MatchResult::span).toList());
        assertEquals(0, functions.totalMatches());
    }

    @Test
    void shouldSearchPastStringsHoldingCharactersOutsideUnicode() {
        AppConfig.SearchConfig config = new AppConfig.SearchConfig();
        config.setSkipMalformedFiles(true);
        List<SourceFile> files = List.of(
                SourceFile.inMemory(Path.of("a.el"), "(foo \"\\x3fff80\")"),
                SourceFile.inMemory(Path.of("b.el"), "(foo \"\\x110000\") (foo 1)"));

        SearchReport report = new ReferenceSearchService(config).search(FOO, files, ReferenceKind.FUNCTION);

        assertTrue(report.skippedFiles().isEmpty());
        assertEquals(List.of(Path.of("a.el"), Path.of("b.el")), new ArrayList<>(report.matchesByFile().keySet()));
        assertEquals(3, report.totalMatches());
    }

    @Test
    void shouldKeepCorpusOrderAndOmitFilesWithoutMatches() {
        List<SourceFile> files = List.of(
                SourceFile.inMemory(Path.of("c.el"), "(foo 1)"),
                SourceFile.inMemory(Path.of("b.el"), "(bar 1)"),
                SourceFile.inMemory(Path.of("a.el"), "(defun x () (foo 2) (foo 3))"));

        SearchReport report = new ReferenceSearchService().search(FOO, files, ReferenceKind.FUNCTION);

        assertEquals(List.of(Path.of("c.el"), Path.of("a.el")), new ArrayList<>(report.matchesByFile().keySet()));
        assertEquals(3, report.filesSearched());
        assertEquals(2, report.matchingFiles());
        assertEquals(3, report.totalMatches());
        assertEquals(new Span(12, 19), report.matchesIn(Path.of("a.el")).get(0).span());
        assertTrue(report.matchesIn(Path.of("b.el")).isEmpty());
    }

    @Test
    void shouldReportProgressAtTheConfiguredIntervalAndOnceAtTheEnd() {
        AppConfig.SearchConfig config = new AppConfig.SearchConfig();
        config.setProgressInterval(2);
        List<String> events = new ArrayList<>();

        new ReferenceSearchService(config).search(FOO, files(5), ReferenceKind.FUNCTION,
                (processed, total) -> events.add(processed + "/" + total));

        assertEquals(List.of("2/5", "4/5", "5/5"), events);
    }

    @Test
    void shouldSendOnlyTheCompletionNoticeForSmallCorpora() {
        List<String> events = new ArrayList<>();

        new ReferenceSearchService().search(FOO, files(3), ReferenceKind.FUNCTION,
                (processed, total) -> events.add(processed + "/" + total));

        assertEquals(List.of("3/3"), events);
    }

    @Test
    void shouldAbortTheWholeSearchOnMalformedInput() {
        List<SourceFile> files = List.of(
                SourceFile.inMemory(Path.of("good.el"), "(foo)"),
                SourceFile.inMemory(Path.of("bad.el"), "(foo))"),
                SourceFile.inMemory(Path.of("later.el"), "(foo)"));

        SearchAbortedException ex = assertThrows(SearchAbortedException.class,
                () -> new ReferenceSearchService().search(FOO, files, ReferenceKind.FUNCTION));

        assertEquals(Path.of("bad.el"), ex.getPath());
        assertEquals(5, ex.getOffset());
        assertEquals("search aborted: malformed input in bad.el at offset 5", ex.getMessage());
        assertInstanceOf(SexpReadException.class, ex.getCause());
    }

    @Test
    void shouldSkipMalformedFilesWhenConfigured() {
        AppConfig.SearchConfig config = new AppConfig.SearchConfig();
        config.setSkipMalformedFiles(true);
        List<SourceFile> files = List.of(
                SourceFile.inMemory(Path.of("good.el"), "(foo)"),
                SourceFile.inMemory(Path.of("bad.el"), "(foo))"),
                SourceFile.inMemory(Path.of("later.el"), "(foo)"));

        SearchReport report = new ReferenceSearchService(config).search(FOO, files, ReferenceKind.FUNCTION);

        assertEquals(List.of(Path.of("bad.el")), report.skippedFiles());
        assertEquals(List.of(Path.of("good.el"), Path.of("later.el")), new ArrayList<>(report.matchesByFile().keySet()));
        assertEquals(3, report.filesSearched());
    }

    @Test
    void shouldNotFailOnTruncatedInput() {
        SourceFile file = SourceFile.inMemory(Path.of("cut.el"), "(foo 1)\n(foo (bar");

        SearchReport report = new ReferenceSearchService().search(FOO, List.of(file), ReferenceKind.FUNCTION);

        assertEquals(1, report.totalMatches());
    }

    @Test
    void shouldReleaseEveryBufferWhenCancelled() {
        AppConfig.SearchConfig config = new AppConfig.SearchConfig();
        config.setProgressInterval(1);
        TrackingFiles tracking = new TrackingFiles(6);
        ReferenceSearchService service = new ReferenceSearchService(config);

        assertThrows(CancellationException.class, () -> service.search(FOO, tracking.files, ReferenceKind.FUNCTION,
                (processed, total) -> service.requestCancel()));

        assertEquals(1, tracking.opened.get());
        assertEquals(tracking.opened.get(), tracking.closed.get());
    }

    @Test
    void shouldHonourACancellationTokenSetBeforeTheSearchStarts() {
        TrackingFiles tracking = new TrackingFiles(3);
        AtomicBoolean cancelled = new AtomicBoolean(true);

        assertThrows(CancellationException.class, () -> new ReferenceSearchService().search(
                FOO, tracking.files, ReferenceKind.FUNCTION, ProgressListener.NONE, cancelled));

        assertEquals(0, tracking.opened.get());
    }

    @Test
    void shouldNotCarryACancelRequestIntoTheNextSearch() {
        AppConfig.SearchConfig config = new AppConfig.SearchConfig();
        config.setProgressInterval(1);
        ReferenceSearchService service = new ReferenceSearchService(config);

        assertThrows(CancellationException.class, () -> service.search(FOO, files(4), ReferenceKind.FUNCTION,
                (processed, total) -> service.requestCancel()));
        service.requestCancel();
        SearchReport report = service.search(FOO, files(4), ReferenceKind.FUNCTION);

        assertEquals(4, report.filesSearched());
        assertEquals(3, report.matchingFiles());
    }

    @Test
    void shouldCancelOnlyTheSearchWhoseTokenIsSet() {
        AppConfig.SearchConfig config = new AppConfig.SearchConfig();
        config.setProgressInterval(1);
        ReferenceSearchService service = new ReferenceSearchService(config);
        AtomicBoolean outer = new AtomicBoolean(false);
        List<SearchReport> inner = new ArrayList<>();

        assertThrows(CancellationException.class, () -> service.search(FOO, files(3), ReferenceKind.FUNCTION,
                (processed, total) -> {
                    if (inner.isEmpty()) {
                        inner.add(service.search(FOO, files(2), ReferenceKind.FUNCTION));
                        outer.set(true);
                    }
                },
                outer));

        assertEquals(1, inner.size());
        assertEquals(2, inner.get(0).matchingFiles());
    }

    @Test
    void shouldReleaseEveryBufferWhenAFileFails() {
        TrackingFiles tracking = new TrackingFiles(2);
        List<SourceFile> files = new ArrayList<>(tracking.files);
        files.add(SourceFile.inMemory(Path.of("broken.el"), "]"));

        assertThrows(SearchAbortedException.class,
                () -> new ReferenceSearchService().search(FOO, files, ReferenceKind.FUNCTION));

        assertEquals(2, tracking.opened.get());
        assertEquals(2, tracking.closed.get());
    }

    @Test
    void shouldWrapReadFailuresAsUncheckedIoExceptions() {
        SourceFile unreadable = new SourceFile() {
            @Override
            public Path path() {
                return Path.of("gone.el");
            }

            @Override
            public SourceBuffer open() throws IOException {
                throw new IOException("disk gone");
            }
        };

        UncheckedIOException ex = assertThrows(UncheckedIOException.class,
                () -> new ReferenceSearchService().search(FOO, List.of(unreadable), ReferenceKind.FUNCTION));

        assertEquals("disk gone", ex.getCause().getMessage());
    }

    @Test
    void shouldFindTheSameMatchesInParallel() {
        AppConfig.SearchConfig parallel = new AppConfig.SearchConfig();
        parallel.setParallelism(4);
        parallel.setProgressInterval(3);
        List<SourceFile> files = files(25);
        AtomicInteger progressCalls = new AtomicInteger();

        SearchReport sequential = new ReferenceSearchService().search(FOO, files, ReferenceKind.FUNCTION);
        SearchReport concurrent = new ReferenceSearchService(parallel).search(FOO, files, ReferenceKind.FUNCTION,
                (processed, total) -> progressCalls.incrementAndGet());

        assertEquals(new ArrayList<>(sequential.matchesByFile().keySet()), new ArrayList<>(concurrent.matchesByFile().keySet()));
        assertEquals(sequential.matchesByFile(), concurrent.matchesByFile());
        assertEquals(9, progressCalls.get());
    }

    @Test
    void shouldAbortParallelSearchesWithTheReaderFailure() {
        AppConfig.SearchConfig parallel = new AppConfig.SearchConfig();
        parallel.setParallelism(3);
        List<SourceFile> files = new ArrayList<>(files(4));
        files.add(2, SourceFile.inMemory(Path.of("bad.el"), "(foo ]"));

        SearchAbortedException ex = assertThrows(SearchAbortedException.class,
                () -> new ReferenceSearchService(parallel).search(FOO, files, ReferenceKind.FUNCTION));

        assertEquals(Path.of("bad.el"), ex.getPath());
    }

    @Test
    void shouldBeDeterministic() {
        List<SourceFile> files = files(4);
        ReferenceSearchService service = new ReferenceSearchService();

        List<MatchResult> first = service.search(FOO, files, ReferenceKind.FUNCTION).matchesIn(Path.of("f1.el"));
        List<MatchResult> second = service.search(FOO, files, ReferenceKind.FUNCTION).matchesIn(Path.of("f1.el"));

        assertEquals(first, second);
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        AppConfig.SearchConfig config = new AppConfig.SearchConfig();
        config.setParallelism(0);

        assertThrows(IllegalArgumentException.class, () -> new ReferenceSearchService(config));
    }

    // Every third file has no match.
    private static List<SourceFile> files(int count) {
        List<SourceFile> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String text = i % 3 == 2 ? "(bar " + i + ")" : "(defun f" + i + " () (foo " + i + "))\n(foo)";
            files.add(SourceFile.inMemory(Path.of("f" + i + ".el"), text));
        }
        return files;
    }

    private static final class TrackingFiles {
        private final AtomicInteger opened = new AtomicInteger();
        private final AtomicInteger closed = new AtomicInteger();
        private final List<SourceFile> files = new ArrayList<>();

        private TrackingFiles(int count) {
            for (int i = 0; i < count; i++) {
                Path path = Path.of("tracked" + i + ".el");
                files.add(new SourceFile() {
                    @Override
                    public Path path() {
                        return path;
                    }

                    @Override
                    public SourceBuffer open() {
                        opened.incrementAndGet();
                        return new SourceBuffer(path, "(foo " + path.getFileName() + ")", closed::incrementAndGet);
                    }
                });
            }
        }
    }
}
