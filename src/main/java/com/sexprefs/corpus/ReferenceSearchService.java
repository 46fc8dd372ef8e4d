package com.sexprefs.corpus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sexprefs.reader.ChildSpanIndexer;
import com.sexprefs.reader.PositionedForm;
import com.sexprefs.reader.SexpReadException;
import com.sexprefs.reader.SexpReader;
import com.sexprefs.reader.Span;
import com.sexprefs.runtime.AppConfig;
import com.sexprefs.search.Classifiers;
import com.sexprefs.search.FormClassifier;
import com.sexprefs.search.FormWalker;
import com.sexprefs.search.MatchResult;
import com.sexprefs.search.ReferenceKind;
import com.sexprefs.sexp.Symbol;

/**
 * Searches a corpus file by file for references to one symbol.
 *
 * <p>Each file's text lives in a {@link SourceBuffer} that is closed before the next file is
 * looked at, whether the file finished normally, failed, or the search was cancelled.
 */
public class ReferenceSearchService {
    private static final Logger log = LoggerFactory.getLogger(ReferenceSearchService.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final AppConfig.SearchConfig config;
    private final SexpReader reader;
    private final Set<AtomicBoolean> runningSearches = ConcurrentHashMap.newKeySet();

    public ReferenceSearchService() {
        this(new AppConfig.SearchConfig());
    }

    public ReferenceSearchService(AppConfig.SearchConfig config) {
        config.validate();
        this.config = config;
        this.reader = new SexpReader();
    }

    /**
     * Asks every search running on this service to stop. Each throws
     * {@link CancellationException} once its open buffers have been released. Searches started
     * afterwards are unaffected; to cancel one that may not have started yet, pass it a token.
     */
    public void requestCancel() {
        for (AtomicBoolean cancelled : runningSearches) {
            cancelled.set(true);
        }
    }

    public SearchReport search(Symbol target, List<? extends SourceFile> files, ReferenceKind kind) {
        return search(target, files, kind, ProgressListener.NONE);
    }

    public SearchReport search(
            Symbol target,
            List<? extends SourceFile> files,
            ReferenceKind kind,
            ProgressListener progressListener) {
        return search(target, files, kind, progressListener, new AtomicBoolean(false));
    }

    /**
     * Searches with a caller-owned cancellation token. Setting the token, before or during the
     * search, stops this search only.
     */
    public SearchReport search(
            Symbol target,
            List<? extends SourceFile> files,
            ReferenceKind kind,
            ProgressListener progressListener,
            AtomicBoolean cancelled) {
        runningSearches.add(cancelled);
        try {
            return runSearch(target, files, kind, progressListener, cancelled);
        } finally {
            runningSearches.remove(cancelled);
        }
    }

    private SearchReport runSearch(
            Symbol target,
            List<? extends SourceFile> files,
            ReferenceKind kind,
            ProgressListener progressListener,
            AtomicBoolean cancelled) {
        long start = System.nanoTime();
        log.info("search.start symbol={} kind={} files={} parallelism={}",
                target, kind, files.size(), config.getParallelism());

        FormClassifier classifier = Classifiers.forKind(kind);
        List<FileOutcome> outcomes = config.getParallelism() > 1 && files.size() > 1
                ? searchParallel(target, files, kind, classifier, progressListener, cancelled)
                : searchSequential(target, files, kind, classifier, progressListener, cancelled);
        progressListener.onProgress(files.size(), files.size());

        Map<Path, List<MatchResult>> matchesByFile = new LinkedHashMap<>();
        List<Path> skipped = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            FileOutcome outcome = outcomes.get(i);
            Path path = files.get(i).path();
            if (outcome.skipped()) {
                skipped.add(path);
            } else if (!outcome.matches().isEmpty()) {
                matchesByFile.put(path, outcome.matches());
            }
        }

        SearchReport report = new SearchReport(target.name(), kind, matchesByFile, files.size(), skipped);
        log.info("search.finished symbol={} kind={} files={} matchingFiles={} matches={} skipped={} elapsedMs={}",
                target,
                kind,
                report.filesSearched(),
                report.matchingFiles(),
                report.totalMatches(),
                skipped.size(),
                (System.nanoTime() - start) / 1_000_000);
        return report;
    }

    private List<FileOutcome> searchSequential(
            Symbol target,
            List<? extends SourceFile> files,
            ReferenceKind kind,
            FormClassifier classifier,
            ProgressListener progressListener,
            AtomicBoolean cancelled) {
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        for (SourceFile file : files) {
            checkCancelled(cancelled);
            outcomes.add(searchFile(target, file, kind, classifier, cancelled));
            reportProgress(outcomes.size(), files.size(), progressListener);
        }
        return outcomes;
    }

    private List<FileOutcome> searchParallel(
            Symbol target,
            List<? extends SourceFile> files,
            ReferenceKind kind,
            FormClassifier classifier,
            ProgressListener progressListener,
            AtomicBoolean cancelled) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.getParallelism(), files.size()));
        AtomicInteger processed = new AtomicInteger();
        Object progressLock = new Object();
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            for (SourceFile file : files) {
                futures.add(executor.submit(() -> {
                    checkCancelled(cancelled);
                    FileOutcome outcome = searchFile(target, file, kind, classifier, cancelled);
                    synchronized (progressLock) {
                        reportProgress(processed.incrementAndGet(), files.size(), progressListener);
                    }
                    return outcome;
                }));
            }
            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (Future<FileOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (ExecutionException e) {
            cancelled.set(true);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Search worker failed", cause);
        } catch (InterruptedException e) {
            cancelled.set(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("search interrupted");
        } finally {
            executor.shutdownNow();
            awaitTermination(executor);
        }
    }

    private FileOutcome searchFile(
            Symbol target,
            SourceFile file,
            ReferenceKind kind,
            FormClassifier classifier,
            AtomicBoolean cancelled) {
        try (SourceBuffer buffer = file.open()) {
            String text = buffer.text();
            List<PositionedForm> forms;
            try {
                forms = reader.readAll(text);
            } catch (SexpReadException e) {
                if (!config.isSkipMalformedFiles()) {
                    throw new SearchAbortedException(file.path(), e);
                }
                log.warn("search.file.skipped path={} offset={} reason={}", file.path(), e.getOffset(), e.getMessage());
                return FileOutcome.SKIPPED;
            }

            FormWalker walker = new FormWalker(new ChildSpanIndexer(text, reader));
            List<MatchResult> matches = new ArrayList<>();
            for (PositionedForm form : forms) {
                checkCancelled(cancelled);
                if (!form.mentions(target)) {
                    continue;
                }
                if (!kind.isStructural()) {
                    for (Span span : form.writtenSpans(target)) {
                        matches.add(new MatchResult(span, target));
                    }
                } else {
                    matches.addAll(walker.walk(form, target, classifier));
                }
            }
            log.debug("search.file path={} forms={} matches={}", file.path(), forms.size(), matches.size());
            return new FileOutcome(matches, false);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + file.path(), e);
        }
    }

    private static void checkCancelled(AtomicBoolean cancelled) {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("search cancelled");
        }
    }

    private void reportProgress(int processed, int total, ProgressListener progressListener) {
        // The completion notice is sent once by search() itself.
        if (processed % config.getProgressInterval() == 0 && processed < total) {
            progressListener.onProgress(processed, total);
        }
    }

    private static void awaitTermination(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("search.workers.still-running afterSeconds={}", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record FileOutcome(List<MatchResult> matches, boolean skipped) {
        private static final FileOutcome SKIPPED = new FileOutcome(List.of(), true);
    }
}
