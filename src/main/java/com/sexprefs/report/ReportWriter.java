package com.sexprefs.report;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.sexprefs.corpus.SearchReport;
import com.sexprefs.corpus.SourceBuffer;
import com.sexprefs.corpus.SourceFile;
import com.sexprefs.search.MatchResult;

/**
 * Turns a {@link SearchReport} into something people and scripts can read. Matched files are
 * re-opened to slice out the matched text, since the search releases every buffer it used.
 */
public class ReportWriter {
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public List<RenderedFile> render(SearchReport report, List<? extends SourceFile> files) throws IOException {
        Map<Path, SourceFile> byPath = new HashMap<>();
        for (SourceFile file : files) {
            byPath.put(file.path(), file);
        }

        List<RenderedFile> rendered = new ArrayList<>();
        for (Map.Entry<Path, List<MatchResult>> entry : report.matchesByFile().entrySet()) {
            SourceFile file = byPath.get(entry.getKey());
            if (file == null) {
                throw new IllegalArgumentException("Report mentions a file outside the corpus: " + entry.getKey());
            }
            try (SourceBuffer buffer = file.open()) {
                String text = buffer.text();
                LineMap lines = new LineMap(text);
                List<RenderedMatch> matches = new ArrayList<>();
                for (MatchResult match : entry.getValue()) {
                    int start = match.span().start();
                    matches.add(new RenderedMatch(
                            start,
                            match.span().end(),
                            lines.line(start),
                            lines.column(start),
                            match.span().slice(text)));
                }
                rendered.add(new RenderedFile(entry.getKey().toString(), matches));
            }
        }
        return rendered;
    }

    public void writeText(PrintStream out, SearchReport report, List<RenderedFile> rendered) {
        for (RenderedFile file : rendered) {
            for (RenderedMatch match : file.matches()) {
                out.printf("%s:%d:%d: %s%n", file.path(), match.line(), match.column(), firstLine(match.text()));
            }
        }
        out.printf("Found %d references in %d files (searched %d files)%n",
                report.totalMatches(),
                report.matchingFiles(),
                report.filesSearched());
        if (!report.skippedFiles().isEmpty()) {
            out.printf("Skipped %d malformed files: %s%n", report.skippedFiles().size(), report.skippedFiles());
        }
    }

    public void writeJson(Path output, SearchReport report, List<RenderedFile> rendered) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        JsonReport json = new JsonReport(
                report.symbol(),
                report.kind().name().toLowerCase(Locale.ROOT),
                report.filesSearched(),
                report.totalMatches(),
                report.skippedFiles().stream().map(Path::toString).toList(),
                rendered);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), json);
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline) + " ...";
    }

    public record RenderedMatch(int start, int end, int line, int column, String text) {
    }

    public record RenderedFile(String path, List<RenderedMatch> matches) {
    }

    public record JsonReport(
            String symbol,
            String kind,
            int filesSearched,
            int totalMatches,
            List<String> skippedFiles,
            List<RenderedFile> files) {
    }
}
