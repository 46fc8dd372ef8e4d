package com.sexprefs.corpus;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.sexprefs.search.MatchResult;
import com.sexprefs.search.ReferenceKind;

/**
 * Matches per file, in corpus order. Files without matches are absent from
 * {@code matchesByFile} but counted in {@code filesSearched}.
 */
public record SearchReport(
        String symbol,
        ReferenceKind kind,
        Map<Path, List<MatchResult>> matchesByFile,
        int filesSearched,
        List<Path> skippedFiles) {

    public SearchReport {
        Map<Path, List<MatchResult>> ordered = new LinkedHashMap<>();
        matchesByFile.forEach((path, matches) -> ordered.put(path, List.copyOf(matches)));
        matchesByFile = Collections.unmodifiableMap(ordered);
        skippedFiles = List.copyOf(skippedFiles);
    }

    public int totalMatches() {
        return matchesByFile.values().stream().mapToInt(List::size).sum();
    }

    public int matchingFiles() {
        return matchesByFile.size();
    }

    public List<MatchResult> matchesIn(Path path) {
        return matchesByFile.getOrDefault(path, List.of());
    }
}
