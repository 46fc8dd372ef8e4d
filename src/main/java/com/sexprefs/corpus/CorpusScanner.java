package com.sexprefs.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sexprefs.runtime.AppConfig;

/**
 * Enumerates the Lisp files under a set of roots, in a stable order.
 */
public class CorpusScanner {
    private static final Logger log = LoggerFactory.getLogger(CorpusScanner.class);

    private final List<String> extensions;
    private final Set<String> excludedDirectories;

    public CorpusScanner(AppConfig.SearchConfig config) {
        this.extensions = config.getExtensions().stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .toList();
        this.excludedDirectories = Set.copyOf(config.getExcludedDirectories());
    }

    public boolean supports(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    public List<SourceFile> scan(List<Path> roots) throws IOException {
        return scan(roots, null);
    }

    /**
     * Files under {@code roots}, sorted per root and de-duplicated. When {@code pathPrefix} is
     * set only files below that directory are kept.
     */
    public List<SourceFile> scan(List<Path> roots, Path pathPrefix) throws IOException {
        Path prefix = pathPrefix == null ? null : pathPrefix.toAbsolutePath().normalize();
        Set<Path> found = new LinkedHashSet<>();
        for (Path root : roots) {
            Path normalizedRoot = root.toAbsolutePath().normalize();
            if (!Files.exists(normalizedRoot)) {
                throw new IllegalArgumentException("Search root does not exist: " + normalizedRoot);
            }
            if (Files.isRegularFile(normalizedRoot)) {
                found.add(normalizedRoot);
                continue;
            }
            try (Stream<Path> walk = Files.walk(normalizedRoot)) {
                walk.filter(Files::isRegularFile)
                        .filter(this::supports)
                        .filter(file -> !insideExcludedDirectory(normalizedRoot, file))
                        .sorted()
                        .forEach(found::add);
            }
        }

        List<SourceFile> sources = new ArrayList<>();
        for (Path file : found) {
            if (prefix == null || file.startsWith(prefix)) {
                sources.add(SourceFile.onDisk(file));
            }
        }
        log.debug("corpus.scan roots={} prefix={} files={}", roots, prefix, sources.size());
        return sources;
    }

    private boolean insideExcludedDirectory(Path root, Path file) {
        Path relative = root.relativize(file);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (excludedDirectories.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }
}
