package com.sexprefs;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sexprefs.corpus.CorpusScanner;
import com.sexprefs.corpus.ReferenceSearchService;
import com.sexprefs.corpus.SearchAbortedException;
import com.sexprefs.corpus.SearchReport;
import com.sexprefs.corpus.SourceFile;
import com.sexprefs.report.ReportWriter;
import com.sexprefs.runtime.AppConfig;
import com.sexprefs.search.ReferenceKind;
import com.sexprefs.sexp.Symbol;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "sexp-refs",
        mixinStandardHelpOptions = true,
        version = "sexp-refs 0.1.0",
        description = "Finds function, macro, special form and variable references to an Emacs Lisp symbol.")
public class Main implements Callable<Integer> {
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_SEARCH_FAILURE = 3;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = { "-k", "--kind" }, description = "Reference kind: ${COMPLETION-CANDIDATES}", defaultValue = "function")
    Kind kind;

    @Option(names = "--path-prefix", description = "Only search files below this directory")
    Path pathPrefix;

    @Option(names = { "-o", "--output" }, description = "Also write a JSON report to this file")
    Path outputPath;

    @Option(names = "--parallelism", description = "Worker threads, overrides search.parallelism")
    Integer parallelism;

    @Option(names = "--skip-malformed", description = "Skip files that cannot be read instead of aborting the search")
    boolean skipMalformed;

    @Parameters(index = "0", description = "Symbol to search for")
    String symbol;

    @Parameters(index = "1..*", arity = "0..*", description = "Files or directories to search (default: current directory)")
    List<Path> roots;

    private final PrintStream out;

    enum Kind {
        function(ReferenceKind.FUNCTION),
        macro(ReferenceKind.MACRO),
        special(ReferenceKind.SPECIAL_FORM),
        variable(ReferenceKind.VARIABLE),
        symbol(ReferenceKind.SYMBOL);

        private final ReferenceKind referenceKind;

        Kind(ReferenceKind referenceKind) {
            this.referenceKind = referenceKind;
        }
    }

    public Main() {
        this(System.out);
    }

    Main(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (symbol == null || symbol.isBlank()) {
            log.error("A non-blank symbol is required");
            return EXIT_USAGE_ERROR;
        }

        AppConfig config;
        try {
            config = loadConfig(Path.of(configPath));
            applyOverrides(config.getSearch());
            config.getSearch().validate();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid configuration {}: {}", configPath, e.getMessage());
            return EXIT_USAGE_ERROR;
        }

        List<SourceFile> files;
        try {
            files = new CorpusScanner(config.getSearch()).scan(searchRoots(), pathPrefix);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return EXIT_USAGE_ERROR;
        } catch (IOException e) {
            log.error("Failed to list search roots {}: {}", searchRoots(), e.getMessage(), e);
            return EXIT_SEARCH_FAILURE;
        }
        log.info("Searching {} references to {} in {} files", kind, symbol, files.size());

        SearchReport report;
        try {
            report = createSearchService(config.getSearch()).search(
                    Symbol.intern(symbol),
                    files,
                    kind.referenceKind,
                    (processed, total) -> log.info("Searched {}/{} files", processed, total));
        } catch (SearchAbortedException e) {
            log.error(e.getMessage());
            return EXIT_SEARCH_FAILURE;
        } catch (UncheckedIOException e) {
            log.error("Search failed: {}", e.getMessage(), e.getCause());
            return EXIT_SEARCH_FAILURE;
        }

        ReportWriter writer = new ReportWriter();
        try {
            List<ReportWriter.RenderedFile> rendered = writer.render(report, files);
            writer.writeText(out, report, rendered);
            if (outputPath != null) {
                writer.writeJson(outputPath, report, rendered);
                log.info("Wrote JSON report to {}", outputPath);
            }
        } catch (IOException e) {
            log.error("Failed to write report: {}", e.getMessage(), e);
            return EXIT_SEARCH_FAILURE;
        }
        return 0;
    }

    ReferenceSearchService createSearchService(AppConfig.SearchConfig searchConfig) {
        return new ReferenceSearchService(searchConfig);
    }

    private void applyOverrides(AppConfig.SearchConfig searchConfig) {
        if (parallelism != null) {
            searchConfig.setParallelism(parallelism);
        }
        if (skipMalformed) {
            searchConfig.setSkipMalformedFiles(true);
        }
    }

    private List<Path> searchRoots() {
        return roots == null || roots.isEmpty() ? List.of(Path.of(".")) : roots;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
