package com.cpparchitect.core.scanner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cpparchitect.core.config.AnalyzerConfig.ParsingConfig;
import com.cpparchitect.core.extractor.ControlFlowBuilder;
import com.cpparchitect.core.extractor.EntityExtractor;
import com.cpparchitect.core.extractor.FileExtraction;
import com.cpparchitect.core.model.CppClass;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.ExtractionStatistics;
import com.cpparchitect.core.model.SourceUnit;
import com.cpparchitect.core.syntax.SourceText;
import com.cpparchitect.core.syntax.SyntaxNode;
import com.cpparchitect.core.syntax.SyntaxParser;
import com.cpparchitect.core.syntax.TreeSitterCppParser;
import com.cpparchitect.core.util.FileUtils;

/**
 * Scans a source tree and builds the {@link EntityRegister} of one analysis run.
 *
 * <p><b>Pipeline:</b>
 * <ol>
 *   <li>Discover files by extension, skipping ignored directories</li>
 *   <li>Skip oversized and unreadable files</li>
 *   <li>Parse and extract each file into a local {@link FileExtraction}</li>
 *   <li>Merge partial results in file-id order</li>
 * </ol>
 *
 * <p>With {@code parallelism > 1} files are extracted on a fixed thread pool, one parser
 * per worker thread. Results are merged in the same order as in a sequential run, so the
 * register does not depend on scheduling.
 *
 * <p>Nothing here aborts a run: every skipped file is counted under a reason in
 * {@link ExtractionStatistics#filesSkipped()}.
 */
public class SourceScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);

    // Skip reasons
    public static final String SKIP_OVERSIZED = "oversized";
    public static final String SKIP_UNREADABLE = "unreadable";
    public static final String SKIP_PARSE_FAILURE = "parse-failure";

    private final ParsingConfig config;
    private final Supplier<SyntaxParser> parserFactory;
    private final EntityExtractor extractor;

    public SourceScanner(ParsingConfig config) {
        this(config, TreeSitterCppParser::new);
    }

    public SourceScanner(ParsingConfig config, Supplier<SyntaxParser> parserFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parserFactory = Objects.requireNonNull(parserFactory, "parserFactory must not be null");
        this.extractor = new EntityExtractor(new ControlFlowBuilder(config.maxRecursionDepth()));
    }

    /**
     * Scans all matching files below a root directory.
     *
     * @param root project root
     * @return register of all extracted entities
     * @throws IOException if the directory tree cannot be traversed
     */
    public EntityRegister scan(Path root) throws IOException {
        Objects.requireNonNull(root, "root must not be null");
        List<Path> files = FileUtils.findSourceFiles(root, config.fileExtensions(), config.ignoredDirectories());
        log.info("Discovered {} C++ files under {}", files.size(), root);

        Stats stats = new Stats();
        stats.discovered = files.size();
        List<SourceUnit> units = new ArrayList<>();
        for (Path file : files) {
            String fileId = FileUtils.toFileId(root, file);
            try {
                if (Files.size(file) > config.maxFileSizeBytes()) {
                    log.warn("Skipping oversized file: {} (limit {} MB)", fileId, config.maxFileSizeMb());
                    stats.skipFile(SKIP_OVERSIZED, fileId + ": larger than " + config.maxFileSizeMb() + " MB");
                    continue;
                }
                units.add(new SourceUnit(fileId, FileUtils.readLenient(file)));
            } catch (IOException e) {
                log.warn("Skipping unreadable file: {} ({})", fileId, e.getMessage());
                stats.skipFile(SKIP_UNREADABLE, fileId + ": " + e.getMessage());
            }
        }
        return extractAll(units, stats);
    }

    /**
     * Extracts entities from source units that are already in memory.
     *
     * @param units source files; extracted and merged in file-id order
     * @return register of all extracted entities
     */
    public EntityRegister scanSources(List<SourceUnit> units) {
        Objects.requireNonNull(units, "units must not be null");
        Stats stats = new Stats();
        stats.discovered = units.size();
        return extractAll(units, stats);
    }

    private EntityRegister extractAll(List<SourceUnit> units, Stats stats) {
        List<SourceUnit> sorted = units.stream()
            .sorted(Comparator.comparing(SourceUnit::fileId))
            .toList();

        List<Outcome> outcomes = config.parallelism() > 1 && sorted.size() > 1
            ? extractParallel(sorted)
            : extractSequential(sorted);

        List<SourceUnit> parsedUnits = new ArrayList<>();
        List<CppFunction> functions = new ArrayList<>();
        List<CppClass> classes = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.extraction() == null) {
                stats.skipFile(SKIP_PARSE_FAILURE, outcome.unit().fileId() + ": " + outcome.error());
                continue;
            }
            parsedUnits.add(outcome.unit());
            stats.parsed++;
            FileExtraction extraction = outcome.extraction();
            functions.addAll(extraction.functions());
            classes.addAll(extraction.classes());
            extraction.skippedEntities().forEach((reason, count) -> stats.entitiesSkipped.merge(reason, count, Integer::sum));
            extraction.errors().forEach(stats::addError);
        }

        ExtractionStatistics statistics = stats.toStatistics();
        log.info("Extraction finished: {} functions, {} classes. {}", functions.size(), classes.size(), statistics.getSummary());
        return new EntityRegister(parsedUnits, functions, classes, statistics);
    }

    private List<Outcome> extractSequential(List<SourceUnit> units) {
        SyntaxParser parser = parserFactory.get();
        List<Outcome> outcomes = new ArrayList<>(units.size());
        for (SourceUnit unit : units) {
            outcomes.add(extractOne(parser, unit));
        }
        return outcomes;
    }

    private List<Outcome> extractParallel(List<SourceUnit> units) {
        ExecutorService executor = Executors.newFixedThreadPool(config.parallelism());
        ThreadLocal<SyntaxParser> parsers = ThreadLocal.withInitial(parserFactory);
        try {
            List<Future<Outcome>> futures = new ArrayList<>(units.size());
            for (SourceUnit unit : units) {
                futures.add(executor.submit(() -> extractOne(parsers.get(), unit)));
            }
            List<Outcome> outcomes = new ArrayList<>(units.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), units.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private Outcome await(Future<Outcome> future, SourceUnit unit) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while extracting " + unit.fileId(), e);
        } catch (ExecutionException e) {
            return new Outcome(unit, null, String.valueOf(e.getCause()));
        }
    }

    private Outcome extractOne(SyntaxParser parser, SourceUnit unit) {
        try {
            SourceText source = new SourceText(unit.text());
            SyntaxNode root = parser.parse(unit.text());
            return new Outcome(unit, extractor.extract(root, source, unit.fileId()), null);
        } catch (RuntimeException e) {
            log.warn("Failed to extract {}: {}", unit.fileId(), e.getMessage());
            return new Outcome(unit, null, e.getMessage());
        }
    }

    /**
     * Result of extracting one file: either an extraction or an error message.
     */
    private record Outcome(SourceUnit unit, FileExtraction extraction, String error) {}

    /**
     * Mutable counters, frozen into {@link ExtractionStatistics} at the end.
     */
    private static final class Stats {
        private int discovered;
        private int parsed;
        private final Map<String, Integer> filesSkipped = new LinkedHashMap<>();
        private final Map<String, Integer> entitiesSkipped = new LinkedHashMap<>();
        private final List<String> errors = new ArrayList<>();

        private void skipFile(String reason, String message) {
            filesSkipped.merge(reason, 1, Integer::sum);
            addError(message);
        }

        private void addError(String message) {
            if (errors.size() < ExtractionStatistics.MAX_TOP_ERRORS) {
                errors.add(message);
            }
        }

        private ExtractionStatistics toStatistics() {
            return new ExtractionStatistics(discovered, parsed, filesSkipped, entitiesSkipped, errors);
        }
    }
}
