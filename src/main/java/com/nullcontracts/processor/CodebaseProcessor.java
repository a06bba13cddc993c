package com.nullcontracts.processor;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import com.nullcontracts.analysis.ContractExpressions;
import com.nullcontracts.analysis.JavaSymbolSolverResolver;
import com.nullcontracts.analysis.ScopeSymbolResolver;
import com.nullcontracts.analysis.SymbolResolver;
import com.nullcontracts.config.ContractConfiguration;
import com.nullcontracts.evaluation.MetricsCollector;
import com.nullcontracts.fix.BatchFixer;
import com.nullcontracts.model.Finding;
import com.nullcontracts.visitor.NotNullContractVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the analysis, and optionally the fixes, over every Java file of a codebase.
 * Documents are independent and are processed on a fixed thread pool.
 */
public class CodebaseProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CodebaseProcessor.class);

    private final ContractConfiguration config;
    private final MetricsCollector metricsCollector;

    public CodebaseProcessor() {
        this(ContractConfiguration.load());
    }

    public CodebaseProcessor(ContractConfiguration config) {
        this.config = config;
        this.metricsCollector = new MetricsCollector();
    }

    /**
     * Processes all Java files below the given path.
     *
     * @param codebasePath Root directory of the codebase
     * @param applyFixes Whether missing contracts are inserted and the files rewritten
     * @return Totals of the run
     * @throws IOException If the path does not exist or cannot be walked
     */
    public ProcessingSummary processCodebase(Path codebasePath, boolean applyFixes) throws IOException {
        if (!Files.exists(codebasePath)) {
            throw new IOException("Path does not exist: " + codebasePath);
        }

        metricsCollector.startAnalysis();

        List<Path> javaFiles;
        try (Stream<Path> paths = Files.walk(codebasePath)) {
            javaFiles = paths.filter(Files::isRegularFile)
                    .filter(path -> path.toString().endsWith(".java"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        logger.info("Found {} Java files. Analyzing with {} thread(s)...", javaFiles.size(), config.getThreads());

        int findings = 0;
        int fixes = 0;
        int failed = 0;
        ExecutorService executor = Executors.newFixedThreadPool(config.getThreads());
        try {
            List<Future<FileResult>> futures = new ArrayList<>();
            for (Path javaFile : javaFiles) {
                futures.add(executor.submit(() -> processFile(javaFile, codebasePath, applyFixes)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    FileResult result = futures.get(i).get();
                    if (result.failed) {
                        failed++;
                        continue;
                    }
                    findings += result.findings.size();
                    fixes += result.fixes;
                    for (Finding finding : result.findings) {
                        logger.info("{}: {}", location(result.file, finding),
                                finding.getMessage(config));
                    }
                } catch (ExecutionException e) {
                    failed++;
                    logger.error("Error processing file: {}", javaFiles.get(i), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while processing " + codebasePath, e);
        } finally {
            executor.shutdownNow();
        }

        metricsCollector.endAnalysis();
        metricsCollector.printReport();
        if (config.isExportMetrics()) {
            try {
                metricsCollector.exportJSON(codebasePath.resolve("null-contracts-metrics.json"));
            } catch (IOException e) {
                logger.error("Failed to export metrics to JSON", e);
            }
        }

        return new ProcessingSummary(javaFiles.size() - failed, failed, findings, fixes);
    }

    /**
     * Analyzes a single parsed document.
     *
     * @param cu The compilation unit
     * @param sourceRoot Root used for cross-file type lookups, may be null
     * @return Findings ordered by position
     */
    public List<Finding> analyze(CompilationUnit cu, Path sourceRoot) {
        return new NotNullContractVisitor(createExpressions(sourceRoot)).analyze(cu);
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    private FileResult processFile(Path javaFile, Path sourceRoot, boolean applyFixes) {
        JavaParser parser = new JavaParser(new ParserConfiguration().setLanguageLevel(config.getLanguageLevel()));
        ParseResult<CompilationUnit> parsed;
        try {
            parsed = parser.parse(javaFile);
        } catch (IOException e) {
            logger.error("Cannot read file: {}", javaFile, e);
            metricsCollector.recordFailedFile();
            return FileResult.failed(javaFile);
        }
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            logger.warn("Skipping unparsable file {}: {}", javaFile, parsed.getProblems());
            metricsCollector.recordFailedFile();
            return FileResult.failed(javaFile);
        }

        CompilationUnit cu = parsed.getResult().get();
        if (applyFixes) {
            // Keeps the original text of everything the fixes do not touch
            LexicalPreservingPrinter.setup(cu);
        }
        ContractExpressions expressions = createExpressions(sourceRoot);
        List<Finding> findings = new NotNullContractVisitor(expressions).analyze(cu);
        metricsCollector.recordFile();
        metricsCollector.recordFindings(findings);

        int fixes = 0;
        if (applyFixes && !findings.isEmpty()) {
            BatchFixer fixer = new BatchFixer(expressions);
            int applied = fixer.fixInPlace(cu);
            if (applied > 0) {
                try {
                    Files.writeString(javaFile, LexicalPreservingPrinter.print(cu));
                    fixes = applied;
                    metricsCollector.recordFixes(fixes);
                    logger.info("Updated file with {} contract statement(s): {}", fixes, javaFile);
                } catch (IOException e) {
                    logger.error("Cannot write file: {}", javaFile, e);
                    metricsCollector.recordFailedFile();
                    return FileResult.failed(javaFile);
                }
            }
        }
        return new FileResult(javaFile, findings, fixes, false);
    }

    private ContractExpressions createExpressions(Path sourceRoot) {
        SymbolResolver resolver;
        if (config.getResolverKind() == ContractConfiguration.ResolverKind.SYMBOL_SOLVER) {
            resolver = new JavaSymbolSolverResolver(sourceRoot == null
                    ? Collections.emptyList()
                    : Collections.singletonList(sourceRoot));
        } else {
            resolver = new ScopeSymbolResolver(config);
        }
        return new ContractExpressions(config, resolver);
    }

    private static String location(Path file, Finding finding) {
        return finding.getRange()
                .map(range -> file + ":" + range.begin.line + ":" + range.begin.column)
                .orElse(file.toString());
    }

    private static final class FileResult {
        private final Path file;
        private final List<Finding> findings;
        private final int fixes;
        private final boolean failed;

        private FileResult(Path file, List<Finding> findings, int fixes, boolean failed) {
            this.file = file;
            this.findings = findings;
            this.fixes = fixes;
            this.failed = failed;
        }

        static FileResult failed(Path file) {
            return new FileResult(file, Collections.emptyList(), 0, true);
        }
    }
}
