package com.nullcontracts.evaluation;

import com.nullcontracts.model.Finding;
import com.nullcontracts.model.SubjectKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects counts and timing for one analysis run.
 * Documents are processed concurrently, so every mutator is synchronized.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private Instant startTime;
    private Instant endTime;

    private int totalFiles = 0;
    private int failedFiles = 0;
    private int fixesApplied = 0;
    private final Map<SubjectKind, Integer> findingsByKind = new EnumMap<>(SubjectKind.class);

    public MetricsCollector() {
        for (SubjectKind kind : SubjectKind.values()) {
            findingsByKind.put(kind, 0);
        }
    }

    public synchronized void startAnalysis() {
        startTime = Instant.now();
        logger.debug("Metrics collection started");
    }

    public synchronized void endAnalysis() {
        endTime = Instant.now();
    }

    public synchronized void recordFile() {
        totalFiles++;
    }

    public synchronized void recordFailedFile() {
        failedFiles++;
    }

    public synchronized void recordFindings(List<Finding> findings) {
        for (Finding finding : findings) {
            findingsByKind.merge(finding.getKind(), 1, Integer::sum);
        }
    }

    public synchronized void recordFixes(int count) {
        fixesApplied += count;
    }

    public synchronized int getTotalFiles() {
        return totalFiles;
    }

    public synchronized int getFailedFiles() {
        return failedFiles;
    }

    public synchronized int getFixesApplied() {
        return fixesApplied;
    }

    public synchronized int getFindings(SubjectKind kind) {
        return findingsByKind.get(kind);
    }

    public synchronized int getTotalFindings() {
        return findingsByKind.values().stream().mapToInt(Integer::intValue).sum();
    }

    public synchronized long getElapsedMillis() {
        if (startTime == null) {
            return 0;
        }
        Instant end = endTime == null ? Instant.now() : endTime;
        return Duration.between(startTime, end).toMillis();
    }

    /**
     * Logs a summary of the run.
     */
    public synchronized void printReport() {
        logger.info("==== Null contract report ====");
        logger.info("Files analyzed: {} ({} failed)", totalFiles, failedFiles);
        logger.info("Missing preconditions: {}", findingsByKind.get(SubjectKind.PARAMETER));
        logger.info("Missing postconditions: {}", findingsByKind.get(SubjectKind.RETURN_VALUE));
        logger.info("Missing invariants: {}", findingsByKind.get(SubjectKind.FIELD));
        logger.info("Fixes applied: {}", fixesApplied);
        logger.info("Elapsed: {} ms", getElapsedMillis());
    }

    /**
     * Writes the counts as JSON.
     *
     * @param outputPath Target file
     * @throws IOException If the file cannot be written
     */
    public synchronized void exportJSON(Path outputPath) throws IOException {
        try (FileWriter writer = new FileWriter(outputPath.toFile())) {
            writer.write("{\n");
            writer.write(String.format("  \"elapsedMs\": %d,%n", getElapsedMillis()));
            writer.write(String.format("  \"files\": %d,%n", totalFiles));
            writer.write(String.format("  \"failedFiles\": %d,%n", failedFiles));
            writer.write("  \"findings\": {\n");
            int count = 0;
            for (Map.Entry<SubjectKind, Integer> entry : findingsByKind.entrySet()) {
                writer.write(String.format("    \"%s\": %d", entry.getKey().name(), entry.getValue()));
                if (++count < findingsByKind.size()) {
                    writer.write(",");
                }
                writer.write("\n");
            }
            writer.write("  },\n");
            writer.write(String.format("  \"fixesApplied\": %d%n", fixesApplied));
            writer.write("}\n");
        }
        logger.info("Metrics exported to: {}", outputPath);
    }
}
