package com.nullcontracts.processor;

/**
 * Totals of one {@link CodebaseProcessor} run.
 */
public class ProcessingSummary {

    private final int filesProcessed;
    private final int failedFiles;
    private final int findings;
    private final int fixesApplied;

    public ProcessingSummary(int filesProcessed, int failedFiles, int findings, int fixesApplied) {
        this.filesProcessed = filesProcessed;
        this.failedFiles = failedFiles;
        this.findings = findings;
        this.fixesApplied = fixesApplied;
    }

    public int getFilesProcessed() {
        return filesProcessed;
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public int getFindings() {
        return findings;
    }

    public int getFixesApplied() {
        return fixesApplied;
    }

    @Override
    public String toString() {
        return String.format("files=%d, failed=%d, findings=%d, fixes=%d",
                filesProcessed, failedFiles, findings, fixesApplied);
    }
}
