package com.nullcontracts.fix;

import com.github.javaparser.ast.CompilationUnit;
import com.nullcontracts.analysis.ContractExpressions;
import com.nullcontracts.model.Finding;
import com.nullcontracts.visitor.NotNullContractVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Applies every fix of a document, one at a time.
 *
 * The findings are recomputed against the current tree before each fix,
 * so insertion indices never go stale.
 */
public class BatchFixer {

    private static final Logger logger = LoggerFactory.getLogger(BatchFixer.class);

    private final NotNullContractVisitor analyzer;
    private final ContractSynthesizer synthesizer;
    private int lastFixCount;

    public BatchFixer(ContractExpressions expressions) {
        this.analyzer = new NotNullContractVisitor(expressions);
        this.synthesizer = new ContractSynthesizer(expressions);
    }

    /**
     * Fixes all findings of a document.
     *
     * @param cu The compilation unit; not modified
     * @return The fixed compilation unit, or {@code cu} if there was nothing to fix
     */
    public CompilationUnit fixAll(CompilationUnit cu) {
        return fix(cu, (current, finding) -> {
            CompilationUnit updated = synthesizer.apply(current, finding);
            return updated == current ? Optional.empty() : Optional.of(updated);
        });
    }

    /**
     * Fixes all findings of a document by editing it directly.
     * Used when the document is printed with the lexical-preserving printer.
     *
     * @param cu The compilation unit; modified
     * @return The number of contract statements inserted
     */
    public int fixInPlace(CompilationUnit cu) {
        fix(cu, (current, finding) -> synthesizer.applyInPlace(current, finding.getAnchor())
                ? Optional.of(current)
                : Optional.empty());
        return lastFixCount;
    }

    /**
     * @param step Inserts the statement for one finding; empty when nothing was inserted
     */
    private CompilationUnit fix(CompilationUnit start,
                                BiFunction<CompilationUnit, Finding, Optional<CompilationUnit>> step) {
        CompilationUnit current = start;
        Set<String> attempted = new HashSet<>();
        lastFixCount = 0;

        while (true) {
            List<Finding> findings = analyzer.analyze(current);
            Optional<Finding> next = findings.stream()
                    .filter(f -> !attempted.contains(keyOf(f)))
                    .findFirst();
            if (next.isEmpty()) {
                if (!findings.isEmpty()) {
                    logger.warn("{} finding(s) could not be fixed", findings.size());
                }
                break;
            }
            attempted.add(keyOf(next.get()));

            Optional<CompilationUnit> updated = step.apply(current, next.get());
            if (updated.isPresent()) {
                lastFixCount++;
                current = updated.get();
            }
        }
        return current;
    }

    /**
     * Number of fixes applied by the last {@link #fixAll(CompilationUnit)} or {@link #fixInPlace(CompilationUnit)} call.
     */
    public int getLastFixCount() {
        return lastFixCount;
    }

    private static String keyOf(Finding finding) {
        return finding.getKind() + ":" + NodePath.of(finding.getAnchor());
    }
}
