package com.nullcontracts.model;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.nullcontracts.config.ContractConfiguration;

import java.util.Objects;
import java.util.Optional;

/**
 * One {@code @NotNull} annotation lacking its contract statement.
 * The anchor is the annotated parameter, method or field variable; the
 * range points at the annotation (or at the field variable).
 */
public class Finding {

    private final Range range;
    private final String subjectName;
    private final SubjectKind kind;
    private final Node anchor;

    public Finding(Range range, String subjectName, SubjectKind kind, Node anchor) {
        this.range = range;
        this.subjectName = Objects.requireNonNull(subjectName);
        this.kind = Objects.requireNonNull(kind);
        this.anchor = Objects.requireNonNull(anchor);
    }

    public Optional<Range> getRange() {
        return Optional.ofNullable(range);
    }

    public String getSubjectName() {
        return subjectName;
    }

    public SubjectKind getKind() {
        return kind;
    }

    public Node getAnchor() {
        return anchor;
    }

    /**
     * Message for diagnostic surfaces, naming the contract method configured for this kind.
     *
     * @param config Supplies the contract class and method names
     * @return e.g. {@code Parameter 'arg' is annotated @NotNull but has no matching Contract.requires}
     */
    public String getMessage(ContractConfiguration config) {
        return String.format("%s '%s' is annotated @NotNull but has no matching %s.%s",
                kind.getLabel(), subjectName, config.getContractClassSimpleName(),
                config.getMethodName(kind.getRequiredContract()));
    }

    @Override
    public String toString() {
        String where = range == null ? "?" : range.begin.line + ":" + range.begin.column;
        return kind + " " + subjectName + " @" + where;
    }
}
