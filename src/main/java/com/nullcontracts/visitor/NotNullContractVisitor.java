package com.nullcontracts.visitor;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.nullcontracts.analysis.ContractClassResolver;
import com.nullcontracts.analysis.ContractExpressions;
import com.nullcontracts.analysis.ContractTarget;
import com.nullcontracts.model.ContractKind;
import com.nullcontracts.model.Finding;
import com.nullcontracts.model.SubjectKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * AST visitor reporting every {@code @NotNull} parameter, return value and
 * field that has no matching contract statement.
 *
 * Only fixable gaps are reported: a subject whose contracts have nowhere to
 * go (no body, no companion, no invariant method) is skipped.
 */
public class NotNullContractVisitor extends VoidVisitorAdapter<List<Finding>> {

    private static final Logger logger = LoggerFactory.getLogger(NotNullContractVisitor.class);

    private final ContractExpressions expressions;
    private final ContractClassResolver classResolver;

    public NotNullContractVisitor(ContractExpressions expressions) {
        this.expressions = expressions;
        this.classResolver = new ContractClassResolver(expressions);
    }

    /**
     * Analyzes one document.
     *
     * @param cu The parsed compilation unit
     * @return Findings ordered by source position
     */
    public List<Finding> analyze(CompilationUnit cu) {
        List<Finding> findings = new ArrayList<>();
        visit(cu, findings);
        // Synthesized nodes have no position; they keep traversal order at the end
        findings.sort(Comparator.comparing((Finding f) -> f.getRange().isEmpty())
                .thenComparing(f -> f.getRange().map(r -> r.begin).orElse(null),
                        Comparator.nullsLast(Comparator.<Position>naturalOrder())));
        return findings;
    }

    @Override
    public void visit(ClassOrInterfaceDeclaration classDecl, List<Finding> findings) {
        if (!classDecl.isInterface()) {
            analyzeFields(classDecl, findings);
        }
        super.visit(classDecl, findings);
    }

    @Override
    public void visit(EnumDeclaration enumDecl, List<Finding> findings) {
        analyzeFields(enumDecl, findings);
        super.visit(enumDecl, findings);
    }

    @Override
    public void visit(MethodDeclaration methodDecl, List<Finding> findings) {
        analyzeParameters(methodDecl, findings);
        analyzeReturn(methodDecl, findings);
        super.visit(methodDecl, findings);
    }

    @Override
    public void visit(ConstructorDeclaration constructorDecl, List<Finding> findings) {
        analyzeParameters(constructorDecl, findings);
        super.visit(constructorDecl, findings);
    }

    private void analyzeParameters(CallableDeclaration<?> callable, List<Finding> findings) {
        ContractTarget target = null;

        for (int i = 0; i < callable.getParameters().size(); i++) {
            Parameter parameter = callable.getParameter(i);
            Optional<AnnotationExpr> annotation = expressions.findNotNullAnnotation(parameter);
            if (annotation.isEmpty() || parameter.getType().isPrimitiveType()) {
                continue;
            }
            if (target == null) {
                target = classResolver.resolveContractTarget(callable);
            }
            if (!target.isFixable()) {
                logger.debug("Skipping parameter {} of {}: no place for a precondition",
                        parameter.getNameAsString(), callable.getNameAsString());
                continue;
            }

            Parameter targetParameter = target.getMember().getParameter(i);
            BlockStmt body = target.getBody().orElseThrow();
            if (!hasPrecondition(body, targetParameter)) {
                findings.add(new Finding(rangeOf(annotation.get(), parameter), parameter.getNameAsString(),
                        SubjectKind.PARAMETER, parameter));
            }
        }
    }

    private void analyzeReturn(MethodDeclaration method, List<Finding> findings) {
        Optional<AnnotationExpr> annotation = expressions.findNotNullAnnotation(method);
        if (annotation.isEmpty() || method.getType().isVoidType() || method.getType().isPrimitiveType()) {
            return;
        }
        ContractTarget target = classResolver.resolveContractTarget(method);
        if (!target.isFixable()) {
            logger.debug("Skipping return value of {}: no place for a postcondition", method.getNameAsString());
            return;
        }
        BlockStmt body = target.getBody().orElseThrow();
        if (!hasPostcondition(body)) {
            findings.add(new Finding(rangeOf(annotation.get(), method), method.getNameAsString(),
                    SubjectKind.RETURN_VALUE, method));
        }
    }

    private void analyzeFields(TypeDeclaration<?> type, List<Finding> findings) {
        Optional<MethodDeclaration> invariantMethod = classResolver.findInvariantMethod(type);

        for (FieldDeclaration field : type.getFields()) {
            if (!expressions.isNotNullAnnotated(field)) {
                continue;
            }
            if (invariantMethod.isEmpty()) {
                logger.debug("Skipping @NotNull fields of {}: no invariant method", type.getNameAsString());
                return;
            }
            BlockStmt body = invariantMethod.get().getBody().orElseThrow();
            for (VariableDeclarator variable : field.getVariables()) {
                if (variable.getType().isPrimitiveType()) {
                    continue;
                }
                if (!hasInvariant(body, variable)) {
                    findings.add(new Finding(variable.getName().getRange().orElse(null), variable.getNameAsString(),
                            SubjectKind.FIELD, variable));
                }
            }
        }
    }

    /**
     * A precondition naming the parameter. A precondition whose condition is
     * not the simple null comparison counts for every parameter.
     */
    private boolean hasPrecondition(BlockStmt body, Parameter parameter) {
        return hasMatching(body, ContractKind.REQUIRES, parameter);
    }

    /**
     * Any postcondition counts; a member has a single result.
     */
    private boolean hasPostcondition(BlockStmt body) {
        return body.getStatements().stream()
                .anyMatch(statement -> expressions.asContractCall(statement, ContractKind.ENSURES).isPresent());
    }

    private boolean hasInvariant(BlockStmt body, VariableDeclarator variable) {
        return hasMatching(body, ContractKind.INVARIANT, variable);
    }

    private boolean hasMatching(BlockStmt body, ContractKind kind, Node subject) {
        for (Statement statement : body.getStatements()) {
            Optional<MethodCallExpr> call = expressions.asContractCall(statement, kind);
            if (call.isEmpty()) {
                continue;
            }
            if (expressions.extractReferencedName(call.get()).isEmpty()) {
                return true;
            }
            if (expressions.resolveReferencedDeclaration(call.get()).map(d -> d == subject).orElse(false)) {
                return true;
            }
        }
        return false;
    }

    private static Range rangeOf(AnnotationExpr annotation, Node fallback) {
        return annotation.getRange().orElse(fallback.getRange().orElse(null));
    }
}
