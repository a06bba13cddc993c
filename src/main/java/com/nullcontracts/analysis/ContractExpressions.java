package com.nullcontracts.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.nullcontracts.config.ContractConfiguration;
import com.nullcontracts.model.ContractKind;

import java.util.Optional;

/**
 * Queries over the syntax tree: not-null markers, contract calls and the
 * names they check. Stateless apart from the configuration and resolver.
 */
public class ContractExpressions {

    private final ContractConfiguration config;
    private final SymbolResolver resolver;

    public ContractExpressions(ContractConfiguration config, SymbolResolver resolver) {
        this.config = config;
        this.resolver = resolver;
    }

    public ContractConfiguration getConfig() {
        return config;
    }

    public SymbolResolver getResolver() {
        return resolver;
    }

    /**
     * Checks whether a parameter, method or field carries a recognized not-null annotation.
     *
     * @param subject The annotated declaration
     * @return true if one of its annotations is a not-null marker
     */
    public boolean isNotNullAnnotated(NodeWithAnnotations<?> subject) {
        return findNotNullAnnotation(subject).isPresent();
    }

    public Optional<AnnotationExpr> findNotNullAnnotation(NodeWithAnnotations<?> subject) {
        return subject.getAnnotations().stream()
                .filter(ann -> config.getNotNullAnnotations().contains(ann.getNameAsString())
                        || config.getNotNullAnnotations().contains(ann.getName().getIdentifier()))
                .findFirst();
    }

    /**
     * Checks for a marker annotation by simple or qualified name.
     */
    public boolean hasMarker(NodeWithAnnotations<?> node, String marker) {
        return findMarker(node, marker).isPresent();
    }

    public Optional<AnnotationExpr> findMarker(NodeWithAnnotations<?> node, String marker) {
        return node.getAnnotations().stream()
                .filter(ann -> ann.getNameAsString().equals(marker) || ann.getName().getIdentifier().equals(marker))
                .findFirst();
    }

    /**
     * Checks whether an expression calls the contract API method for the given kind.
     * The call target is resolved, so a local method or variable named like the
     * contract class does not match.
     *
     * @param expression The expression to test
     * @param kind The contract kind
     * @return true if the call binds to the contract method
     */
    public boolean isContractCall(Expression expression, ContractKind kind) {
        if (!(expression instanceof MethodCallExpr)) {
            return false;
        }
        MethodCallExpr call = (MethodCallExpr) expression;
        String methodName = methodNameFor(kind);
        if (!call.getNameAsString().equals(methodName)) {
            return false;
        }
        return resolver.resolveMethod(call)
                .map(qualified -> qualified.equals(config.getContractClassName() + "." + methodName))
                .orElse(false);
    }

    /**
     * Statement-level form of {@link #isContractCall(Expression, ContractKind)}.
     */
    public Optional<MethodCallExpr> asContractCall(Statement statement, ContractKind kind) {
        if (!(statement instanceof ExpressionStmt)) {
            return Optional.empty();
        }
        Expression expression = ((ExpressionStmt) statement).getExpression();
        return isContractCall(expression, kind) ? Optional.of((MethodCallExpr) expression) : Optional.empty();
    }

    /**
     * Extracts the expression compared to {@code null} in the first argument of a contract call.
     *
     * For {@code requires} and {@code invariant} this is the checked name
     * ({@code x} or {@code this.x}); for {@code ensures} it is the
     * {@code Contract.<T>result()} call. Anything else, including compound
     * conditions, yields empty.
     *
     * @param call A contract call
     * @return The compared expression, if the argument has the simple shape
     */
    public Optional<Expression> extractReferencedName(MethodCallExpr call) {
        if (call.getArguments().isEmpty()) {
            return Optional.empty();
        }
        Expression argument = call.getArgument(0);
        while (argument.isEnclosedExpr()) {
            argument = argument.asEnclosedExpr().getInner();
        }
        if (!(argument instanceof BinaryExpr)) {
            return Optional.empty();
        }
        BinaryExpr comparison = (BinaryExpr) argument;
        if (comparison.getOperator() != BinaryExpr.Operator.NOT_EQUALS) {
            return Optional.empty();
        }
        Expression compared;
        if (comparison.getRight().isNullLiteralExpr()) {
            compared = comparison.getLeft();
        } else if (comparison.getLeft().isNullLiteralExpr()) {
            compared = comparison.getRight();
        } else {
            return Optional.empty();
        }

        if (isContractCall(call, ContractKind.ENSURES)) {
            return isResultCall(compared) ? Optional.of(compared) : Optional.empty();
        }
        if (compared instanceof NameExpr) {
            return Optional.of(compared);
        }
        if (compared instanceof FieldAccessExpr && ((FieldAccessExpr) compared).getScope().isThisExpr()) {
            return Optional.of(compared);
        }
        return Optional.empty();
    }

    /**
     * Resolves the name checked by a {@code requires} or {@code invariant} call to its declaration.
     */
    public Optional<Node> resolveReferencedDeclaration(MethodCallExpr call) {
        Optional<Expression> referenced = extractReferencedName(call);
        if (referenced.isEmpty()) {
            return Optional.empty();
        }
        Expression expression = referenced.get();
        if (expression instanceof NameExpr) {
            return resolver.resolveDeclaration((NameExpr) expression);
        }
        if (expression instanceof FieldAccessExpr) {
            return resolveThisField((FieldAccessExpr) expression);
        }
        return Optional.empty();
    }

    /**
     * Checks for the {@code Contract.<T>result()} form.
     */
    public boolean isResultCall(Expression expression) {
        if (!(expression instanceof MethodCallExpr)) {
            return false;
        }
        MethodCallExpr call = (MethodCallExpr) expression;
        if (!call.getNameAsString().equals(config.getResultMethod()) || !call.getArguments().isEmpty()) {
            return false;
        }
        return resolver.resolveMethod(call)
                .map(qualified -> qualified.equals(config.getContractClassName() + "." + config.getResultMethod()))
                .orElse(false);
    }

    /**
     * Checks whether the compilation unit can refer to {@code importName} by its simple name.
     *
     * @param root The compilation unit
     * @param importName A qualified type name
     * @return true if a single-type or on-demand import covers it, or it lives in the same package,
     *         and no other type takes the simple name
     */
    public static boolean hasImport(CompilationUnit root, String importName) {
        if (hasImportConflict(root, importName)) {
            return false;
        }
        int dot = importName.lastIndexOf('.');
        String pkg = dot < 0 ? "" : importName.substring(0, dot);
        String currentPackage = root.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
        if (pkg.equals(currentPackage)) {
            return true;
        }
        for (ImportDeclaration imp : root.getImports()) {
            if (imp.isStatic()) {
                continue;
            }
            if (!imp.isAsterisk() && imp.getNameAsString().equals(importName)) {
                return true;
            }
            if (imp.isAsterisk() && imp.getNameAsString().equals(pkg)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether the simple name of {@code importName} already denotes another type,
     * through a single-type import or a type declared in the document.
     * Such a document has to spell the contract class out in full.
     *
     * @param root The compilation unit
     * @param importName A qualified type name
     * @return true if importing {@code importName} would clash
     */
    public static boolean hasImportConflict(CompilationUnit root, String importName) {
        String simpleName = importName.substring(importName.lastIndexOf('.') + 1);
        for (ImportDeclaration imp : root.getImports()) {
            if (!imp.isStatic() && !imp.isAsterisk()
                    && imp.getName().getIdentifier().equals(simpleName)
                    && !imp.getNameAsString().equals(importName)) {
                return true;
            }
        }
        for (TypeDeclaration<?> type : root.findAll(TypeDeclaration.class)) {
            if (type.getNameAsString().equals(simpleName)
                    && !type.getFullyQualifiedName().map(importName::equals).orElse(false)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a compilation unit that imports {@code importName}; the input is left untouched.
     *
     * @param root The compilation unit
     * @param importName A qualified type name
     * @return {@code root} itself if already imported or if the import would clash,
     *         otherwise a copy with the import added
     */
    public static CompilationUnit withImportAdded(CompilationUnit root, String importName) {
        if (hasImport(root, importName) || hasImportConflict(root, importName)) {
            return root;
        }
        CompilationUnit copy = root.clone();
        addImportIfMissing(copy, importName);
        return copy;
    }

    /**
     * In-place form of {@link #withImportAdded(CompilationUnit, String)}.
     *
     * @return true if an import was added
     */
    public static boolean addImportIfMissing(CompilationUnit root, String importName) {
        if (hasImport(root, importName) || hasImportConflict(root, importName)) {
            return false;
        }
        root.addImport(new ImportDeclaration(importName, false, false));
        return true;
    }

    public String methodNameFor(ContractKind kind) {
        return config.getMethodName(kind);
    }

    private Optional<Node> resolveThisField(FieldAccessExpr access) {
        Node current = access.getParentNode().orElse(null);
        while (current != null && !(current instanceof TypeDeclaration)) {
            current = current.getParentNode().orElse(null);
        }
        if (current == null) {
            return Optional.empty();
        }
        String fieldName = access.getNameAsString();
        return ((TypeDeclaration<?>) current).getFieldByName(fieldName)
                .flatMap(field -> field.getVariables().stream()
                        .filter(v -> v.getNameAsString().equals(fieldName))
                        .map(v -> (Node) v)
                        .findFirst());
    }
}
