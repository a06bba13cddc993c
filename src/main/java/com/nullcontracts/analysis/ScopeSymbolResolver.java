package com.nullcontracts.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithStatements;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.nullcontracts.config.ContractConfiguration;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves names by walking the lexical scopes of the tree itself.
 *
 * Types that are not declared in the document are looked up in a small table
 * of known qualified type names; it is only consulted for on-demand imports,
 * where the tree alone cannot tell which package supplies a simple name.
 */
public class ScopeSymbolResolver implements SymbolResolver {

    private final Set<String> knownTypes;

    public ScopeSymbolResolver(ContractConfiguration config) {
        this(Collections.singleton(config.getContractClassName()));
    }

    public ScopeSymbolResolver(Collection<String> knownTypes) {
        this.knownTypes = Collections.unmodifiableSet(new LinkedHashSet<>(knownTypes));
    }

    @Override
    public Optional<String> resolveMethod(MethodCallExpr call) {
        String methodName = call.getNameAsString();

        if (call.getScope().isPresent()) {
            return qualifyTypeExpression(call.getScope().get())
                    .map(type -> type + "." + methodName);
        }

        // Members of enclosing types shadow static imports
        Optional<Node> current = call.getParentNode();
        while (current.isPresent()) {
            Node node = current.get();
            if (node instanceof TypeDeclaration) {
                TypeDeclaration<?> type = (TypeDeclaration<?>) node;
                if (!type.getMethodsByName(methodName).isEmpty()) {
                    return type.getFullyQualifiedName().map(q -> q + "." + methodName);
                }
            }
            current = node.getParentNode();
        }

        Optional<CompilationUnit> cu = call.findCompilationUnit();
        if (cu.isEmpty()) {
            return Optional.empty();
        }
        for (ImportDeclaration imp : cu.get().getImports()) {
            if (imp.isStatic() && !imp.isAsterisk() && imp.getName().getIdentifier().equals(methodName)) {
                return Optional.of(imp.getNameAsString());
            }
        }
        for (ImportDeclaration imp : cu.get().getImports()) {
            if (imp.isStatic() && imp.isAsterisk() && knownTypes.contains(imp.getNameAsString())) {
                return Optional.of(imp.getNameAsString() + "." + methodName);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Node> resolveDeclaration(NameExpr name) {
        return lookupVariable(name, name.getNameAsString());
    }

    @Override
    public Optional<TypeDeclaration<?>> resolveType(ClassOrInterfaceType type) {
        Optional<CompilationUnit> cu = type.findCompilationUnit();
        if (cu.isEmpty()) {
            return Optional.empty();
        }
        String written = type.getNameWithScope();
        String simpleName = type.getNameAsString();

        for (TypeDeclaration<?> candidate : cu.get().findAll(TypeDeclaration.class)) {
            if (!candidate.getNameAsString().equals(simpleName)) {
                continue;
            }
            if (written.equals(simpleName)) {
                return Optional.of(candidate);
            }
            String qualified = candidate.getFullyQualifiedName().orElse(simpleName);
            if (qualified.equals(written) || qualified.endsWith("." + written)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Walks outward from {@code from}, returning the innermost declaration of {@code identifier}.
     */
    private Optional<Node> lookupVariable(Node from, String identifier) {
        Node child = from;
        Optional<Node> parent = from.getParentNode();
        while (parent.isPresent()) {
            Node scope = parent.get();
            Optional<Node> found = declaredIn(scope, child, identifier);
            if (found.isPresent()) {
                return found;
            }
            child = scope;
            parent = scope.getParentNode();
        }
        return Optional.empty();
    }

    private Optional<Node> declaredIn(Node scope, Node child, String identifier) {
        if (scope instanceof NodeWithStatements) {
            NodeList<Statement> statements = ((NodeWithStatements<?>) scope).getStatements();
            int limit = indexOf(statements, child);
            // Only locals declared before the statement we came from are visible
            for (int i = limit - 1; i >= 0; i--) {
                Optional<Node> local = localDeclaredBy(statements.get(i), identifier);
                if (local.isPresent()) {
                    return local;
                }
            }
            return Optional.empty();
        }
        if (scope instanceof LambdaExpr) {
            return parameterNamed(((LambdaExpr) scope).getParameters(), identifier);
        }
        if (scope instanceof CallableDeclaration) {
            return parameterNamed(((CallableDeclaration<?>) scope).getParameters(), identifier);
        }
        if (scope instanceof CatchClause) {
            Parameter parameter = ((CatchClause) scope).getParameter();
            return parameter.getNameAsString().equals(identifier) ? Optional.of(parameter) : Optional.empty();
        }
        if (scope instanceof ForEachStmt) {
            return declaratorNamed(((ForEachStmt) scope).getVariable(), identifier);
        }
        if (scope instanceof ForStmt) {
            for (Expression init : ((ForStmt) scope).getInitialization()) {
                if (init instanceof VariableDeclarationExpr) {
                    Optional<Node> found = declaratorNamed((VariableDeclarationExpr) init, identifier);
                    if (found.isPresent()) {
                        return found;
                    }
                }
            }
            return Optional.empty();
        }
        if (scope instanceof TryStmt) {
            for (Expression resource : ((TryStmt) scope).getResources()) {
                if (resource instanceof VariableDeclarationExpr) {
                    Optional<Node> found = declaratorNamed((VariableDeclarationExpr) resource, identifier);
                    if (found.isPresent()) {
                        return found;
                    }
                }
            }
            return Optional.empty();
        }
        if (scope instanceof ObjectCreationExpr) {
            Optional<NodeList<BodyDeclaration<?>>> body = ((ObjectCreationExpr) scope).getAnonymousClassBody();
            return body.isPresent() ? fieldNamed(body.get(), identifier) : Optional.empty();
        }
        if (scope instanceof TypeDeclaration) {
            TypeDeclaration<?> type = (TypeDeclaration<?>) scope;
            Optional<Node> field = fieldNamed(type.getMembers(), identifier);
            if (field.isPresent()) {
                return field;
            }
            if (type instanceof RecordDeclaration) {
                return parameterNamed(((RecordDeclaration) type).getParameters(), identifier);
            }
        }
        return Optional.empty();
    }

    private Optional<Node> localDeclaredBy(Statement statement, String identifier) {
        if (statement instanceof ExpressionStmt) {
            Expression expression = ((ExpressionStmt) statement).getExpression();
            if (expression instanceof VariableDeclarationExpr) {
                return declaratorNamed((VariableDeclarationExpr) expression, identifier);
            }
        }
        return Optional.empty();
    }

    private Optional<Node> parameterNamed(List<Parameter> parameters, String identifier) {
        for (Parameter parameter : parameters) {
            if (parameter.getNameAsString().equals(identifier)) {
                return Optional.of(parameter);
            }
        }
        return Optional.empty();
    }

    private Optional<Node> declaratorNamed(VariableDeclarationExpr declaration, String identifier) {
        for (VariableDeclarator variable : declaration.getVariables()) {
            if (variable.getNameAsString().equals(identifier)) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }

    private Optional<Node> fieldNamed(List<BodyDeclaration<?>> members, String identifier) {
        for (BodyDeclaration<?> member : members) {
            if (member instanceof FieldDeclaration) {
                for (VariableDeclarator variable : ((FieldDeclaration) member).getVariables()) {
                    if (variable.getNameAsString().equals(identifier)) {
                        return Optional.of(variable);
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Qualified type name denoted by the scope of a static call, if the scope is a type at all.
     */
    private Optional<String> qualifyTypeExpression(Expression scope) {
        if (scope instanceof NameExpr) {
            NameExpr name = (NameExpr) scope;
            if (lookupVariable(name, name.getNameAsString()).isPresent()) {
                return Optional.empty();
            }
            return qualifyTypeName(name.getNameAsString(), name);
        }
        if (scope instanceof FieldAccessExpr) {
            Expression leftmost = scope;
            while (leftmost instanceof FieldAccessExpr) {
                leftmost = ((FieldAccessExpr) leftmost).getScope();
            }
            if (!(leftmost instanceof NameExpr)) {
                return Optional.empty();
            }
            NameExpr head = (NameExpr) leftmost;
            if (lookupVariable(head, head.getNameAsString()).isPresent()) {
                return Optional.empty();
            }
            String written = scope.toString();
            Optional<CompilationUnit> cu = scope.findCompilationUnit();
            if (cu.isPresent()) {
                // Outer.Inner where Outer is declared in this document
                for (TypeDeclaration<?> type : cu.get().findAll(TypeDeclaration.class)) {
                    if (type.getNameAsString().equals(head.getNameAsString()) && type.getFullyQualifiedName().isPresent()) {
                        return Optional.of(type.getFullyQualifiedName().get()
                                + written.substring(head.getNameAsString().length()));
                    }
                }
            }
            return Optional.of(written);
        }
        return Optional.empty();
    }

    private Optional<String> qualifyTypeName(String simpleName, Node context) {
        Optional<CompilationUnit> cu = context.findCompilationUnit();
        if (cu.isEmpty()) {
            return Optional.empty();
        }
        for (TypeDeclaration<?> type : cu.get().findAll(TypeDeclaration.class)) {
            if (type.getNameAsString().equals(simpleName)) {
                return type.getFullyQualifiedName();
            }
        }
        for (ImportDeclaration imp : cu.get().getImports()) {
            if (!imp.isStatic() && !imp.isAsterisk() && imp.getName().getIdentifier().equals(simpleName)) {
                return Optional.of(imp.getNameAsString());
            }
        }
        for (ImportDeclaration imp : cu.get().getImports()) {
            if (!imp.isStatic() && imp.isAsterisk()) {
                String candidate = imp.getNameAsString() + "." + simpleName;
                if (knownTypes.contains(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        // Same package
        return Optional.of(cu.get().getPackageDeclaration()
                .map(pkg -> pkg.getNameAsString() + "." + simpleName)
                .orElse(simpleName));
    }

    private static int indexOf(List<? extends Node> nodes, Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }
}
