package com.nullcontracts.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedValueDeclaration;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link SymbolResolver} backed by the JavaParser symbol solver.
 * Classes are looked up through reflection on the current class path and,
 * optionally, through the given source roots.
 */
public class JavaSymbolSolverResolver implements SymbolResolver {

    private static final Logger logger = LoggerFactory.getLogger(JavaSymbolSolverResolver.class);

    private final JavaSymbolSolver symbolSolver;

    public JavaSymbolSolverResolver() {
        this(Collections.emptyList());
    }

    public JavaSymbolSolverResolver(List<Path> sourceRoots) {
        CombinedTypeSolver typeSolver = new CombinedTypeSolver(new ReflectionTypeSolver(false));
        for (Path root : sourceRoots) {
            typeSolver.add(new JavaParserTypeSolver(root));
        }
        this.symbolSolver = new JavaSymbolSolver(typeSolver);
    }

    public JavaSymbolSolver getSymbolSolver() {
        return symbolSolver;
    }

    @Override
    public Optional<String> resolveMethod(MethodCallExpr call) {
        ensureInjected(call);
        try {
            ResolvedMethodDeclaration method = call.resolve();
            return Optional.of(method.getQualifiedName());
        } catch (RuntimeException e) {
            logger.debug("Unresolved call {}: {}", call, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<Node> resolveDeclaration(NameExpr name) {
        ensureInjected(name);
        try {
            ResolvedValueDeclaration value = name.resolve();
            Optional<? extends Node> ast = value.toAst();
            return ast.map(node -> normalize(node, name.getNameAsString()));
        } catch (RuntimeException e) {
            logger.debug("Unresolved name {}: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<TypeDeclaration<?>> resolveType(ClassOrInterfaceType type) {
        ensureInjected(type);
        Optional<CompilationUnit> cu = type.findCompilationUnit();
        if (cu.isEmpty()) {
            return Optional.empty();
        }
        String qualified;
        try {
            ResolvedType resolved = type.resolve();
            if (!resolved.isReferenceType()) {
                return Optional.empty();
            }
            qualified = resolved.asReferenceType().getQualifiedName();
        } catch (RuntimeException e) {
            logger.debug("Unresolved type {}: {}", type, e.getMessage());
            return Optional.empty();
        }
        for (TypeDeclaration<?> candidate : cu.get().findAll(TypeDeclaration.class)) {
            if (candidate.getFullyQualifiedName().map(qualified::equals).orElse(false)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Fields resolve to their declaration; callers compare against the variable.
     */
    private Node normalize(Node node, String identifier) {
        if (node instanceof FieldDeclaration) {
            for (VariableDeclarator variable : ((FieldDeclaration) node).getVariables()) {
                if (variable.getNameAsString().equals(identifier)) {
                    return variable;
                }
            }
        }
        return node;
    }

    /**
     * Trees produced by cloning do not carry the solver; attach it on first use.
     */
    private void ensureInjected(Node node) {
        node.findCompilationUnit().ifPresent(cu -> {
            if (!cu.containsData(Node.SYMBOL_RESOLVER_KEY)) {
                symbolSolver.inject(cu);
            }
        });
    }
}
