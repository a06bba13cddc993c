package com.nullcontracts.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;

import java.util.Optional;

/**
 * Semantic lookups the analysis depends on. Implementations answer
 * "unresolved" with an empty result and never throw.
 */
public interface SymbolResolver {

    /**
     * Resolves the method a call binds to.
     *
     * @param call The call expression
     * @return The qualified method name, e.g. {@code com.nullcontracts.contracts.Contract.requires}
     */
    Optional<String> resolveMethod(MethodCallExpr call);

    /**
     * Resolves a simple name to the node declaring it: a {@code Parameter},
     * or the {@code VariableDeclarator} of a field or local variable.
     *
     * @param name The name expression
     * @return The declaring node, in the same tree as {@code name}
     */
    Optional<Node> resolveDeclaration(NameExpr name);

    /**
     * Resolves a type reference to its declaration within the same compilation unit.
     *
     * @param type The type reference
     * @return The type declaration
     */
    Optional<TypeDeclaration<?>> resolveType(ClassOrInterfaceType type);
}
