package com.nullcontracts.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.nullcontracts.TestSources;
import com.nullcontracts.config.ContractConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeSymbolResolverTest {

    private ScopeSymbolResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ScopeSymbolResolver(new ContractConfiguration());
    }

    private static MethodCallExpr call(CompilationUnit cu, String text) {
        return cu.findFirst(MethodCallExpr.class, c -> c.toString().equals(text)).orElseThrow();
    }

    private static NameExpr name(MethodCallExpr call, String identifier) {
        return call.findFirst(NameExpr.class, n -> n.getNameAsString().equals(identifier)).orElseThrow();
    }

    @Test
    @DisplayName("Static calls qualify through single imports, on-demand imports and the package")
    void resolvesScopedCalls() {
        CompilationUnit cu = TestSources.parse("""
                package test;

                import java.util.Objects;
                import com.nullcontracts.contracts.*;

                class Sample {
                    void method(Object arg) {
                        Objects.requireNonNull(arg);
                        Contract.requires(arg != null);
                        Helper.run();
                        com.nullcontracts.contracts.Contract.invariant(true);
                    }
                }
                """);

        assertEquals(Optional.of("java.util.Objects.requireNonNull"),
                resolver.resolveMethod(call(cu, "Objects.requireNonNull(arg)")));
        assertEquals(Optional.of("com.nullcontracts.contracts.Contract.requires"),
                resolver.resolveMethod(call(cu, "Contract.requires(arg != null)")));
        assertEquals(Optional.of("test.Helper.run"), resolver.resolveMethod(call(cu, "Helper.run()")));
        assertEquals(Optional.of("com.nullcontracts.contracts.Contract.invariant"),
                resolver.resolveMethod(call(cu, "com.nullcontracts.contracts.Contract.invariant(true)")));
    }

    @Test
    @DisplayName("A variable named like a type is not a type")
    void variableScopeIsNotAType() {
        CompilationUnit cu = TestSources.parse("""
                package test;

                import com.nullcontracts.contracts.Contract;

                class Sample {
                    void method(Checker Contract) {
                        Contract.requires(true);
                    }
                }
                """);

        assertTrue(resolver.resolveMethod(call(cu, "Contract.requires(true)")).isEmpty());
    }

    @Test
    @DisplayName("Unscoped calls prefer enclosing members over static imports")
    void resolvesUnscopedCalls() {
        CompilationUnit cu = TestSources.parse("""
                package test;

                import static com.nullcontracts.contracts.Contract.requires;
                import static com.nullcontracts.contracts.Contract.*;

                class Sample {
                    void method(Object arg) {
                        requires(arg != null);
                        invariant(arg != null);
                    }
                }

                class Shadowing {
                    void method(Object arg) {
                        requires(arg != null);
                    }

                    static void requires(boolean condition) {
                    }
                }
                """);

        MethodCallExpr imported = cu.findAll(MethodCallExpr.class).get(0);
        assertEquals(Optional.of("com.nullcontracts.contracts.Contract.requires"), resolver.resolveMethod(imported));
        assertEquals(Optional.of("com.nullcontracts.contracts.Contract.invariant"),
                resolver.resolveMethod(call(cu, "invariant(arg != null)")));

        MethodCallExpr shadowed = cu.findAll(MethodCallExpr.class).get(2);
        assertEquals(Optional.of("test.Shadowing.requires"), resolver.resolveMethod(shadowed));
    }

    @Test
    @DisplayName("Names resolve to the innermost visible declaration")
    void resolvesDeclarations() {
        CompilationUnit cu = TestSources.parse("""
                package test;

                class Sample {
                    private Object value;

                    void method(Object value, Object other) {
                        use(value);
                        use(other);
                        Object local = other;
                        use(local);
                        for (String item : java.util.List.of("a")) {
                            use(item);
                        }
                        use(missing);
                    }

                    void field() {
                        use(value);
                    }

                    void use(Object o) {
                    }
                }
                """);

        Parameter parameter = TestSources.method(cu, "Sample", "method").getParameter(0);
        Parameter otherParameter = TestSources.method(cu, "Sample", "method").getParameter(1);
        List<MethodCallExpr> uses = cu.findAll(MethodCallExpr.class, c -> c.getNameAsString().equals("use"));

        assertSame(parameter, resolver.resolveDeclaration(name(uses.get(0), "value")).orElseThrow());
        assertSame(otherParameter, resolver.resolveDeclaration(name(uses.get(1), "other")).orElseThrow());

        Node local = resolver.resolveDeclaration(name(uses.get(2), "local")).orElseThrow();
        assertTrue(local instanceof VariableDeclarator);
        assertEquals("local = other", local.toString());

        Node item = resolver.resolveDeclaration(name(uses.get(3), "item")).orElseThrow();
        assertEquals("item", ((VariableDeclarator) item).getNameAsString());

        assertTrue(resolver.resolveDeclaration(name(uses.get(4), "missing")).isEmpty());

        Node field = resolver.resolveDeclaration(name(uses.get(5), "value")).orElseThrow();
        assertTrue(field instanceof VariableDeclarator);
        assertSame(TestSources.type(cu, "Sample").getFieldByName("value").orElseThrow().getVariable(0), field);
    }

    @Test
    @DisplayName("Types resolve to declarations of the same document")
    void resolvesTypes() {
        CompilationUnit cu = TestSources.parse("""
                package test;

                class Outer {
                    static class Inner {
                    }
                }

                class Sample extends Outer.Inner implements Runnable {
                    public void run() {
                    }
                }
                """);
        ClassOrInterfaceType extended = TestSources.type(cu, "Sample").asClassOrInterfaceDeclaration()
                .getExtendedTypes(0);
        ClassOrInterfaceType implemented = TestSources.type(cu, "Sample").asClassOrInterfaceDeclaration()
                .getImplementedTypes(0);

        assertSame(TestSources.type(cu, "Inner"), resolver.resolveType(extended).orElseThrow());
        assertTrue(resolver.resolveType(implemented).isEmpty());
    }
}
