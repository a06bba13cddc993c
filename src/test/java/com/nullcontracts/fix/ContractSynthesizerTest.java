package com.nullcontracts.fix;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.nullcontracts.TestSources;
import com.nullcontracts.model.Finding;
import com.nullcontracts.visitor.NotNullContractVisitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static com.nullcontracts.TestSources.IMPORTS;
import static org.junit.jupiter.api.Assertions.*;

public class ContractSynthesizerTest {

    private NotNullContractVisitor visitor;
    private ContractSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        visitor = new NotNullContractVisitor(TestSources.expressions());
        synthesizer = new ContractSynthesizer(TestSources.expressions());
    }

    private Finding single(CompilationUnit cu) {
        List<Finding> findings = visitor.analyze(cu);
        assertEquals(1, findings.size(), () -> "Expected one finding: " + findings);
        return findings.get(0);
    }

    @Test
    @DisplayName("Precondition goes after the preconditions of earlier parameters")
    void addsPreconditionAfterEarlierParameters() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                class Sample {
                    void method(@NotNull Object arg, @NotNull Object arg2) {
                        Contract.requires(arg != null);

                        arg = arg2;
                    }
                }
                """);
        String before = cu.toString();

        CompilationUnit fixed = synthesizer.apply(cu, single(cu));

        assertNotSame(cu, fixed);
        assertEquals(Arrays.asList(
                "Contract.requires(arg != null);",
                "Contract.requires(arg2 != null);",
                "arg = arg2;"), TestSources.statements(fixed, "Sample", "method"));
        assertEquals(before, cu.toString(), "input tree must not change");
        assertTrue(visitor.analyze(fixed).isEmpty());
    }

    @Test
    @DisplayName("Precondition goes before the preconditions of later parameters")
    void addsPreconditionBeforeLaterParameters() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                class Sample {
                    void method(@NotNull Object arg, @NotNull Object arg2) {
                        Contract.requires(arg2 != null);
                        arg = arg2;
                    }
                }
                """);

        CompilationUnit fixed = synthesizer.apply(cu, single(cu));

        assertEquals(Arrays.asList(
                "Contract.requires(arg != null);",
                "Contract.requires(arg2 != null);",
                "arg = arg2;"), TestSources.statements(fixed, "Sample", "method"));
    }

    @Test
    @DisplayName("Postcondition follows the preconditions and keeps the generic return type")
    void addsPostconditionWithDeclaredReturnType() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                class Sample {
                    @NotNull
                    java.util.List<String> method(@NotNull Object arg) {
                        Contract.requires(arg != null);
                        return null;
                    }
                }
                """);

        CompilationUnit fixed = synthesizer.apply(cu, single(cu));

        assertEquals(Arrays.asList(
                "Contract.requires(arg != null);",
                "Contract.ensures(Contract.<java.util.List<String>>result() != null);",
                "return null;"), TestSources.statements(fixed, "Sample", "method"));
        assertTrue(visitor.analyze(fixed).isEmpty());
    }

    @Test
    @DisplayName("Contracts of an interface member are written into its companion")
    void redirectsToContractClass() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                @ContractClass(ServiceContract.class)
                interface Service {
                    @NotNull
                    String describe(@NotNull Object subject);
                }

                @ContractClassFor(Service.class)
                abstract class ServiceContract implements Service {
                    public String describe(Object subject) {
                        return null;
                    }
                }
                """);

        List<Finding> findings = visitor.analyze(cu);
        assertEquals(2, findings.size());

        CompilationUnit fixed = synthesizer.apply(cu, findings.get(0));
        // Anchors must come from the tree being fixed
        fixed = synthesizer.apply(fixed, single(fixed));

        assertEquals(Arrays.asList(
                "Contract.requires(subject != null);",
                "Contract.ensures(Contract.<String>result() != null);",
                "return null;"), TestSources.statements(fixed, "ServiceContract", "describe"));
        MethodDeclaration declared = TestSources.method(fixed, "Service", "describe");
        assertTrue(declared.getBody().isEmpty());
        assertTrue(visitor.analyze(fixed).isEmpty());
    }

    @Test
    @DisplayName("Invariant is appended to the invariant method")
    void appendsInvariant() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                class Sample {
                    @NotNull
                    private Object first = new Object();
                    @NotNull
                    private Object second = new Object();

                    @ContractInvariantMethod
                    private void invariant() {
                        Contract.invariant(first != null);
                    }
                }
                """);

        CompilationUnit fixed = synthesizer.apply(cu, single(cu));

        assertEquals(Arrays.asList(
                "Contract.invariant(first != null);",
                "Contract.invariant(second != null);"), TestSources.statements(fixed, "Sample", "invariant"));
    }

    @Test
    @DisplayName("The contract import is added once")
    void addsImportOnce() {
        CompilationUnit cu = TestSources.parse("""
                package test;

                import com.nullcontracts.annotations.NotNull;

                class Sample {
                    void method(@NotNull Object arg, @NotNull Object arg2) {
                    }
                }
                """);

        CompilationUnit once = synthesizer.apply(cu, visitor.analyze(cu).get(0));
        CompilationUnit twice = synthesizer.apply(once, visitor.analyze(once).get(0));

        long imports = twice.getImports().stream()
                .map(ImportDeclaration::getNameAsString)
                .filter("com.nullcontracts.contracts.Contract"::equals)
                .count();
        assertEquals(1, imports);
        assertEquals(Arrays.asList(
                "Contract.requires(arg != null);",
                "Contract.requires(arg2 != null);"), TestSources.statements(twice, "Sample", "method"));
        assertTrue(cu.getImports().stream()
                .noneMatch(i -> i.getNameAsString().equals("com.nullcontracts.contracts.Contract")));
    }

    @Test
    @DisplayName("Unfixable, foreign or unsupported anchors leave the tree as is")
    void returnsInputWhenNothingCanBeInserted() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                interface Plain {
                    @NotNull
                    Object method(@NotNull Object arg);
                }
                """);
        MethodDeclaration bodiless = TestSources.method(cu, "Plain", "method");

        assertSame(cu, synthesizer.apply(cu, bodiless));
        assertSame(cu, synthesizer.apply(cu, bodiless.getParameter(0)));
        assertSame(cu, synthesizer.apply(cu, TestSources.type(cu, "Plain")));

        CompilationUnit other = TestSources.parse(IMPORTS + """
                class Sample {
                    void method(@NotNull Object arg) {
                    }
                }
                """);
        assertSame(cu, synthesizer.apply(cu, TestSources.method(other, "Sample", "method").getParameter(0)));
    }

    @Test
    @DisplayName("Generic companion gets contracts written with its own type variables")
    void redirectsToGenericContractClass() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                @ContractClass(RepoContract.class)
                interface Repo<T> {
                    @NotNull
                    java.util.List<T> all();

                    void save(@NotNull T item);
                }

                @ContractClassFor(Repo.class)
                abstract class RepoContract<E> implements Repo<E> {
                    public java.util.List<E> all() {
                        return null;
                    }

                    public void save(E item) {
                    }
                }
                """);

        List<Finding> findings = visitor.analyze(cu);
        assertEquals(2, findings.size(), () -> "Expected findings for all and item: " + findings);

        CompilationUnit fixed = synthesizer.apply(cu, findings.get(0));
        fixed = synthesizer.apply(fixed, single(fixed));

        assertEquals(Arrays.asList(
                "Contract.ensures(Contract.<java.util.List<E>>result() != null);",
                "return null;"), TestSources.statements(fixed, "RepoContract", "all"));
        assertEquals(Arrays.asList("Contract.requires(item != null);"),
                TestSources.statements(fixed, "RepoContract", "save"));
        assertTrue(visitor.analyze(fixed).isEmpty());
    }

    @Test
    @DisplayName("Postcondition uses the return type as the companion spells it")
    void postconditionUsesCompanionReturnType() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                @ContractClass(NamesContract.class)
                interface Names<T extends CharSequence> {
                    @NotNull
                    T first();
                }

                @ContractClassFor(Names.class)
                abstract class NamesContract implements Names<String> {
                    public String first() {
                        return null;
                    }
                }
                """);

        CompilationUnit fixed = synthesizer.apply(cu, single(cu));

        assertEquals(Arrays.asList(
                "Contract.ensures(Contract.<String>result() != null);",
                "return null;"), TestSources.statements(fixed, "NamesContract", "first"));
        assertTrue(visitor.analyze(fixed).isEmpty());
    }

    @Test
    @DisplayName("Invariant names the field through this when a local shadows it")
    void invariantQualifiesShadowedField() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                class Sample {
                    @NotNull
                    private Object value = new Object();

                    @ContractInvariantMethod
                    private void invariant() {
                        Object value = this.value;
                    }
                }
                """);

        CompilationUnit fixed = synthesizer.apply(cu, single(cu));

        assertEquals(Arrays.asList(
                "Object value = this.value;",
                "Contract.invariant(this.value != null);"), TestSources.statements(fixed, "Sample", "invariant"));
        assertTrue(visitor.analyze(fixed).isEmpty());
    }

    @Test
    @DisplayName("The contract class is written in full when its simple name is taken")
    void qualifiesContractClassOnImportClash() {
        CompilationUnit cu = TestSources.parse("""
                package test;

                import com.nullcontracts.annotations.NotNull;
                import org.example.validation.Contract;

                class Sample {
                    @NotNull
                    Object method(@NotNull Object arg) {
                        return arg;
                    }
                }
                """);

        CompilationUnit fixed = synthesizer.apply(cu, visitor.analyze(cu).get(0));
        fixed = synthesizer.apply(fixed, visitor.analyze(fixed).get(0));

        assertEquals(Arrays.asList(
                "com.nullcontracts.contracts.Contract.requires(arg != null);",
                "com.nullcontracts.contracts.Contract.ensures("
                        + "com.nullcontracts.contracts.Contract.<Object>result() != null);",
                "return arg;"), TestSources.statements(fixed, "Sample", "method"));
        assertEquals(Arrays.asList("com.nullcontracts.annotations.NotNull", "org.example.validation.Contract"),
                fixed.getImports().stream().map(ImportDeclaration::getNameAsString).collect(Collectors.toList()));
        assertTrue(visitor.analyze(fixed).isEmpty());
    }

    @Test
    @DisplayName("In-place insertion edits the given tree")
    void appliesInPlace() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                class Sample {
                    void method(@NotNull Object arg) {
                    }
                }
                """);
        Finding finding = single(cu);

        assertTrue(synthesizer.applyInPlace(cu, finding.getAnchor()));

        assertEquals(Arrays.asList("Contract.requires(arg != null);"),
                TestSources.statements(cu, "Sample", "method"));
        assertFalse(synthesizer.applyInPlace(cu, TestSources.type(cu, "Sample")));
    }
}
