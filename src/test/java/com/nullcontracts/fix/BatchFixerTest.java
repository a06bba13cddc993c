package com.nullcontracts.fix;

import com.github.javaparser.ast.CompilationUnit;
import com.nullcontracts.TestSources;
import com.nullcontracts.visitor.NotNullContractVisitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.nullcontracts.TestSources.IMPORTS;
import static org.junit.jupiter.api.Assertions.*;

public class BatchFixerTest {

    private static final String SOURCE = IMPORTS + """
            @ContractClass(RepositoryContract.class)
            interface Repository {
                @NotNull
                String find(@NotNull String key, @NotNull String fallback);
            }

            @ContractClassFor(Repository.class)
            abstract class RepositoryContract implements Repository {
                public String find(String key, String fallback) {
                    return null;
                }
            }

            class Cache {
                @NotNull
                private String name = "cache";

                Cache(@NotNull String name) {
                    this.name = name;
                }

                @NotNull
                String lookup(@NotNull String key, int attempts) {
                    Contract.requires(key != null);
                    return key;
                }

                @ContractInvariantMethod
                private void invariant() {
                }
            }
            """;

    private BatchFixer fixer;

    @BeforeEach
    void setUp() {
        fixer = new BatchFixer(TestSources.expressions());
    }

    @Test
    @DisplayName("Every fixable finding is fixed in one pass")
    void fixesEverything() {
        CompilationUnit cu = TestSources.parse(SOURCE);

        CompilationUnit fixed = fixer.fixAll(cu);

        assertEquals(6, fixer.getLastFixCount());
        assertTrue(new NotNullContractVisitor(TestSources.expressions()).analyze(fixed).isEmpty());
        assertEquals(Arrays.asList(
                "Contract.requires(key != null);",
                "Contract.requires(fallback != null);",
                "Contract.ensures(Contract.<String>result() != null);",
                "return null;"), TestSources.statements(fixed, "RepositoryContract", "find"));
        assertEquals(Arrays.asList(
                "Contract.requires(key != null);",
                "Contract.ensures(Contract.<String>result() != null);",
                "return key;"), TestSources.statements(fixed, "Cache", "lookup"));
        assertEquals(Arrays.asList("Contract.invariant(name != null);"),
                TestSources.statements(fixed, "Cache", "invariant"));
    }

    @Test
    @DisplayName("A fixed document is returned unchanged")
    void fixingTwiceIsIdempotent() {
        CompilationUnit fixed = fixer.fixAll(TestSources.parse(SOURCE));
        String printed = fixed.toString();

        CompilationUnit again = fixer.fixAll(fixed);

        assertSame(fixed, again);
        assertEquals(0, fixer.getLastFixCount());
        assertEquals(printed, again.toString());
    }

    @Test
    @DisplayName("Unfixable subjects do not stop the loop")
    void ignoresUnfixable() {
        CompilationUnit cu = TestSources.parse(IMPORTS + """
                interface Plain {
                    @NotNull
                    Object method(@NotNull Object arg);
                }
                """);

        assertSame(cu, fixer.fixAll(cu));
        assertEquals(0, fixer.getLastFixCount());
    }

    @Test
    @DisplayName("In-place fixing edits the parsed tree and counts the insertions")
    void fixesInPlace() {
        CompilationUnit cu = TestSources.parse(SOURCE);

        int fixes = fixer.fixInPlace(cu);

        assertEquals(6, fixes);
        assertEquals(6, fixer.getLastFixCount());
        assertTrue(new NotNullContractVisitor(TestSources.expressions()).analyze(cu).isEmpty());
        assertEquals(Arrays.asList("Contract.invariant(name != null);"),
                TestSources.statements(cu, "Cache", "invariant"));

        assertEquals(0, fixer.fixInPlace(cu));
    }
}
