package com.nullcontracts.config;

import com.github.javaparser.ParserConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ContractConfigurationTest {

    @Test
    @DisplayName("Bundled defaults name the contract API")
    void loadsDefaults() {
        ContractConfiguration config = ContractConfiguration.load();

        assertEquals("com.nullcontracts.contracts.Contract", config.getContractClassName());
        assertEquals("Contract", config.getContractClassSimpleName());
        assertEquals("com.nullcontracts.contracts", config.getContractPackage());
        assertEquals(new LinkedHashSet<>(Arrays.asList("NotNull", "NonNull", "Nonnull")),
                config.getNotNullAnnotations());
        assertEquals(ContractConfiguration.ResolverKind.SCOPE, config.getResolverKind());
        assertEquals(ParserConfiguration.LanguageLevel.JAVA_17, config.getLanguageLevel());
        assertFalse(config.isExportMetrics());
        assertTrue(config.getThreads() >= 1);
    }

    @Test
    @DisplayName("A properties file overrides the defaults")
    void loadsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.properties");
        Files.writeString(file, String.join("\n",
                "notNullAnnotations = NonNull, , Required",
                "contractClassName=Checks",
                "threads=3",
                "resolver=SYMBOL_SOLVER",
                "exportMetrics=true",
                "unknown=ignored"));

        ContractConfiguration config = ContractConfiguration.load(file);

        assertEquals(new LinkedHashSet<>(Arrays.asList("NonNull", "Required")), config.getNotNullAnnotations());
        assertEquals("Checks", config.getContractClassSimpleName());
        assertEquals("", config.getContractPackage());
        assertEquals(3, config.getThreads());
        assertEquals(ContractConfiguration.ResolverKind.SYMBOL_SOLVER, config.getResolverKind());
        assertTrue(config.isExportMetrics());
        assertEquals("requires", config.getRequiresMethod());
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void rejectsInvalidValues() {
        Properties threads = new Properties();
        threads.setProperty("threads", "0");
        assertThrows(IllegalArgumentException.class, () -> new ContractConfiguration().apply(threads));

        Properties resolver = new Properties();
        resolver.setProperty("resolver", "NONE");
        assertThrows(IllegalArgumentException.class, () -> new ContractConfiguration().apply(resolver));
    }
}
