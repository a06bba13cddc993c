package com.nullcontracts.config;

import com.github.javaparser.ParserConfiguration;
import com.nullcontracts.model.ContractKind;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings for analysis and fixing: which names count as markers, where the
 * contract API lives and how documents are parsed and processed.
 */
@Getter
@Setter
@ToString
public class ContractConfiguration {

    public static final String RESOURCE_NAME = "null-contracts.properties";

    public enum ResolverKind { SCOPE, SYMBOL_SOLVER }

    private Set<String> notNullAnnotations = new LinkedHashSet<>(Arrays.asList("NotNull", "NonNull", "Nonnull"));
    private String contractClassName = "com.nullcontracts.contracts.Contract";
    private String requiresMethod = "requires";
    private String ensuresMethod = "ensures";
    private String invariantMethod = "invariant";
    private String resultMethod = "result";
    private String invariantMethodAnnotation = "ContractInvariantMethod";
    private String contractClassAnnotation = "ContractClass";
    private String contractClassForAnnotation = "ContractClassFor";
    private ParserConfiguration.LanguageLevel languageLevel = ParserConfiguration.LanguageLevel.JAVA_17;
    private int threads = Runtime.getRuntime().availableProcessors();
    private ResolverKind resolverKind = ResolverKind.SCOPE;
    private boolean exportMetrics = false;

    /**
     * Defaults, overridden by {@value #RESOURCE_NAME} when it is on the classpath.
     */
    public static ContractConfiguration load() {
        ContractConfiguration config = new ContractConfiguration();
        try (InputStream in = ContractConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                config.apply(props);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE_NAME, e);
        }
        return config;
    }

    /**
     * Classpath defaults overridden by the given properties file.
     *
     * @param file The properties file
     * @return The merged configuration
     * @throws IOException If the file cannot be read
     */
    public static ContractConfiguration load(Path file) throws IOException {
        ContractConfiguration config = load();
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        config.apply(props);
        return config;
    }

    /**
     * Applies the recognized keys; unknown keys are ignored.
     */
    public void apply(Properties props) {
        String names = props.getProperty("notNullAnnotations");
        if (names != null) {
            notNullAnnotations = Arrays.stream(names.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }
        contractClassName = props.getProperty("contractClassName", contractClassName);
        requiresMethod = props.getProperty("requiresMethod", requiresMethod);
        ensuresMethod = props.getProperty("ensuresMethod", ensuresMethod);
        invariantMethod = props.getProperty("invariantMethod", invariantMethod);
        resultMethod = props.getProperty("resultMethod", resultMethod);
        invariantMethodAnnotation = props.getProperty("invariantMethodAnnotation", invariantMethodAnnotation);
        contractClassAnnotation = props.getProperty("contractClassAnnotation", contractClassAnnotation);
        contractClassForAnnotation = props.getProperty("contractClassForAnnotation", contractClassForAnnotation);

        String level = props.getProperty("languageLevel");
        if (level != null) {
            languageLevel = ParserConfiguration.LanguageLevel.valueOf(level.trim());
        }
        String threadCount = props.getProperty("threads");
        if (threadCount != null) {
            int parsed = Integer.parseInt(threadCount.trim());
            if (parsed < 1) {
                throw new IllegalArgumentException("threads must be positive: " + parsed);
            }
            threads = parsed;
        }
        String resolver = props.getProperty("resolver");
        if (resolver != null) {
            resolverKind = ResolverKind.valueOf(resolver.trim());
        }
        String metrics = props.getProperty("exportMetrics");
        if (metrics != null) {
            exportMetrics = Boolean.parseBoolean(metrics.trim());
        }
    }

    /**
     * Name of the contract API method for the given kind.
     */
    public String getMethodName(ContractKind kind) {
        switch (kind) {
            case REQUIRES:
                return requiresMethod;
            case ENSURES:
                return ensuresMethod;
            case INVARIANT:
                return invariantMethod;
            default:
                throw new IllegalArgumentException("Unknown contract kind: " + kind);
        }
    }

    /**
     * Simple name of the contract class, as written in synthesized statements.
     */
    public String getContractClassSimpleName() {
        int dot = contractClassName.lastIndexOf('.');
        return dot < 0 ? contractClassName : contractClassName.substring(dot + 1);
    }

    /**
     * Package of the contract class, empty for the default package.
     */
    public String getContractPackage() {
        int dot = contractClassName.lastIndexOf('.');
        return dot < 0 ? "" : contractClassName.substring(0, dot);
    }
}
