package com.nullcontracts;

import com.nullcontracts.config.ContractConfiguration;
import com.nullcontracts.processor.CodebaseProcessor;
import com.nullcontracts.processor.ProcessingSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: reports, and with {@code --fix} inserts, the
 * contract statements missing for {@code @NotNull} annotations.
 */
public class NullContractsApp {

    private static final Logger logger = LoggerFactory.getLogger(NullContractsApp.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the tool.
     *
     * @param args {@code <path> [--fix] [--config <file>]}
     * @return Process exit code
     */
    static int run(String[] args) {
        if (args.length < 1) {
            printUsage();
            return 1;
        }

        String codebasePath = null;
        String configPath = null;
        boolean fix = false;
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("--fix")) {
                fix = true;
            } else if (args[i].equals("--config") && i + 1 < args.length) {
                configPath = args[++i];
            } else if (codebasePath == null && !args[i].startsWith("--")) {
                codebasePath = args[i];
            } else {
                printUsage();
                return 1;
            }
        }
        if (codebasePath == null) {
            printUsage();
            return 1;
        }

        logger.info("Starting null contract check");
        logger.info("Target codebase: {}", codebasePath);

        try {
            ContractConfiguration config = configPath == null
                    ? ContractConfiguration.load()
                    : ContractConfiguration.load(Paths.get(configPath));
            Path path = Paths.get(codebasePath);
            ProcessingSummary summary = new CodebaseProcessor(config).processCodebase(path, fix);
            logger.info("Processing complete: {}", summary);
            return 0;
        } catch (Exception e) {
            logger.error("Error processing codebase", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar null-contracts.jar <path-to-java-codebase> [--fix] [--config <file>]");
        System.err.println("Example: java -jar null-contracts.jar /path/to/project/src --fix");
    }
}
