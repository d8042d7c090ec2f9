package com.example.inkbatch;

import com.example.inkbatch.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar ink-batch.jar <config.json>");
            System.exit(BatchResult.EXIT_CRITICAL);
        }
        System.exit(run(Path.of(args[0])));
    }

    static int run(Path configPath) throws Exception {
        BatchConfig config;
        try {
            config = new ConfigLoader().load(configPath);
        } catch (ValidationException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return BatchResult.EXIT_CRITICAL;
        }
        BatchDriver driver = new BatchDriver(config, new LoggingProgressSink(config.verbose()));
        BatchResult result;
        try {
            result = driver.run();
        } catch (ValidationException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return BatchResult.EXIT_CRITICAL;
        }
        LOGGER.info("Finished: {} succeeded, {} failed, {} skipped (exit code {}).",
                result.succeeded(), result.failed(), result.skipped(), result.exitCode());
        return result.exitCode();
    }
}
