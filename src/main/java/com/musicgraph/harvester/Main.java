package com.musicgraph.harvester;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the similar-artist harvester.
 * Discovers artists related to one or more seeds and downloads their top tracks into a
 * content-addressed local cache, with resumable per-session progress.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = HarvestCommand.newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Switches the Logback root logger to DEBUG.
     */
    static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
            logger.debug("Debug logging enabled");
        } else {
            logger.warn("Logging backend is not Logback; --verbose has no effect");
        }
    }
}
