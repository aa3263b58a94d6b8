/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.taskflow.examples.util;

import java.io.PrintStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Console output helper for the Taskflow examples.
 *
 * <p>Prints formatted, indented progress to the console and mirrors each line to
 * java.util.logging, so a run can also be captured through a logging configuration.
 *
 * <p>Usage:
 * <pre>
 * private static final ExampleLogger log = ExampleLogger.getLogger(MyExample.class);
 *
 * log.exampleStart("My Example");
 * log.section("Scenario 1");
 * log.success("fetch completed");
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 2.0
 */
public class ExampleLogger {

    private final Logger logger;
    private final PrintStream out;
    private final PrintStream err;

    private static final String SYMBOL_SUCCESS = "✓";
    private static final String SYMBOL_FAILURE = "✗";
    private static final String SYMBOL_WARNING = "⚠";

    private static final String INDENT = "   ";

    private ExampleLogger(Class<?> clazz) {
        this.logger = Logger.getLogger(clazz.getName());
        this.out = System.out;
        this.err = System.err;
        configureLogger();
    }

    public static ExampleLogger getLogger(Class<?> clazz) {
        return new ExampleLogger(clazz);
    }

    /**
     * Routes the underlying logger through a one-line formatter, unless a handler
     * was already configured for it.
     */
    private void configureLogger() {
        if (logger.getHandlers().length == 0) {
            Handler consoleHandler = new ConsoleHandler();
            consoleHandler.setFormatter(new SimpleExampleFormatter());
            consoleHandler.setLevel(Level.WARNING);
            logger.addHandler(consoleHandler);
            logger.setUseParentHandlers(false);
        }
    }

    // ========== Header/Section Methods ==========

    /**
     * Print a major section header.
     * Example: === My Example ===
     */
    public void header(String title) {
        out.println();
        out.println("=== " + title + " ===");
        logger.info("Starting: " + title);
    }

    /**
     * Print a minor section header.
     * Example: --- Sub Section ---
     */
    public void section(String title) {
        out.println();
        out.println("--- " + title + " ---");
        logger.fine("Section: " + title);
    }

    public void separator() {
        out.println("─".repeat(60));
    }

    // ========== Standard Logging Methods ==========

    public void info(String message) {
        out.println(message);
        logger.info(message);
    }

    public void detail(String message) {
        out.println(INDENT + message);
        logger.fine(message);
    }

    public void blank() {
        out.println();
    }

    // ========== Status Methods ==========

    public void success(String message) {
        out.println(INDENT + SYMBOL_SUCCESS + " " + message);
        logger.info("SUCCESS: " + message);
    }

    public void failure(String message) {
        out.println(INDENT + SYMBOL_FAILURE + " " + message);
        logger.warning("FAILURE: " + message);
    }

    public void warning(String message) {
        out.println(INDENT + SYMBOL_WARNING + " " + message);
        logger.warning(message);
    }

    // ========== Key-Value and List Methods ==========

    public void keyValue(String key, Object value) {
        out.println(INDENT + key + ": " + value);
        logger.fine(key + "=" + value);
    }

    public void listItem(String item) {
        out.println(INDENT + "- " + item);
        logger.fine("  - " + item);
    }

    // ========== Error Methods ==========

    /**
     * Print an error message with exception details to stderr.
     */
    public void error(String message, Throwable t) {
        err.println("ERROR: " + message + ": " + t.getMessage());
        logger.log(Level.SEVERE, message, t);
    }

    /**
     * Print an unexpected error, i.e. one that is not part of a demonstrated scenario.
     */
    public void unexpectedError(String context, Throwable t) {
        err.println();
        err.println("UNEXPECTED ERROR occurred during " + context + ":");
        err.println("Error: " + t.getMessage());
        err.println("This indicates a real problem with the example execution.");
        logger.log(Level.SEVERE, "Unexpected error in " + context, t);
    }

    // ========== Example Lifecycle ==========

    public void exampleStart(String exampleName, String description) {
        header("Taskflow " + exampleName);
        detail(description);
        logger.info("Example started: " + exampleName + " - " + description);
    }

    public void exampleComplete(String exampleName) {
        out.println();
        out.println("=== " + exampleName + " completed successfully! ===");
        logger.info("Example completed: " + exampleName);
    }

    /**
     * Formatter for the mirrored log records: level, simple class name, message.
     */
    private static class SimpleExampleFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            return String.format("[%s] %s: %s%n",
                    record.getLevel().getName(),
                    record.getLoggerName().substring(record.getLoggerName().lastIndexOf('.') + 1),
                    record.getMessage());
        }
    }
}
