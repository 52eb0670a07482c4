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


package dev.mars.flowscript.examples.util;

import dev.mars.flowscript.core.FlowView;
import dev.mars.flowscript.core.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Console output for the FlowScript examples.
 *
 * <p>Formatted lines go to standard output for the reader; the same events are logged through
 * SLF4J so they also appear in the Logback output.</p>
 *
 * <pre>
 * private static final ExampleLogger log = ExampleLogger.getLogger(MyExample.class);
 *
 * log.header("My Example");
 * log.step(1, "Parsing flow...");
 * log.success("Flow parsed");
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ExampleLogger {

    private static final String SYMBOL_SUCCESS = "✓";
    private static final String SYMBOL_FAILURE = "✗";
    private static final String SYMBOL_EXPECTED = "✓ EXPECTED:";
    private static final String INDENT = "   ";

    private final Logger logger;
    private final PrintStream out;

    private ExampleLogger(Class<?> clazz) {
        this.logger = LoggerFactory.getLogger(clazz);
        this.out = System.out;
    }

    public static ExampleLogger getLogger(Class<?> clazz) {
        return new ExampleLogger(clazz);
    }

    public void header(String title) {
        out.println();
        out.println("=== " + title + " ===");
        logger.info("Starting: {}", title);
    }

    public void step(int stepNumber, String description) {
        out.println(stepNumber + ". " + description);
        logger.info("Step {}: {}", stepNumber, description);
    }

    public void detail(String message) {
        out.println(INDENT + message);
        logger.debug(message);
    }

    public void success(String message) {
        out.println(INDENT + SYMBOL_SUCCESS + " " + message);
        logger.info("SUCCESS: {}", message);
    }

    public void failure(String message) {
        out.println(INDENT + SYMBOL_FAILURE + " " + message);
        logger.warn("FAILURE: {}", message);
    }

    /**
     * For failures an example provokes on purpose.
     */
    public void expectedFailure(String message, Exception e) {
        out.println(INDENT + SYMBOL_EXPECTED + " " + message + " - " + e.getMessage());
        logger.info("EXPECTED FAILURE: {} - {}", message, e.getMessage());
    }

    /**
     * Prints every statement with its status and attempt count, nested blocks indented.
     */
    public void statements(FlowView flow) {
        printStatements(flow.getMainStatements(), INDENT);
    }

    public void variables(FlowView flow) {
        flow.getVariables().values().forEach(variable ->
                out.println(INDENT + variable.getName() + " = " + variable.getValue().asText()
                        + " (" + variable.getType() + ", from " + variable.getSource() + ")"));
    }

    public void completion(String exampleName) {
        out.println();
        out.println("=== " + exampleName + " completed successfully! ===");
        logger.info("{} completed successfully", exampleName);
    }

    /**
     * For errors the example did not expect. The stack trace is only logged at debug.
     */
    public void unexpectedError(String exampleName, Exception e) {
        System.err.println("UNEXPECTED ERROR occurred during " + exampleName + " execution:");
        System.err.println("Error: " + e.getMessage());
        logger.error("Unexpected error in {}: {}", exampleName, e.getMessage());
        logger.debug("Stack trace for {}", exampleName, e);
    }

    private void printStatements(List<Statement> statements, String indent) {
        for (Statement statement : statements) {
            out.printf("%sline %-3d %-14s %-16s attempts=%d%n", indent, statement.getLineNumber(),
                    statement.getType().getCode(), statement.getStatus().getCode(), statement.getAttempts());
            printStatements(statement.getChildren(), indent + INDENT);
        }
    }
}
