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


package dev.mars.flowscript.workflow;

import dev.mars.flowscript.core.FlowModel;
import dev.mars.flowscript.core.FlowValue;
import dev.mars.flowscript.core.Statement;
import dev.mars.flowscript.core.StepDefinition;
import dev.mars.flowscript.core.VariableInfo;
import dev.mars.flowscript.core.exceptions.FlowParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Line-oriented implementation of {@link FlowSourceParser}.
 *
 * <p>The first pass collects the input block, step declarations and the extent of
 * {@code func main()}; the main body is parsed afterwards so that calls can be checked against
 * every declared step regardless of declaration order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class SimpleFlowSourceParser implements FlowSourceParser {

    private static final Logger logger = LoggerFactory.getLogger(SimpleFlowSourceParser.class);

    private static final Pattern MAIN_FUNCTION = Pattern.compile("^func\\s+main\\s*\\(\\s*\\)");

    private final InputLiteralParser inputParser = new InputLiteralParser();
    private final StepDeclarationParser stepParser = new StepDeclarationParser();
    private final StatementParser statementParser = new StatementParser();

    @Override
    public FlowModel parse(String source) {
        return parse(FlowSourceParser.generateFlowId(), source);
    }

    @Override
    public FlowModel parse(Path sourceFile) throws FlowParseException {
        try {
            String source = Files.readString(sourceFile, StandardCharsets.UTF_8);
            return parse(source);
        } catch (IOException e) {
            throw new FlowParseException("Failed to read flow source: " + sourceFile, e);
        }
    }

    @Override
    public FlowModel parse(String flowId, String source) {
        ParseState state = new ParseState(flowId);
        if (source == null || source.isBlank()) {
            return failure(state, "empty flow source");
        }

        List<String> lines = Arrays.asList(source.split("\\r?\n", -1));
        Map<String, FlowValue> inputVars = new LinkedHashMap<>();
        int mainStart = -1;
        int mainEnd = -1;

        int index = 0;
        while (index < lines.size()) {
            String text = SourceScanner.stripComment(lines.get(index)).trim();
            if (text.isEmpty()) {
                index++;
                continue;
            }

            if (inputParser.isInputDeclaration(text)) {
                InputLiteralParser.InputBlock block;
                try {
                    block = inputParser.parse(lines, index, state);
                } catch (FlowParseException e) {
                    return failure(state, e.getMessage());
                }
                block.values().forEach((key, value) -> {
                    inputVars.put(key, value);
                    state.registerVariable(VariableInfo.input(key, value));
                });
                index = block.endLine() + 1;
            } else if (MAIN_FUNCTION.matcher(text).lookingAt()) {
                int end = SourceScanner.findBlockEnd(lines, index);
                if (end < 0) {
                    return failure(state, String.format("line %d: unterminated main block", index + 1));
                }
                if (mainStart >= 0) {
                    state.warn(index + 1, "duplicate func main() ignored");
                } else {
                    mainStart = index;
                    mainEnd = end;
                }
                index = end + 1;
            } else if (stepParser.isDeclaration(text)) {
                int lineNumber = index + 1;
                String desc = SourceScanner.extractDescription(lines, index);
                stepParser.parse(lines.get(index), lineNumber, desc, state)
                        .ifPresent(step -> state.addStep(step, lineNumber));
                index++;
            } else {
                index++;
            }
        }

        if (mainStart < 0) {
            return failure(state, "missing func main()");
        }

        List<Statement> statements;
        if (mainStart == mainEnd) {
            String text = SourceScanner.stripComment(lines.get(mainStart));
            int open = text.indexOf('{');
            String body = text.substring(open + 1, SourceScanner.findClosing(text, open));
            statements = new ArrayList<>();
            for (String part : SourceScanner.splitTopLevel(body, ';')) {
                statementParser.parseLine(part, mainStart + 1, "", state).ifPresent(statements::add);
            }
        } else {
            statements = statementParser.parseBlock(lines, mainStart + 1, mainEnd, state);
        }
        if (statements.isEmpty()) {
            return failure(state, "main function has no statements");
        }

        List<StepDefinition> steps = state.getSteps();
        logger.debug("Parsed flow {}: {} step(s), {} statement(s), {} warning(s)",
                flowId, steps.size(), statements.size(), state.getLogs().size());

        return FlowModel.builder()
                .flowId(flowId)
                .inputVars(inputVars)
                .steps(steps)
                .mainStatements(statements)
                .variables(state.getVariables())
                .globalLogs(state.getLogs())
                .success(true)
                .build();
    }

    private static FlowModel failure(ParseState state, String error) {
        logger.warn("Flow {} failed to parse: {}", state.getFlowId(), error);
        return FlowModel.failure(state.getFlowId(), error, state.getLogs());
    }
}
