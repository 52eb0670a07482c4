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

import dev.mars.flowscript.core.Argument;
import dev.mars.flowscript.core.ExecutionOptions;
import dev.mars.flowscript.core.FlowValue;
import dev.mars.flowscript.core.ParameterInfo;
import dev.mars.flowscript.core.Statement;
import dev.mars.flowscript.core.StatementType;
import dev.mars.flowscript.core.StepDefinition;
import dev.mars.flowscript.core.VariableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns the body of {@code func main()} into an ordered statement tree.
 *
 * <p>Function calls, {@code if} blocks (nested to any depth), {@code :=} assignments and
 * {@code return} are recognised. Dotted calls without an assignment are logging and are dropped;
 * anything else that fits none of the forms is skipped. All steps must already be known so
 * that argument and return lists can be checked against the declared parameters.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
class StatementParser {

    private static final Logger logger = LoggerFactory.getLogger(StatementParser.class);

    private static final String IDENT = "[\\p{L}_][\\p{L}\\p{N}_]*";
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "^(" + IDENT + "(?:\\s*,\\s*" + IDENT + ")*)\\s*(:=|=)(?!=)\\s*(.+)$");
    private static final Pattern LOCAL_CALL = Pattern.compile("^(" + IDENT + ")\\s*\\(");
    private static final Pattern DOTTED_CALL = Pattern.compile("^" + IDENT + "(?:\\." + IDENT + ")+\\s*\\(");
    private static final Pattern IF_HEAD = Pattern.compile("^if[\\s(]");
    private static final Pattern RETURN = Pattern.compile("^return\\b.*");

    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();

    /**
     * Parses lines {@code [from, to)} into statements.
     */
    List<Statement> parseBlock(List<String> lines, int from, int to, ParseState state) {
        List<Statement> statements = new ArrayList<>();
        int index = from;
        while (index < to) {
            String text = SourceScanner.stripComment(lines.get(index)).trim();
            int lineNumber = index + 1;
            if (text.isEmpty() || "{".equals(text) || "}".equals(text)) {
                index++;
                continue;
            }

            String desc = SourceScanner.extractDescription(lines, index);
            if (IF_HEAD.matcher(text).lookingAt()) {
                index = parseIf(lines, index, to, desc, state, statements);
                continue;
            }

            parseLine(text, lineNumber, desc, state).ifPresent(statements::add);
            index++;
        }
        return statements;
    }

    private int parseIf(List<String> lines, int index, int to, String desc, ParseState state,
                        List<Statement> statements) {
        String text = SourceScanner.stripComment(lines.get(index)).trim();
        int lineNumber = index + 1;
        int brace = SourceScanner.indexOfTopLevel(text, "{", 2);
        String condition = (brace > 0 ? text.substring(2, brace) : text.substring(2)).trim();
        if (condition.startsWith("(") && SourceScanner.findClosing(condition, 0) == condition.length() - 1) {
            condition = condition.substring(1, condition.length() - 1).trim();
        }
        if (!conditionEvaluator.isSupported(condition)) {
            state.warn(lineNumber, "unsupported condition '" + condition + "' always evaluates to false");
        }

        int end = SourceScanner.findBlockEnd(lines, index);
        List<Statement> children;
        int next;
        if (end == index) {
            int close = SourceScanner.findClosing(text, brace);
            String inline = text.substring(brace + 1, close).trim();
            children = new ArrayList<>();
            for (String part : SourceScanner.splitTopLevel(inline, ';')) {
                parseLine(part, lineNumber, "", state).ifPresent(children::add);
            }
            next = index + 1;
        } else if (end < 0 || end >= to) {
            state.warn(lineNumber, "unterminated if block runs to the end of main");
            children = parseBlock(lines, index + 1, to, state);
            next = to;
        } else {
            String closingLine = SourceScanner.stripComment(lines.get(end)).trim();
            if (closingLine.contains("else")) {
                state.warn(end + 1, "else branches are not supported and are skipped");
            }
            children = parseBlock(lines, index + 1, end, state);
            next = skipElse(lines, end, to, closingLine);
        }

        statements.add(Statement.builder(StatementType.IF)
                .lineNumber(lineNumber)
                .content(text)
                .desc(desc)
                .condition(condition)
                .children(children)
                .build());
        return next;
    }

    private static int skipElse(List<String> lines, int end, int to, String closingLine) {
        if (!closingLine.contains("else")) {
            return end + 1;
        }
        int elseEnd = SourceScanner.findBlockEnd(lines, end + 1);
        return elseEnd < 0 || elseEnd >= to ? to : elseEnd + 1;
    }

    /**
     * Parses one simple (non-block) statement.
     */
    Optional<Statement> parseLine(String line, int lineNumber, String desc, ParseState state) {
        String text = stripSemicolons(line.trim());
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (RETURN.matcher(text).matches()) {
            return Optional.of(Statement.builder(StatementType.RETURN)
                    .lineNumber(lineNumber)
                    .content(text)
                    .desc(desc)
                    .build());
        }
        if (text.startsWith("var ")) {
            text = text.substring(4).trim();
        }

        Matcher assignment = ASSIGNMENT.matcher(text);
        if (assignment.matches()) {
            List<String> targets = Arrays.stream(assignment.group(1).split(","))
                    .map(String::trim)
                    .collect(Collectors.toList());
            String value = assignment.group(3).trim();

            Matcher call = LOCAL_CALL.matcher(value);
            if (call.lookingAt()) {
                return parseCall(call.group(1), value, targets, text, lineNumber, desc, state);
            }
            if (DOTTED_CALL.matcher(value).lookingAt()) {
                state.warn(lineNumber, "skipping call to undeclared function " + value.substring(0, value.indexOf('(')).trim());
                return Optional.empty();
            }
            if (targets.size() == 1) {
                String name = targets.get(0);
                state.registerVariable(new VariableInfo(name, "string", FlowValue.NULL,
                        VariableInfo.SOURCE_ASSIGNMENT, lineNumber, false));
                return Optional.of(Statement.builder(StatementType.VAR)
                        .lineNumber(lineNumber)
                        .content(name + " := " + value)
                        .desc(desc)
                        .build());
            }
            logger.debug("Flow {} line {}: skipping multi-target assignment '{}'", state.getFlowId(), lineNumber, text);
            return Optional.empty();
        }

        Matcher call = LOCAL_CALL.matcher(text);
        if (call.lookingAt()) {
            return parseCall(call.group(1), text, Collections.emptyList(), text, lineNumber, desc, state);
        }
        // sys.Println(...), step1.Printf(...) and similar
        logger.debug("Flow {} line {}: ignoring '{}'", state.getFlowId(), lineNumber, text);
        return Optional.empty();
    }

    private Optional<Statement> parseCall(String alias, String callText, List<String> targets, String content,
                                          int lineNumber, String desc, ParseState state) {
        int open = callText.indexOf('(');
        int close = SourceScanner.findClosing(callText, open);
        if (close < 0) {
            state.warn(lineNumber, "unterminated argument list in call to " + alias);
            return Optional.empty();
        }

        List<Argument> args = SourceScanner.splitTopLevel(callText.substring(open + 1, close), ',').stream()
                .map(Argument::parse)
                .collect(Collectors.toList());

        Map<String, FlowValue> metadata = Collections.emptyMap();
        String rest = stripSemicolons(callText.substring(close + 1).trim());
        if (rest.startsWith("{")) {
            int metadataEnd = SourceScanner.findClosing(rest, 0);
            if (metadataEnd < 0) {
                state.warn(lineNumber, "unterminated metadata block in call to " + alias);
            } else {
                metadata = MetadataParser.parse(rest.substring(0, metadataEnd + 1),
                        message -> state.warn(lineNumber, message));
            }
        } else if (!rest.isEmpty()) {
            state.warn(lineNumber, "ignoring unexpected text after call to " + alias + ": " + rest);
        }
        ExecutionOptions options = ExecutionOptions.fromMetadata(metadata, message -> state.warn(lineNumber, message));

        List<String> returns = new ArrayList<>(targets);
        StepDefinition step = state.getStep(alias);
        if (step == null) {
            state.warn(lineNumber, "call to undeclared step " + alias);
        } else {
            int inputCount = step.getInputParams().size();
            if (args.size() > inputCount) {
                state.warn(lineNumber, String.format("step %s takes %d argument(s), dropping %d extra",
                        alias, inputCount, args.size() - inputCount));
                args = new ArrayList<>(args.subList(0, inputCount));
            }
            int outputCount = step.getOutputParams().size();
            if (returns.size() > outputCount) {
                state.warn(lineNumber, String.format("step %s returns %d value(s), dropping %d extra target(s)",
                        alias, outputCount, returns.size() - outputCount));
                returns = new ArrayList<>(returns.subList(0, outputCount));
            }
        }

        for (int i = 0; i < returns.size(); i++) {
            String name = returns.get(i);
            if ("_".equals(name)) {
                continue;
            }
            String type = "unknown";
            if (step != null) {
                ParameterInfo output = step.getOutputParams().get(i);
                type = output.getType();
            }
            state.registerVariable(VariableInfo.stepOutput(name, type, FlowValue.NULL, alias, lineNumber));
        }

        return Optional.of(Statement.builder(StatementType.FUNCTION_CALL)
                .lineNumber(lineNumber)
                .content(content)
                .desc(desc)
                .function(alias)
                .args(args)
                .returns(returns)
                .metadata(metadata)
                .options(options)
                .build());
    }

    private static String stripSemicolons(String text) {
        String result = text;
        while (result.endsWith(";")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }
}
