package com.cpparchitect.core.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Structural checks on rendered diagram text.
 *
 * <p>Checked for every dialect: the start and end marker lines appear exactly once.
 * Activity-flow text must close every construct it opens in nesting order and carry no
 * empty activity, condition or container label. Graph-description text must balance
 * brackets outside quoted strings and carry no empty quoted label.
 */
public final class DiagramValidator {

    private static final Pattern EMPTY_ACTIVITY = Pattern.compile("^:\\s*;$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EMPTY_CONDITION =
        Pattern.compile("^(if|elseif|while|switch|case|repeat while)\\s*\\(\\s*\\).*", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EMPTY_CONTAINER =
        Pattern.compile("^(class|partition)\\s+\"\\s*\".*", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NOTE_BLOCK = Pattern.compile("^note (left|right|top|bottom)$");

    private enum Construct { IF, WHILE, REPEAT, SWITCH, FORK, NOTE, BLOCK }

    private final Dialect dialect;

    public DiagramValidator(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    /**
     * Validates diagram text.
     *
     * @param content rendered diagram
     * @return problems found, empty when the text is well formed
     */
    public List<String> validate(String content) {
        Objects.requireNonNull(content, "content must not be null");
        List<String> errors = new ArrayList<>();
        String[] lines = content.split("\n", -1);

        int startLine = checkMarker(lines, dialect.startMarker(), errors);
        int endLine = checkMarker(lines, dialect.endMarker(), errors);
        if (startLine >= 0 && endLine >= 0 && endLine < startLine) {
            errors.add("End marker precedes start marker");
        }

        if (dialect.family() == Dialect.Family.ACTIVITY_FLOW) {
            validateActivity(lines, errors);
        } else if (startLine >= 0 && endLine > startLine) {
            validateGraph(lines, startLine, endLine, errors);
        }
        return errors;
    }

    public boolean isValid(String content) {
        return validate(content).isEmpty();
    }

    private static int checkMarker(String[] lines, String marker, List<String> errors) {
        int found = -1;
        int count = 0;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].trim().equals(marker)) {
                count++;
                if (found < 0) {
                    found = i;
                }
            }
        }
        if (count != 1) {
            errors.add("Marker '" + marker + "' expected once, found " + count);
        }
        return found;
    }

    private static void validateActivity(String[] lines, List<String> errors) {
        Deque<Construct> open = new ArrayDeque<>();
        int starts = 0;
        int stops = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            int lineNumber = i + 1;
            if (line.isEmpty()) {
                continue;
            }
            if (open.peek() == Construct.NOTE) {
                if (line.equals("end note")) {
                    open.pop();
                }
                continue;
            }
            if (line.startsWith(":")) {
                if (EMPTY_ACTIVITY.matcher(line).matches()) {
                    errors.add("Line " + lineNumber + ": empty activity label");
                }
                continue;
            }
            if (EMPTY_CONDITION.matcher(line).matches()) {
                errors.add("Line " + lineNumber + ": empty condition");
            }
            if (EMPTY_CONTAINER.matcher(line).matches() || line.equals("title")) {
                errors.add("Line " + lineNumber + ": empty label");
            }

            if (line.equals("start")) {
                starts++;
            } else if (line.equals("stop")) {
                stops++;
            } else if (line.startsWith("if (")) {
                open.push(Construct.IF);
            } else if (line.startsWith("else")) {
                expectTop(open, Construct.IF, line, lineNumber, errors);
            } else if (line.equals("endif")) {
                close(open, Construct.IF, line, lineNumber, errors);
            } else if (line.startsWith("while (")) {
                open.push(Construct.WHILE);
            } else if (line.startsWith("endwhile")) {
                close(open, Construct.WHILE, line, lineNumber, errors);
            } else if (line.equals("repeat")) {
                open.push(Construct.REPEAT);
            } else if (line.startsWith("repeat while")) {
                close(open, Construct.REPEAT, line, lineNumber, errors);
            } else if (line.startsWith("switch (")) {
                open.push(Construct.SWITCH);
            } else if (line.startsWith("case (")) {
                expectTop(open, Construct.SWITCH, line, lineNumber, errors);
            } else if (line.equals("endswitch")) {
                close(open, Construct.SWITCH, line, lineNumber, errors);
            } else if (line.equals("fork")) {
                open.push(Construct.FORK);
            } else if (line.equals("fork again")) {
                expectTop(open, Construct.FORK, line, lineNumber, errors);
            } else if (line.equals("end fork")) {
                close(open, Construct.FORK, line, lineNumber, errors);
            } else if (NOTE_BLOCK.matcher(line).matches()) {
                open.push(Construct.NOTE);
            } else if (line.equals("end note")) {
                close(open, Construct.NOTE, line, lineNumber, errors);
            } else if (line.endsWith("{")) {
                open.push(Construct.BLOCK);
            } else if (line.equals("}")) {
                close(open, Construct.BLOCK, line, lineNumber, errors);
            }
        }

        while (!open.isEmpty()) {
            errors.add("Unclosed " + open.pop());
        }
        if (starts > 1) {
            errors.add("'start' appears " + starts + " times");
        }
        if (starts != stops) {
            errors.add("'start' count " + starts + " does not match 'stop' count " + stops);
        }
    }

    private static void expectTop(Deque<Construct> open, Construct expected, String line, int lineNumber,
                                  List<String> errors) {
        if (open.peek() != expected) {
            errors.add("Line " + lineNumber + ": '" + line + "' outside " + expected);
        }
    }

    private static void close(Deque<Construct> open, Construct expected, String line, int lineNumber,
                              List<String> errors) {
        if (open.peek() != expected) {
            errors.add("Line " + lineNumber + ": unexpected '" + line + "'");
            return;
        }
        open.pop();
    }

    private static void validateGraph(String[] lines, int startLine, int endLine, List<String> errors) {
        Deque<Character> brackets = new ArrayDeque<>();
        for (int i = startLine; i <= endLine; i++) {
            String line = lines[i];
            int lineNumber = i + 1;
            boolean quoted = false;
            int quoteStart = -1;
            for (int j = 0; j < line.length(); j++) {
                char c = line.charAt(j);
                if (c == '"') {
                    if (quoted && j == quoteStart + 1) {
                        errors.add("Line " + lineNumber + ": empty label");
                    }
                    quoted = !quoted;
                    quoteStart = j;
                    continue;
                }
                if (quoted) {
                    continue;
                }
                switch (c) {
                    case '(', '[', '{' -> brackets.push(c);
                    case ')', ']', '}' -> {
                        char expected = c == ')' ? '(' : c == ']' ? '[' : '{';
                        if (brackets.isEmpty() || brackets.peek() != expected) {
                            errors.add("Line " + lineNumber + ": unbalanced '" + c + "'");
                        } else {
                            brackets.pop();
                        }
                    }
                }
            }
            if (quoted) {
                errors.add("Line " + lineNumber + ": unterminated quoted label");
            }
        }
        if (!brackets.isEmpty()) {
            errors.add("Unclosed bracket '" + brackets.peek() + "'");
        }
    }
}
