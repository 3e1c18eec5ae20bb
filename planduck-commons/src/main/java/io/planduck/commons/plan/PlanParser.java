package io.planduck.commons.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses plan text into an ordered list of {@link PlanStep}. One statement per line, blank lines
 * are skipped and keywords are case-sensitive:
 * <pre>
 * load "data/people.parquet"
 * filter age &gt; 30
 * select ["name", "age", "city"]
 * group_by "city".agg(mean("age"))
 * sort "city"
 * agg(count("name"))
 * </pre>
 * Parsing stops at the first line that is not one of these shapes.
 */
public final class PlanParser {

    private PlanParser() {
    }

    public static List<PlanStep> parse(String text) throws PlanParseException {
        var plan = new ArrayList<PlanStep>();
        var lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            var steps = statement(new LineScanner(line));
            if (steps == null) {
                throw new PlanParseException(line, i + 1);
            }
            plan.addAll(steps);
        }
        return plan;
    }

    private static List<PlanStep> statement(LineScanner s) {
        return switch (s.word()) {
            case "load" -> load(s);
            case "filter" -> filter(s);
            case "select" -> select(s);
            case "group_by" -> groupBy(s);
            case "sort" -> sort(s);
            case "agg" -> {
                var expression = aggArgument(s);
                yield expression == null ? null : List.of(new PlanStep.Aggregate(expression));
            }
            default -> null;
        };
    }

    private static List<PlanStep> load(LineScanner s) {
        var path = quotedArgument(s);
        return path == null ? null : List.of(new PlanStep.LoadSource(path));
    }

    private static List<PlanStep> filter(LineScanner s) {
        if (s.skipSpaces() == 0) {
            return null;
        }
        var expression = s.rest().strip();
        return expression.isEmpty() ? null : List.of(new PlanStep.Filter(expression));
    }

    private static List<PlanStep> select(LineScanner s) {
        if (s.skipSpaces() == 0 || !s.consume('[')) {
            return null;
        }
        var columns = new ArrayList<String>();
        while (true) {
            s.skipSpaces();
            if (s.consume(']')) {
                break;
            }
            var name = s.quoted();
            if (name == null) {
                return null;
            }
            if (!name.isEmpty()) {
                columns.add(name);
            }
            s.skipSpaces();
            if (s.consume(',')) {
                continue;
            }
            if (s.consume(']')) {
                break;
            }
            return null;
        }
        s.skipSpaces();
        return s.atEnd() ? List.of(new PlanStep.Project(columns)) : null;
    }

    private static List<PlanStep> groupBy(LineScanner s) {
        if (s.skipSpaces() == 0) {
            return null;
        }
        var key = s.quoted();
        if (key == null || key.isEmpty()) {
            return null;
        }
        s.skipSpaces();
        if (s.atEnd()) {
            return List.of(new PlanStep.GroupBy(key));
        }
        if (!s.consume('.') || !"agg".equals(s.word())) {
            return null;
        }
        var expression = aggArgument(s);
        return expression == null ? null : List.of(new PlanStep.GroupBy(key), new PlanStep.Aggregate(expression));
    }

    private static List<PlanStep> sort(LineScanner s) {
        var column = quotedArgument(s);
        return column == null ? null : List.of(new PlanStep.OrderBy(column));
    }

    /**
     * {@code <spaces> "value" <end>}; null on mismatch or empty value.
     */
    private static String quotedArgument(LineScanner s) {
        if (s.skipSpaces() == 0) {
            return null;
        }
        var value = s.quoted();
        if (value == null || value.isEmpty()) {
            return null;
        }
        s.skipSpaces();
        return s.atEnd() ? value : null;
    }

    /**
     * {@code (<expression>)} running to the end of the line; returns the trimmed expression.
     */
    private static String aggArgument(LineScanner s) {
        s.skipSpaces();
        if (!s.consume('(')) {
            return null;
        }
        var rest = s.rest();
        if (!rest.endsWith(")")) {
            return null;
        }
        var expression = rest.substring(0, rest.length() - 1).strip();
        return expression.isEmpty() ? null : expression;
    }

    private static final class LineScanner {
        private final String line;
        private int pos;

        private LineScanner(String line) {
            this.line = line;
        }

        String word() {
            int start = pos;
            while (pos < line.length() && isWordChar(line.charAt(pos))) {
                pos++;
            }
            return line.substring(start, pos);
        }

        int skipSpaces() {
            int start = pos;
            while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
                pos++;
            }
            return pos - start;
        }

        boolean consume(char c) {
            if (pos < line.length() && line.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        String quoted() {
            if (!consume('"')) {
                return null;
            }
            int end = line.indexOf('"', pos);
            if (end < 0) {
                return null;
            }
            var value = line.substring(pos, end);
            pos = end + 1;
            return value;
        }

        String rest() {
            var rest = line.substring(pos);
            pos = line.length();
            return rest;
        }

        boolean atEnd() {
            return pos >= line.length();
        }

        private static boolean isWordChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_';
        }
    }
}
