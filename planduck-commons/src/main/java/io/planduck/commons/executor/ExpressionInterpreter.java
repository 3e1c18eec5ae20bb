package io.planduck.commons.executor;

import io.planduck.commons.engine.AggregateExpression;
import io.planduck.commons.engine.AggregateFunction;
import io.planduck.commons.engine.ComparisonOperator;
import io.planduck.commons.engine.EngineException;
import io.planduck.commons.engine.Predicate;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns the expression text of filter and aggregate steps into typed engine expressions.
 */
public final class ExpressionInterpreter {

    private static final String COLUMN = "(?:\"(?<quoted>[^\"]+)\"|(?<bare>[A-Za-z_][A-Za-z0-9_]*))";

    // Two-character operators first so that ">=" is not read as ">" followed by "=...".
    private static final Pattern PREDICATE = Pattern.compile(
            "^" + COLUMN + "\\s*(?<op>>=|<=|==|!=|>|<)\\s*(?<literal>.+)$");

    private static final Pattern AGGREGATE = Pattern.compile(
            "^(?<function>[A-Za-z_]\\w*)\\(\\s*" + COLUMN + "\\s*\\)$");

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern NON_FINITE = Pattern.compile("[+-]?(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private ExpressionInterpreter() {
    }

    public static Predicate predicate(String expression) {
        var matcher = PREDICATE.matcher(expression.strip());
        if (!matcher.matches()) {
            throw new EngineException(EngineException.Kind.UNSUPPORTED_EXPRESSION, "Unsupported filter: " + expression);
        }
        var column = column(matcher.group("quoted"), matcher.group("bare"));
        var operator = ComparisonOperator.fromSymbol(matcher.group("op")).orElseThrow();
        return new Predicate(column, operator, literal(matcher.group("literal")));
    }

    public static AggregateExpression aggregate(String expression) {
        var matcher = AGGREGATE.matcher(expression.strip());
        if (!matcher.matches()) {
            throw new EngineException(EngineException.Kind.UNSUPPORTED_EXPRESSION, "Unsupported aggregate: " + expression);
        }
        var functionName = matcher.group("function");
        var function = AggregateFunction.fromName(functionName)
                .orElseThrow(() -> new EngineException(EngineException.Kind.UNSUPPORTED_EXPRESSION,
                        "Unsupported aggregate function: " + functionName));
        return new AggregateExpression(function, column(matcher.group("quoted"), matcher.group("bare")));
    }

    /**
     * Integer if it parses as one, else floating point (including {@code inf} and {@code nan}), else the text
     * with surrounding quotes stripped.
     */
    static Object literal(String text) {
        var value = stripQuotes(text.strip());
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                // out of long range, fall through to double
            }
        }
        if (FLOAT.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        if (NON_FINITE.matcher(value).matches()) {
            var lower = value.toLowerCase(Locale.ROOT);
            if (lower.endsWith("nan")) {
                return Double.NaN;
            }
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return value;
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }

    private static String column(String quoted, String bare) {
        return quoted != null ? quoted : bare;
    }
}
