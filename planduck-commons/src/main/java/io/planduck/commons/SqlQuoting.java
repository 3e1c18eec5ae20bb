package io.planduck.commons;

public final class SqlQuoting {

    private SqlQuoting() {
    }

    public static String identifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    public static String string(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Renders a {@link Long}, {@link Double} or {@link String} as a sql literal.
     */
    public static String literal(Object value) {
        if (value instanceof Long l) {
            return l.toString();
        } else if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return "CAST(%s AS DOUBLE)".formatted(string(d.toString()));
            }
            return d.toString();
        } else if (value instanceof String s) {
            return string(s);
        }
        throw new IllegalArgumentException("Unsupported literal type: " + (value == null ? "null" : value.getClass().getName()));
    }
}
