package io.planduck.commons.engine;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {
    GREATER_THAN(">", ">"),
    LESS_THAN("<", "<"),
    GREATER_THAN_OR_EQUAL(">=", ">="),
    LESS_THAN_OR_EQUAL("<=", "<="),
    EQUAL("==", "="),
    NOT_EQUAL("!=", "<>");

    private final String symbol;
    private final String sqlSymbol;

    ComparisonOperator(String symbol, String sqlSymbol) {
        this.symbol = symbol;
        this.sqlSymbol = sqlSymbol;
    }

    public String symbol() {
        return symbol;
    }

    public String sqlSymbol() {
        return sqlSymbol;
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(o -> o.symbol.equals(symbol)).findFirst();
    }
}
