package io.planduck.commons.engine;

import java.util.Arrays;
import java.util.Optional;

public enum AggregateFunction {
    SUM("sum", "sum"),
    MEAN("mean", "avg"),
    MIN("min", "min"),
    MAX("max", "max"),
    COUNT("count", "count");

    private final String functionName;
    private final String sqlFunction;

    AggregateFunction(String functionName, String sqlFunction) {
        this.functionName = functionName;
        this.sqlFunction = sqlFunction;
    }

    public String functionName() {
        return functionName;
    }

    public String sqlFunction() {
        return sqlFunction;
    }

    public static Optional<AggregateFunction> fromName(String name) {
        return Arrays.stream(values()).filter(f -> f.functionName.equals(name)).findFirst();
    }
}
