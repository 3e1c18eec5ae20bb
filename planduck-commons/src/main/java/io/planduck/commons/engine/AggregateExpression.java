package io.planduck.commons.engine;

public record AggregateExpression(AggregateFunction function, String column) {

    /**
     * Name of the result column, e.g. {@code age_mean}.
     */
    public String outputName() {
        return column + "_" + function.functionName();
    }
}
