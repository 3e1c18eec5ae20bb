package io.planduck.commons.engine;

/**
 * {@code column operator literal}. The literal is a {@link Long}, a {@link Double} or a {@link String}.
 */
public record Predicate(String column, ComparisonOperator operator, Object literal) {
}
