package io.planduck.commons.engine;

/**
 * Handle to a table produced by a {@link TabularEngine}. Only the engine that created it knows how
 * to read it.
 */
public interface Table {
}
