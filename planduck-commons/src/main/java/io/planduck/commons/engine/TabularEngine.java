package io.planduck.commons.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Primitive table operations a plan is executed with. Operations other than {@link #load},
 * {@link #serialize} and {@link #writeToFile} may be lazy: errors such as an unknown column can
 * surface only once the table is serialized.
 */
public interface TabularEngine {

    /**
     * @throws EngineException of kind {@link EngineException.Kind#NOT_FOUND} or {@link EngineException.Kind#CORRUPT}
     */
    Table load(String path);

    Table filter(Table table, Predicate predicate);

    Table project(Table table, List<String> columns);

    /**
     * @param key grouping column, or null to aggregate the whole table into a single row
     * @param aggregates may be empty when {@code key} is set, producing the distinct keys
     */
    Table groupAggregate(Table table, String key, List<AggregateExpression> aggregates);

    Table sort(Table table, String column);

    /**
     * Full table in arrow IPC stream format.
     */
    byte[] serialize(Table table) throws IOException;

    /**
     * Writes the full table in arrow IPC file format.
     */
    void writeToFile(Table table, Path path) throws IOException;
}
