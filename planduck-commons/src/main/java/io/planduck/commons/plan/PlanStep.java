package io.planduck.commons.plan;

import java.util.List;

/**
 * One typed operation of a query plan. A plan is an ordered {@code List<PlanStep>}; the
 * order is the order of the statements in the plan text.
 *
 * <p>Filter and aggregate expressions are kept as text here. They are interpreted by the
 * executor when the step is reached, so an unsupported expression is an execution error
 * rather than a parse error.
 */
public interface PlanStep {

    /** Replaces the current table with a fresh scan of {@code path}. */
    record LoadSource(String path) implements PlanStep { }

    record Filter(String expression) implements PlanStep { }

    record Project(List<String> columns) implements PlanStep {
        public Project {
            columns = List.copyOf(columns);
        }
    }

    /** Records the grouping key. Materialized together with the aggregates at the end of the plan. */
    record GroupBy(String key) implements PlanStep { }

    record Aggregate(String expression) implements PlanStep { }

    record OrderBy(String column) implements PlanStep { }
}
