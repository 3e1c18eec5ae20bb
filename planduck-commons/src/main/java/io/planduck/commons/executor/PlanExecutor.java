package io.planduck.commons.executor;

import io.planduck.commons.engine.AggregateExpression;
import io.planduck.commons.engine.Table;
import io.planduck.commons.engine.TabularEngine;
import io.planduck.commons.plan.PlanParseException;
import io.planduck.commons.plan.PlanParser;
import io.planduck.commons.plan.PlanStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives a {@link TabularEngine} through the steps of a plan.
 *
 * <p>Filter, project and sort are silently skipped while no source has been loaded. Grouping is
 * deferred: the last {@code GroupBy} key and every {@code Aggregate} seen are applied once, after
 * the last step.
 */
public class PlanExecutor {

    private final TabularEngine engine;

    public PlanExecutor(TabularEngine engine) {
        this.engine = engine;
    }

    public Table execute(String planText) throws PlanParseException {
        return execute(PlanParser.parse(planText));
    }

    /**
     * @throws io.planduck.commons.engine.EngineException if a source cannot be read or an expression is unsupported
     * @throws NoTableBuiltException if the plan never loads a source
     */
    public Table execute(List<PlanStep> plan) {
        Table table = null;
        String groupKey = null;
        var aggregates = new ArrayList<AggregateExpression>();

        for (PlanStep step : plan) {
            if (step instanceof PlanStep.LoadSource load) {
                table = engine.load(load.path());
            } else if (step instanceof PlanStep.Filter filter) {
                if (table != null) {
                    table = engine.filter(table, ExpressionInterpreter.predicate(filter.expression()));
                }
            } else if (step instanceof PlanStep.Project project) {
                if (table != null) {
                    table = engine.project(table, project.columns());
                }
            } else if (step instanceof PlanStep.GroupBy groupBy) {
                groupKey = groupBy.key();
            } else if (step instanceof PlanStep.Aggregate aggregate) {
                aggregates.add(ExpressionInterpreter.aggregate(aggregate.expression()));
            } else if (step instanceof PlanStep.OrderBy orderBy) {
                if (table != null) {
                    table = engine.sort(table, orderBy.column());
                }
            } else {
                throw new IllegalArgumentException("Unknown plan step: " + step);
            }
        }

        if (table != null && (groupKey != null || !aggregates.isEmpty())) {
            table = engine.groupAggregate(table, groupKey, aggregates);
        }
        if (table == null) {
            throw new NoTableBuiltException();
        }
        return table;
    }
}
