package io.planduck.commons.executor;

import io.planduck.commons.TestTables;
import io.planduck.commons.engine.DuckDBTabularEngine;
import io.planduck.commons.engine.EngineException;
import io.planduck.commons.plan.PlanParseException;
import io.planduck.commons.plan.PlanStep;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PlanExecutorTest {

    @TempDir
    static Path dir;

    static Path people;
    static DuckDBTabularEngine engine;
    static PlanExecutor executor;

    @BeforeAll
    static void setup() {
        people = TestTables.people(dir);
        engine = new DuckDBTabularEngine();
        executor = new PlanExecutor(engine);
    }

    @AfterAll
    static void cleanup() {
        engine.close();
    }

    private static List<Map<String, Object>> run(String plan) throws Exception {
        return TestTables.readStream(engine.serialize(executor.execute(plan)));
    }

    @Test
    public void testFilterKeepsMatchingRows() throws Exception {
        var ages = TestTables.writeParquet(dir.resolve("ages.parquet"),
                "SELECT * FROM (VALUES (20::BIGINT), (40::BIGINT)) AS t(age)");
        var rows = run("""
                load "%s"
                filter age > 30
                """.formatted(ages));
        assertEquals(List.of(Map.of("age", 40L)), rows);
    }

    @Test
    public void testFilterAgainstInfinity() throws Exception {
        assertEquals(5, run("""
                load "%s"
                filter age < inf
                """.formatted(people)).size());
        assertEquals(0, run("""
                load "%s"
                filter age < -inf
                """.formatted(people)).size());
    }

    @Test
    public void testGroupByWithoutAggregateGivesDistinctKeys() throws Exception {
        var rows = run("""
                load "%s"
                group_by "city"
                """.formatted(people));
        assertEquals(Set.of("Paris", "London", "Berlin"),
                rows.stream().map(r -> r.get("city")).collect(Collectors.toSet()));
        assertEquals(3, rows.size());
        rows.forEach(r -> assertEquals(Set.of("city"), r.keySet()));
    }

    @Test
    public void testFullPipeline() throws Exception {
        var rows = run("""
                load "%s"
                filter age >= 25
                select ["name", "age", "city"]
                group_by "city".agg(mean("age"))
                """.formatted(people));
        var byCity = rows.stream().collect(Collectors.toMap(r -> r.get("city"), r -> ((Number) r.get("age_mean")).doubleValue()));
        assertEquals(Map.of("Paris", 25.0, "London", 40.0, "Berlin", 35.0), byCity);
    }

    @Test
    public void testTopLevelAggregateOverWholeTable() throws Exception {
        var rows = run("""
                load "%s"
                agg(count("name"))
                """.formatted(people));
        assertEquals(1, rows.size());
        assertEquals(5L, ((Number) rows.get(0).get("name_count")).longValue());
    }

    @Test
    public void testLastGroupKeyWins() throws Exception {
        var rows = run("""
                load "%s"
                group_by "name"
                group_by "city"
                """.formatted(people));
        assertEquals(3, rows.size());
    }

    @Test
    public void testStepsBeforeLoadAreSkipped() throws Exception {
        var rows = run("""
                filter age > 100
                select ["name"]
                sort "name"
                load "%s"
                """.formatted(people));
        assertEquals(5, rows.size());
        assertEquals(3, rows.get(0).size());
    }

    @Test
    public void testSortedOutput() throws Exception {
        var names = run("""
                load "%s"
                select ["name"]
                sort "name"
                """.formatted(people)).stream().map(r -> r.get("name")).toList();
        assertEquals(List.of("alice", "bob", "carol", "dave", "erin"), names);
    }

    @Test
    public void testPlanWithoutLoad() {
        assertThrows(NoTableBuiltException.class, () -> executor.execute("sort \"name\""));
        assertThrows(NoTableBuiltException.class, () -> executor.execute(List.<PlanStep>of()));
    }

    @Test
    public void testMissingSource() {
        var e = assertThrows(EngineException.class, () -> executor.execute("load \"" + dir.resolve("nope.parquet") + "\""));
        assertEquals(EngineException.Kind.NOT_FOUND, e.getKind());
    }

    @Test
    public void testUnsupportedFilter() {
        var e = assertThrows(EngineException.class, () -> executor.execute("""
                load "%s"
                filter age like 3
                """.formatted(people)));
        assertEquals(EngineException.Kind.UNSUPPORTED_EXPRESSION, e.getKind());
    }

    @Test
    public void testUnparseablePlan() {
        var e = assertThrows(PlanParseException.class, () -> executor.execute("drop table people"));
        assertEquals(1, e.getLineNumber());
    }
}
