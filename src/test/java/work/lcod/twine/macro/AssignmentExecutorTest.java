package work.lcod.twine.macro;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.twine.support.TwineTestSupport.context;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.runtime.RandomSource;
import work.lcod.twine.runtime.TagLookup;
import work.lcod.twine.runtime.VariableStore;
import work.lcod.twine.runtime.VisitLog;
import work.lcod.twine.support.TwineTestSupport.RecordingTraceSink;

class AssignmentExecutorTest {
    @Test
    void assignsLiterals() {
        var ctx = context(Map.of());
        var executor = new AssignmentExecutor(ctx);

        executor.execute("$gold to 10");
        executor.execute("$ratio to 0.5");
        executor.execute("$name to \"Bob\"");
        executor.execute("$ready to true");
        executor.execute("$mood to 'calm'");

        assertEquals(10L, ctx.store().get("gold"));
        assertEquals(0.5d, ctx.store().get("ratio"));
        assertEquals("Bob", ctx.store().get("name"));
        assertEquals(Boolean.TRUE, ctx.store().get("ready"));
        assertEquals("calm", ctx.store().get("mood"));
    }

    @Test
    void assignsArrays() {
        var ctx = context(Map.of());
        var executor = new AssignmentExecutor(ctx);

        executor.execute("$items to (a: \"sword\", \"shield\")");
        executor.execute("$bag to (a:)");

        assertEquals(List.of("sword", "shield"), ctx.store().get("items"));
        assertEquals(List.of(), ctx.store().get("bag"));
    }

    @Test
    void mapLiteralIsAlwaysEmpty() {
        var ctx = context(Map.of());
        new AssignmentExecutor(ctx).execute("$stats to (dm: \"hp\", 10)");
        assertEquals(Map.of(), ctx.store().get("stats"));
    }

    @Test
    void concatenatesOntoAnotherVariable() {
        var ctx = context(Map.of("items", List.of("sword")));
        new AssignmentExecutor(ctx).execute("$loot to $items + (a: \"axe\", \"rope\")");

        assertEquals(List.of("sword", "axe", "rope"), ctx.store().get("loot"));
        assertEquals(List.of("sword"), ctx.store().get("items"));
    }

    @Test
    void concatenationStartsFromEmptyWhenSourceIsMissing() {
        var ctx = context(Map.of());
        new AssignmentExecutor(ctx).execute("$items to $items + (a: \"torch\")");
        assertEquals(List.of("torch"), ctx.store().get("items"));
    }

    @Test
    void mapConcatenationDropsUnpairedItem() {
        var ctx = context(Map.of("stats", Map.of("hp", "5")));
        new AssignmentExecutor(ctx).execute("$stats to $stats + (dm: \"mp\", \"3\", \"dangling\")");
        assertEquals(Map.of("hp", "5", "mp", "3"), ctx.store().get("stats"));
    }

    @Test
    void arithmeticOverVariables() {
        var ctx = context(Map.of("x", 3, "y", 10, "z", 4));
        var executor = new AssignmentExecutor(ctx);

        executor.execute("$x to $x + 5");
        executor.execute("$d to $y - $z");

        assertEquals(8L, ctx.store().get("x"));
        assertEquals(6L, ctx.store().get("d"));
    }

    @Test
    void arithmeticWithIt() {
        var ctx = context(Map.of("x", 3));
        new AssignmentExecutor(ctx).execute("$x to it * 2");
        assertEquals(6L, ctx.store().get("x"));
    }

    @Test
    void missingSourceReadsAsZero() {
        var ctx = context(Map.of());
        new AssignmentExecutor(ctx).execute("$visits to $visits + 1");
        assertEquals(1L, ctx.store().get("visits"));
    }

    @Test
    void divisionTruncates() {
        var ctx = context(Map.of("x", 7));
        new AssignmentExecutor(ctx).execute("$x to $x / 2");
        assertEquals(3L, ctx.store().get("x"));
    }

    @Test
    void divisionByZeroLeavesValueUnchanged() {
        var sink = new RecordingTraceSink();
        var ctx = new ExecutionContext(
            VariableStore.seededFrom(Map.of("x", 7)),
            VisitLog.empty(),
            TagLookup.none(),
            RandomSource.system(),
            sink,
            ExecutionContext.DEFAULT_MAX_ITERATIONS
        );
        new AssignmentExecutor(ctx).execute("$x to $x / 0");

        assertEquals(7L, ctx.store().get("x"));
        assertTrue(sink.lines().stream().anyMatch(line -> line.startsWith("[SET]") && line.contains("unchanged")));
    }

    @Test
    void detectsArithmeticShape() {
        assertTrue(AssignmentExecutor.isArithmetic("$x to $x + 1"));
        assertTrue(AssignmentExecutor.isArithmetic("$x to it - $y"));
        assertFalse(AssignmentExecutor.isArithmetic("$x to 5"));
        assertFalse(AssignmentExecutor.isArithmetic("$x to $items + (a: \"axe\")"));
    }

    @Test
    void ignoresMalformedCommands() {
        var ctx = context(Map.of());
        new AssignmentExecutor(ctx).execute("nonsense");
        assertTrue(ctx.store().names().isEmpty());
    }

    @Test
    void topLevelSkipsCommandsInsideHooks() {
        var ctx = context(Map.of());
        var remaining = new AssignmentExecutor(ctx)
            .executeTopLevel("(set: $a to 1){(set: $b to 2)}Text[(set: $c to 3)]");

        assertEquals("Text[(set: $c to 3)]", remaining);
        assertEquals(1L, ctx.store().get("a"));
        assertEquals(2L, ctx.store().get("b"));
        assertFalse(ctx.store().contains("c"));
    }

    @Test
    void executeAllConsumesTrailingNewline() {
        var ctx = context(Map.of());
        var remaining = new AssignmentExecutor(ctx).executeAll("(set: $a to 1)\nHello (set: $b to 2)");

        assertEquals("Hello ", remaining);
        assertEquals(2L, ctx.store().get("b"));
    }

    @Test
    void laterAssignmentsSeeEarlierOnes() {
        var ctx = context(Map.of());
        new AssignmentExecutor(ctx).executeAll("(set: $a to 2)(set: $b to $a * 3)");
        assertEquals(6L, ctx.store().get("b"));
    }
}
