package work.lcod.twine.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.twine.support.TwineTestSupport.fixedRandom;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.twine.model.Choice;
import work.lcod.twine.model.Passage;
import work.lcod.twine.model.RawPassageRecord;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.runtime.TagLookup;
import work.lcod.twine.runtime.VisitLog;
import work.lcod.twine.support.TwineTestSupport.RecordingTraceSink;

class PassageCompilerTest {
    private final PassageCompiler compiler = new PassageCompiler(TagLookup.none());

    @Test
    void setThenConditional() {
        var passage = compile("(set: $score to 50)(if: $score > 30)[High][Low]", Map.of());

        assertEquals("High", passage.content());
        assertEquals(Map.of("score", 50L), passage.stateChanges());
    }

    @Test
    void setThenPossessivePrint() {
        var passage = compile("(set: $items to (a: \"sword\",\"shield\"))You have a (print: $items's 1).", Map.of());

        assertTrue(passage.content().endsWith("You have a sword."));
        assertEquals(Map.of("items", List.of("sword", "shield")), passage.stateChanges());
    }

    @Test
    void extractsChoicesAndStripsLinks() {
        var passage = compile("Where now?\n[[Go left|Left Path]]\n[[Nod again.->You nod politely.]]\n[[Step back.]]", Map.of());

        assertEquals("Where now?", passage.content());
        assertEquals(List.of(
            new Choice("Go left", "Left Path"),
            new Choice("Nod again.", "You nod politely."),
            new Choice("Step back.", "Step back.")
        ), passage.choices());
    }

    @Test
    void choicesFollowSelectedBranchOnly() {
        var body = "(if: $armed)[Draw! [[[Fight|Arena]]]](else:)[Run! [[Flee->Forest]]]";

        var armed = compile(body, Map.of("armed", true));
        assertEquals("Draw!", armed.content());
        assertEquals(List.of(new Choice("Fight", "Arena")), armed.choices());

        var unarmed = compile(body, Map.of("armed", false));
        assertEquals("Run!", unarmed.content());
        assertEquals(List.of(new Choice("Flee", "Forest")), unarmed.choices());
    }

    @Test
    void leavesCallerSnapshotUntouched() {
        var items = new ArrayList<Object>(List.of("sword"));
        var snapshot = new LinkedHashMap<String, Object>();
        snapshot.put("gold", 5);
        snapshot.put("items", items);

        compile("(set: $gold to $gold + 1)(set: $items to $items + (a: \"axe\"))", snapshot);

        assertEquals(5, snapshot.get("gold"));
        assertEquals(List.of("sword"), items);
    }

    @Test
    void unchangedVariablesAreNotReported() {
        var passage = compile("(set: $gold to 5)(set: $name to \"Bob\")Hi", Map.of("gold", 5));

        assertEquals(Map.of("name", "Bob"), passage.stateChanges());
    }

    @Test
    void compilingTwiceGivesTheSamePassage() {
        var record = RawPassageRecord.of("Loop", "", "(set: $n to $n + 1)Count: $n [[Again->Loop]]");
        var snapshot = Map.of("n", 1);

        assertEquals(
            compiler.compile(record, snapshot, VisitLog.empty()),
            compiler.compile(record, snapshot, VisitLog.empty())
        );
    }

    @Test
    void substitutesInlineVariables() {
        var passage = compile("Hello $name, meet $stranger.", Map.of("name", "Bob"));
        assertEquals("Hello Bob, meet $stranger.", passage.content());
    }

    @Test
    void rendersItalicsAndRemovesBraces() {
        var passage = compile("{It is //quiet// here.}", Map.of());
        assertEquals("It is *quiet* here.", passage.content());
    }

    @Test
    void cleansCollectionResidue() {
        var passage = compile("List (a: \"x\") and (a:) and (dm: \"k\", 1)", Map.of());
        assertEquals("List [] and  and {}", passage.content());
    }

    @Test
    void collapsesBlankLines() {
        var passage = compile("First\n\n\n\n   \nSecond", Map.of());
        assertEquals("First\n\nSecond", passage.content());
    }

    @Test
    void unwrapsGroupedConditionals() {
        assertEquals("(if: true)[A] rest", PassageCompiler.unwrapGroupedConditionals("{(if: true)[A]} rest"));
        assertEquals("(unless: $x)[B]", PassageCompiler.unwrapGroupedConditionals("{(unless: $x)[B]}"));
        assertEquals("{(if: true)[A]", PassageCompiler.unwrapGroupedConditionals("{(if: true)[A]"));
    }

    @Test
    void appliesContentFilters() {
        var filtering = new PassageCompiler(
            TagLookup.none(),
            fixedRandom(1),
            (category, message) -> {},
            ExecutionContext.DEFAULT_MAX_ITERATIONS,
            List.of(ContentFilters.statDisplay(), ContentFilters.stripping("\\[DEBUG\\][^\\n]*"))
        );
        var record = RawPassageRecord.of("Night", "", "**Suspicion:** 10/100 | **Time:** 9:00 PM | **Film:** 3/30\n[DEBUG] hidden\nThe night begins.");

        assertEquals("The night begins.", filtering.compile(record, Map.of(), VisitLog.empty()).content());
    }

    @Test
    void statDisplayIsOffByDefault() {
        var passage = compile("**Suspicion:** 10/100 | **Time:** 9:00 PM", Map.of());
        assertTrue(passage.content().contains("Suspicion"));
    }

    @Test
    void resolvesVisitedTagsThroughLookup() {
        TagLookup tags = name -> "Left Path".equals(name) ? List.of("forest") : List.of();
        var withTags = new PassageCompiler(tags);
        var record = RawPassageRecord.of("Step back.", "", "(visited: where its tags contains \"forest\")[You remember the trees.] Nothing here.");

        assertEquals(
            "You remember the trees. Nothing here.",
            withTags.compile(record, Map.of(), VisitLog.of("Left Path")).content()
        );
        assertEquals("Nothing here.", withTags.compile(record, Map.of(), VisitLog.empty()).content());
    }

    @Test
    void drawsFromInjectedRandomSource() {
        var seeded = new PassageCompiler(
            TagLookup.none(),
            fixedRandom(3),
            (category, message) -> {},
            ExecutionContext.DEFAULT_MAX_ITERATIONS,
            List.of()
        );
        var record = RawPassageRecord.of("Dice", "", "You rolled (print: (random: 1, 6)).");

        assertEquals("You rolled 3.", seeded.compile(record, Map.of(), VisitLog.empty()).content());
    }

    @Test
    void compilesContentWithoutChoices() {
        var record = RawPassageRecord.of("StoryHeader", "header", "Score: $score [[Ignored]]");
        assertEquals("Score: 12", compiler.compileContent(record, Map.of("score", 12)));
    }

    @Test
    void tracesStateChanges() {
        var sink = new RecordingTraceSink();
        var tracing = new PassageCompiler(TagLookup.none(), fixedRandom(1), sink, ExecutionContext.DEFAULT_MAX_ITERATIONS, List.of());

        tracing.compile(RawPassageRecord.of("Start", "", "(set: $score to 50)"), Map.of(), VisitLog.empty());

        assertTrue(sink.lines().contains("[SET] score = 50"));
        assertTrue(sink.lines().contains("[STATE_CHANGES] Passage \"Start\" changes: {score: 50}"));
    }

    @Test
    void keepsRecordTags() {
        var passage = compiler.compile(RawPassageRecord.of("Shop", "town market", "Buy"), Map.of(), VisitLog.empty());
        assertEquals(List.of("town", "market"), passage.tags());
        assertFalse(passage.hasStateChanges());
    }

    private Passage compile(String body, Map<String, ?> snapshot) {
        return compiler.compile(RawPassageRecord.of("Test", "", body), snapshot, VisitLog.empty());
    }
}
