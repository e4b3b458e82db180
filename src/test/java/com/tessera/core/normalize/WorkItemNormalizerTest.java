package com.tessera.core.normalize;

import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.WorkItem;
import com.tessera.core.model.WorkItemDraft;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkItemNormalizerTest {

    private WorkItemNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new WorkItemNormalizer();
    }

    private static WorkItemDraft draft(String id, String description, Set<String> deps, String stage) {
        return new WorkItemDraft(id, description, null, null, null, null, deps, stage);
    }

    @Test
    @DisplayName("Bare description gets defaults derived from its text")
    void defaultsFromText() {
        WorkItem item = normalizer.normalize(WorkItemDraft.describing("  Measure the playground in teams "), 1);

        assertEquals("ITEM-001", item.id());
        assertEquals("Measure the playground in teams", item.description());
        assertEquals(WorkItemNormalizer.DEFAULT_COMPLEXITY, item.complexity());
        assertEquals(CollaborationMode.GROUP, item.collaborationMode());
        assertEquals(36, item.estimatedDurationMinutes());
        assertEquals(Set.of("collaboration", "precision", "mathematics"), item.requiredCompetencies());
        assertEquals(KeywordTable.STAGE_EXECUTION, item.stage());
    }

    @Test
    @DisplayName("Explicit values are kept, complexity is clamped and tags normalized")
    void explicitValues() {
        var draft = new WorkItemDraft("t1", "Write the report", Set.of("Critical Thinking"), 9,
                CollaborationMode.PAIR, 20, null, "Execution");

        WorkItem item = normalizer.normalize(draft, 4);

        assertEquals("ITEM-004", item.id());
        assertEquals(5, item.complexity());
        assertEquals(CollaborationMode.PAIR, item.collaborationMode());
        assertEquals(20, item.estimatedDurationMinutes());
        assertEquals(Set.of("critical-thinking"), item.requiredCompetencies());
        assertEquals("execution", item.stage());
    }

    @Test
    @DisplayName("Huge parsed complexity clamps to the top and huge durations to one day")
    void hugeValues() {
        var draft = new WorkItemDraft(null, "Measure the room", null,
                FieldValues.firstInteger("3000000000").orElseThrow(), null, 1_215_752_191, null, null);

        WorkItem item = normalizer.normalize(draft, 1);

        assertEquals(WorkItem.MAX_COMPLEXITY, item.complexity());
        assertEquals(FieldValues.MAX_DURATION_MINUTES, item.estimatedDurationMinutes());
    }

    @Test
    @DisplayName("Default duration stays within 15-60 minutes")
    void defaultDurationClamped() {
        var easy = new WorkItemDraft(null, "Sort the cards", null, 1, null, null, null, null);
        var hard = new WorkItemDraft(null, "Sort the cards", null, 5, null, null, null, null);
        assertEquals(15, normalizer.normalize(easy, 1).estimatedDurationMinutes());
        assertEquals(60, normalizer.normalize(hard, 1).estimatedDurationMinutes());
    }

    @Test
    @DisplayName("Draft without description is rejected")
    void rejectsUndescribed() {
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(WorkItemDraft.describing(" "), 1));
        assertThrows(IllegalArgumentException.class,
                () -> normalizer.normalizeBatch(List.of(WorkItemDraft.describing("ok"), WorkItemDraft.describing(null))));
    }

    @Test
    @DisplayName("Batch resolves draft ids, ordinals and stage names, and drops self and unknown references")
    void batchResolvesReferences() {
        var drafts = List.of(
                draft("task 1", "Prepare the materials", null, "preparation"),
                draft("task 2", "Build the model", Set.of("task 1", "task 2"), "execution"),
                draft("task 3", "Present the model", Set.of("2", "preparation", "task 9", "ghost"), "execution"));

        List<WorkItem> items = normalizer.normalizeBatch(drafts);

        assertEquals(List.of("ITEM-001", "ITEM-002", "ITEM-003"), items.stream().map(WorkItem::id).toList());
        assertTrue(items.get(0).dependencies().isEmpty());
        assertEquals(Set.of("ITEM-001"), items.get(1).dependencies());
        assertEquals(Set.of("ITEM-002", "ITEM-001"), items.get(2).dependencies());
    }

    @Test
    @DisplayName("Normalizing an already normalized batch changes nothing")
    void idempotent() {
        var drafts = List.of(
                draft("a", "Prepare the materials", null, null),
                draft("b", "Experiment with water together", Set.of("a"), null),
                draft("c", "Reflect on the results", Set.of("b"), null));

        List<WorkItem> once = normalizer.normalizeBatch(drafts);
        List<WorkItem> twice = normalizer.normalizeBatch(once.stream().map(WorkItemDraft::of).toList());

        assertEquals(once, twice);
    }

    @Test
    @DisplayName("Empty batch normalizes to an empty list")
    void emptyBatch() {
        assertTrue(normalizer.normalizeBatch(List.of()).isEmpty());
        assertTrue(normalizer.normalizeBatch(null).isEmpty());
    }
}
