package io.swarmmesh.topology;

import io.swarmmesh.error.TopologyTransitionException;
import io.swarmmesh.model.TopologyKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class TopologyBuilderTest {
    private final TopologyBuilder builder = new TopologyBuilder(4, 5, 20);

    @Test
    void meshConnectsEveryPairAndHasNoLeader() {
        TopologyBuilder.Layout layout = builder.build(TopologyKind.MESH, members("a", "b", "c", "d"), null);
        Assertions.assertNull(layout.leaderId());
        Assertions.assertEquals(Set.of("b", "c", "d"), layout.edges().get("a"));
        Assertions.assertEquals(Set.of("a", "b", "c"), layout.edges().get("d"));
        int edges = layout.edges().values().stream().mapToInt(Set::size).sum();
        Assertions.assertEquals(12, edges);
    }

    @Test
    void starUsesLowestIdUnlessPinned() {
        TopologyBuilder.Layout byOrder = builder.build(TopologyKind.STAR, members("c", "a", "b"), null);
        Assertions.assertEquals("a", byOrder.leaderId());
        Assertions.assertEquals(Set.of("b", "c"), byOrder.edges().get("a"));
        Assertions.assertEquals(Set.of("a"), byOrder.edges().get("b"));
        Assertions.assertFalse(byOrder.edges().get("b").contains("c"));

        List<TopologyMember> pinned = new ArrayList<>(members("a", "b"));
        pinned.add(new TopologyMember("c", true, true));
        TopologyBuilder.Layout withPin = builder.build(TopologyKind.STAR, pinned, null);
        Assertions.assertEquals("c", withPin.leaderId());
    }

    @Test
    void starSkipsAgentsThatCannotLead() {
        List<TopologyMember> list = List.of(
                new TopologyMember("a", false, false),
                new TopologyMember("b", true, false),
                new TopologyMember("c", true, false));
        Assertions.assertEquals("b", builder.build(TopologyKind.STAR, list, null).leaderId());
    }

    @Test
    void ringLinksEachAgentToItsSuccessor() {
        TopologyBuilder.Layout layout = builder.build(TopologyKind.RING, members("b", "c", "a"), null);
        Assertions.assertEquals(Set.of("b"), layout.edges().get("a"));
        Assertions.assertEquals(Set.of("c"), layout.edges().get("b"));
        Assertions.assertEquals(Set.of("a"), layout.edges().get("c"));
        Assertions.assertNull(layout.leaderId());
    }

    @Test
    void hierarchicalFillsLevelsBreadthFirst() {
        TopologyBuilder small = new TopologyBuilder(2, 5, 20);
        TopologyBuilder.Layout layout = small.build(TopologyKind.HIERARCHICAL,
                members("a1", "a2", "a3", "a4", "a5", "a6"), null);
        Assertions.assertEquals("a1", layout.leaderId());
        Assertions.assertEquals(Set.of("a2", "a3"), layout.edges().get("a1"));
        Assertions.assertEquals(Set.of("a1", "a4", "a5"), layout.edges().get("a2"));
        Assertions.assertEquals(Set.of("a1", "a6"), layout.edges().get("a3"));
        Assertions.assertEquals(Set.of("a3"), layout.edges().get("a6"));
    }

    @Test
    void hierarchicalWithoutEligibleLeaderFails() {
        List<TopologyMember> list = List.of(new TopologyMember("a", false, false), new TopologyMember("b", false, false));
        Assertions.assertThrows(TopologyTransitionException.class,
                () -> builder.build(TopologyKind.HIERARCHICAL, list, null));
    }

    @Test
    void adaptiveResolvesBySwarmSize() {
        Assertions.assertEquals(TopologyKind.MESH, builder.resolveAdaptive(1, null));
        Assertions.assertEquals(TopologyKind.MESH, builder.resolveAdaptive(5, null));
        Assertions.assertEquals(TopologyKind.STAR, builder.resolveAdaptive(6, null));
        Assertions.assertEquals(TopologyKind.STAR, builder.resolveAdaptive(20, null));
        Assertions.assertEquals(TopologyKind.HIERARCHICAL, builder.resolveAdaptive(21, null));
        Assertions.assertEquals(TopologyKind.RING, builder.resolveAdaptive(21, TopologyKind.RING));

        TopologyBuilder.Layout layout = builder.build(TopologyKind.ADAPTIVE, members("a", "b", "c", "d", "e", "f"), null);
        Assertions.assertEquals(TopologyKind.STAR, layout.effectiveKind());
        Assertions.assertEquals("a", layout.leaderId());
    }

    @Test
    void singleAgentRingHasNoEdges() {
        TopologyBuilder.Layout layout = builder.build(TopologyKind.RING, members("solo"), null);
        Assertions.assertEquals(Set.of("solo"), layout.edges().keySet());
        Assertions.assertTrue(layout.edges().get("solo").isEmpty());
    }

    private static List<TopologyMember> members(String... ids) {
        List<TopologyMember> out = new ArrayList<>();
        for (String id : ids) {
            out.add(TopologyMember.plain(id));
        }
        return out;
    }
}
