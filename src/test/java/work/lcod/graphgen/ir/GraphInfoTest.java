package work.lcod.graphgen.ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GraphInfoTest {
    @Test
    void endAliasIsNormalisedToTerminal() {
        var graph = GraphInfo.builder()
            .node("a")
            .edge("a", "END")
            .conditional("a", "pick", Map.of("stop", "END"))
            .entryPoint("a")
            .build();
        assertEquals(GraphInfo.TERMINAL, graph.edges().get(0).to());
        assertEquals(GraphInfo.TERMINAL, graph.conditionalEdges().get(0).mapping().get("stop"));
        assertTrue(graph.edges().get(0).isTerminal());
    }

    @Test
    void duplicateNodesAndReservedIdsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> GraphInfo.builder().node("a").node("a").entryPoint("a").build());
        assertThrows(IllegalArgumentException.class,
            () -> GraphInfo.builder().node(GraphInfo.TERMINAL).entryPoint("a").build());
        assertThrows(IllegalArgumentException.class, () -> NodeSpec.of(" "));
    }

    @Test
    void nodeNamedLikeTheTerminalAliasIsRejected() {
        var error = assertThrows(IllegalArgumentException.class, () -> GraphInfo.builder()
            .node("start")
            .node("END")
            .edge("start", "END")
            .entryPoint("start")
            .build());
        assertTrue(error.getMessage().contains("'END' is reserved"), error.getMessage());
    }

    @Test
    void duplicateFieldsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> GraphInfo.builder()
            .node("a")
            .field("x", DynamicTypeDescriptor.string())
            .field("x", DynamicTypeDescriptor.integer())
            .entryPoint("a")
            .build());
    }

    @Test
    void conditionalEdgeNeedsBranches() {
        assertThrows(IllegalArgumentException.class, () -> new ConditionalEdgeSpec("a", "pick", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new ConditionalEdgeSpec("a", " ", Map.of("x", "b")));
    }

    @Test
    void builderKeepsDeclarationOrderAndDropsRepeatedEdges() {
        var graph = GraphInfo.builder()
            .node("z")
            .node("a")
            .edge("z", "a")
            .edge("z", "a")
            .edge("a", "END")
            .entryPoint("z")
            .build();
        assertEquals(List.of("z", "a"), List.copyOf(graph.nodesById().keySet()));
        assertEquals(2, graph.edges().size());
        assertEquals("workflow", graph.displayName());
    }

    @Test
    void descriptorsDescribeThemselvesLikeAnnotations() {
        var descriptor = DynamicTypeDescriptor.optional(DynamicTypeDescriptor.collection(
            DynamicTypeDescriptor.mapping(DynamicTypeDescriptor.string(), DynamicTypeDescriptor.opaque())));
        assertEquals("Optional[list[dict[str, Any]]]", descriptor.describe());
        assertEquals(DynamicTypeDescriptor.Kind.OPTIONAL, descriptor.kind());
    }
}
