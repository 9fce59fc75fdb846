package work.lcod.graphgen.topology;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.graphgen.diagnostics.DiagnosticKind;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.support.GraphFixtures;

class TopologyResolverTest {
    private final TopologyResolver resolver = new TopologyResolver();

    @Test
    void linearGraphResolvesToChain() throws Exception {
        var resolved = resolver.resolve(GraphFixtures.linear());
        assertEquals(List.of("a", "b", "c"), resolved.reachableOrder());
        assertEquals(Map.of("a", "b", "b", "c", "c", GraphInfo.TERMINAL), resolved.unconditionalTargets());
        assertTrue(resolved.warnings().isEmpty());
        assertFalse(resolved.hasLoops());
    }

    @Test
    void routerEntryCarriesEveryBranch() throws Exception {
        var resolved = resolver.resolve(GraphFixtures.branching());
        var start = resolved.entry("start").orElseThrow();
        assertTrue(start.isConditional());
        var dispatch = start.conditional().orElseThrow();
        assertEquals("route_based_on_value", dispatch.routerName());
        assertEquals(List.of("high", "low"), List.copyOf(dispatch.branches().keySet()));
        assertEquals(List.of("start", "high_path", "low_path"), resolved.reachableOrder());
        assertTrue(resolved.warnings().isEmpty());
    }

    @Test
    void unreachableNodeIsReportedButKept() throws Exception {
        var resolved = resolver.resolve(GraphFixtures.withOrphan());
        assertEquals(List.of("orphan"), resolved.unreachableNodes());
        assertTrue(resolved.entry("orphan").isEmpty());
        assertEquals(1, resolved.warnings().size());
        assertEquals(DiagnosticKind.UNREACHABLE_NODE, resolved.warnings().get(0).kind());
        assertEquals("orphan", resolved.warnings().get(0).subject());
    }

    @Test
    void loopIsPreservedAsLoopBackTransition() throws Exception {
        var resolved = resolver.resolve(GraphFixtures.retryLoop());
        assertEquals(List.of(Transition.branch("check", "retry", "fetch")), resolved.loopBackEdges());
        assertEquals("fetch", resolved.entry("check").orElseThrow().conditional().orElseThrow().branches().get("retry"));
    }

    @Test
    void selfLoopIsALoopBack() throws Exception {
        var graph = GraphInfo.builder()
            .node("poll")
            .conditional("poll", "still_waiting", GraphFixtures.ordered("again", "poll", "ready", "END"))
            .entryPoint("poll")
            .build();
        var resolved = resolver.resolve(graph);
        var loopBack = resolved.loopBackEdges().get(0);
        assertTrue(loopBack.isSelfLoop());
        assertEquals(GraphInfo.TERMINAL, resolved.entry("poll").orElseThrow().conditional().orElseThrow().branches().get("ready"));
    }

    @Test
    void nodeWithoutOutgoingEdgeEndsTheRun() throws Exception {
        var graph = GraphInfo.builder()
            .node("a")
            .node("b")
            .edge("a", "b")
            .entryPoint("a")
            .build();
        var resolved = resolver.resolve(graph);
        assertEquals(GraphInfo.TERMINAL, resolved.entry("b").orElseThrow().unconditionalNext().orElseThrow());
    }

    @Test
    void danglingEdgeIsFatal() {
        var graph = GraphInfo.builder()
            .node("a")
            .edge("a", "ghost")
            .entryPoint("a")
            .build();
        var ex = assertThrows(GraphException.class, () -> resolver.resolve(graph));
        assertEquals(GraphErrorKind.DANGLING_EDGE, ex.kind());
        assertEquals("a -> ghost", ex.subject());
        assertTrue(ex.getMessage().contains("ghost"));
    }

    @Test
    void danglingBranchTargetIsFatalEvenWhenUnreachable() {
        var graph = GraphInfo.builder()
            .node("a")
            .node("island")
            .edge("a", "END")
            .conditional("island", "pick", Map.of("x", "nowhere"))
            .entryPoint("a")
            .build();
        var ex = assertThrows(GraphException.class, () -> resolver.resolve(graph));
        assertEquals(GraphErrorKind.DANGLING_EDGE, ex.kind());
    }

    @Test
    void undeclaredEntryIsFatal() {
        var graph = GraphInfo.builder().node("a").edge("a", "END").entryPoint("missing").build();
        var ex = assertThrows(GraphException.class, () -> resolver.resolve(graph));
        assertEquals(GraphErrorKind.UNREACHABLE_ENTRY, ex.kind());
        assertEquals("missing", ex.subject());
    }

    @Test
    void entryWithoutOutgoingEdgeIsFatal() {
        var graph = GraphInfo.builder().node("a").entryPoint("a").build();
        var ex = assertThrows(GraphException.class, () -> resolver.resolve(graph));
        assertEquals(GraphErrorKind.UNREACHABLE_ENTRY, ex.kind());
    }

    @Test
    void conditionalEdgeShadowsUnconditionalOne() throws Exception {
        var graph = GraphInfo.builder()
            .node("a")
            .node("b")
            .node("c")
            .edge("a", "b")
            .conditional("a", "choose", Map.of("go", "c"))
            .edge("b", "END")
            .edge("c", "END")
            .entryPoint("a")
            .build();
        var resolved = resolver.resolve(graph);
        assertTrue(resolved.entry("a").orElseThrow().isConditional());
        assertEquals(List.of("a", "c"), resolved.reachableOrder());
        var kinds = resolved.warnings().stream().map(warning -> warning.kind()).toList();
        assertEquals(List.of(DiagnosticKind.DEAD_EDGE, DiagnosticKind.UNREACHABLE_NODE), kinds);
        assertEquals("a -> b", resolved.warnings().get(0).subject());
    }

    @Test
    void oversizedGraphIsRejected() {
        var small = new TopologyResolver(3);
        var ex = assertThrows(GraphException.class, () -> small.resolve(GraphFixtures.linear()));
        assertEquals(GraphErrorKind.LIMIT_EXCEEDED, ex.kind());
    }

    @Test
    void chainAtTheSizeLimitResolvesQuickly() {
        var graph = GraphFixtures.chain(TopologyResolver.DEFAULT_MAX_GRAPH_SIZE / 2);
        var resolved = assertTimeout(Duration.ofSeconds(10), () -> resolver.resolve(graph));
        assertEquals(graph.nodes().size(), resolved.reachableOrder().size());
        assertEquals("n0", resolved.reachableOrder().get(0));
        assertTrue(resolved.warnings().isEmpty());
        assertFalse(resolved.hasLoops());
    }

    @Test
    void resolutionIsDeterministic() throws Exception {
        var first = resolver.resolve(GraphFixtures.retryLoop());
        var second = resolver.resolve(GraphFixtures.retryLoop());
        assertEquals(first, second);
    }
}
