package work.lcod.graphgen.support;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.graphgen.ir.DynamicTypeDescriptor;
import work.lcod.graphgen.ir.FieldSpec;
import work.lcod.graphgen.ir.GraphInfo;

/**
 * Small graphs shared by the resolver, emitter and pipeline suites.
 */
public final class GraphFixtures {
    private GraphFixtures() {}

    /**
     * {@code a -> b -> c -> END}, no routers.
     */
    public static GraphInfo linear() {
        return GraphInfo.builder()
            .name("linear")
            .node("a", "First step")
            .node("b")
            .node("c")
            .edge("a", "b")
            .edge("b", "c")
            .edge("c", GraphInfo.TERMINAL)
            .field("message", DynamicTypeDescriptor.string())
            .field("count", DynamicTypeDescriptor.integer())
            .entryPoint("a")
            .build();
    }

    /**
     * {@code start} routes through {@code route_based_on_value} to {@code high_path} or {@code low_path}.
     */
    public static GraphInfo branching() {
        return GraphInfo.builder()
            .name("branching")
            .node("start")
            .node("high_path")
            .node("low_path")
            .conditional("start", "route_based_on_value", ordered("high", "high_path", "low", "low_path"))
            .edge("high_path", GraphInfo.TERMINAL)
            .edge("low_path", GraphInfo.TERMINAL)
            .field("value", DynamicTypeDescriptor.integer())
            .entryPoint("start")
            .build();
    }

    /**
     * Single-node graph whose only field maps strings to an unrecognised value type.
     */
    public static GraphInfo opaqueScores() {
        return GraphInfo.builder()
            .name("scores")
            .node("score")
            .edge("score", GraphInfo.TERMINAL)
            .field("scores", DynamicTypeDescriptor.mapping(DynamicTypeDescriptor.string(), DynamicTypeDescriptor.opaque("ScoreCard")))
            .entryPoint("score")
            .build();
    }

    /**
     * {@code a -> END} plus an orphan node {@code orphan -> a} nobody reaches.
     */
    public static GraphInfo withOrphan() {
        return GraphInfo.builder()
            .name("orphaned")
            .node("a")
            .node("orphan", "Never scheduled")
            .edge("a", GraphInfo.TERMINAL)
            .edge("orphan", "a")
            .entryPoint("a")
            .build();
    }

    /**
     * {@code fetch -> check}, where {@code check} retries back to {@code fetch} or finishes.
     */
    public static GraphInfo retryLoop() {
        return GraphInfo.builder()
            .name("retry loop")
            .node("fetch")
            .node("check")
            .edge("fetch", "check")
            .conditional("check", "should_retry", ordered("retry", "fetch", "done", GraphInfo.TERMINAL))
            .field(FieldSpec.of("attempts", DynamicTypeDescriptor.integer()).withDefault(0))
            .field(FieldSpec.optional("last_error", DynamicTypeDescriptor.string()))
            .field("payload", DynamicTypeDescriptor.collection(DynamicTypeDescriptor.string()))
            .entryPoint("fetch")
            .build();
    }

    /**
     * Graph named {@code objects} whose node, router, field and label names collide with Java keywords, the
     * generated class members and the types the generated source imports.
     */
    public static GraphInfo awkwardNames() {
        return GraphInfo.builder()
            .name("objects")
            .node("class")
            .node("2nd step", "Second \"quoted\" */ step")
            .node("node")
            .node("café")
            .edge("class", "2nd step")
            .edge("2nd step", "node")
            .conditional("node", "switch", ordered("a b", "café", "\"done\"", "END", "again", "class"))
            .edge("café", "END")
            .field("NullNode", DynamicTypeDescriptor.opaque("Blob"))
            .field("List", DynamicTypeDescriptor.collection(DynamicTypeDescriptor.string()))
            .field("Objects", DynamicTypeDescriptor.mapping(DynamicTypeDescriptor.string(), DynamicTypeDescriptor.integer()))
            .field(FieldSpec.of("default", DynamicTypeDescriptor.string()).withDefault("x"))
            .field("my-field", DynamicTypeDescriptor.floating())
            .entryPoint("class")
            .build();
    }

    /**
     * {@code n0 -> n1 -> ... -> END}; {@code length} nodes plus as many edges.
     */
    public static GraphInfo chain(int length) {
        var builder = GraphInfo.builder().name("chain");
        for (int i = 0; i < length; i++) {
            builder.node("n" + i);
            builder.edge("n" + i, i + 1 < length ? "n" + (i + 1) : GraphInfo.TERMINAL);
        }
        return builder.entryPoint("n0").build();
    }

    public static Map<String, String> ordered(String... labelsAndTargets) {
        var mapping = new LinkedHashMap<String, String>();
        for (int i = 0; i < labelsAndTargets.length; i += 2) {
            mapping.put(labelsAndTargets[i], labelsAndTargets[i + 1]);
        }
        return mapping;
    }

    public static Path resource(String name) {
        var url = GraphFixtures.class.getResource("/graphs/" + name);
        if (url == null) {
            throw new IllegalStateException("Missing test resource graphs/" + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException ex) {
            throw new IllegalStateException("Invalid resource URI for " + name, ex);
        }
    }
}
