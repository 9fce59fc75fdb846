package work.lcod.graphgen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.graphgen.diagnostics.Diagnostic;
import work.lcod.graphgen.diagnostics.DiagnosticKind;
import work.lcod.graphgen.emit.TargetLanguage;
import work.lcod.graphgen.ir.DynamicTypeDescriptor;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.ir.io.GraphInfoLoader;
import work.lcod.graphgen.support.GraphFixtures;
import work.lcod.graphgen.topology.GraphErrorKind;
import work.lcod.graphgen.topology.GraphException;
import work.lcod.graphgen.topology.TopologyResolver;
import work.lcod.graphgen.types.StaticType;

class GraphGeneratorTest {
    @Test
    void cleanGraphProducesNoDiagnostics() throws Exception {
        var result = new GraphGenerator().generate(GraphFixtures.linear());
        assertFalse(result.hasWarnings());
        assertEquals(List.of("Linear.java", "LinearTest.java"), List.copyOf(result.artifact().files().keySet()));
        assertEquals(StaticType.text(), result.fieldTypes().get("message"));
        assertEquals(StaticType.int64(), result.fieldTypes().get("count"));
    }

    @Test
    void opaqueFieldDegradesWithOneDiagnostic() throws Exception {
        var result = new GraphGenerator().generate(GraphFixtures.opaqueScores());
        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(DiagnosticKind.OPAQUE_FALLBACK, diagnostic.kind());
        assertEquals("scores", diagnostic.subject());
        assertEquals(StaticType.orderedDictionary(StaticType.text(), StaticType.dynamic()), result.fieldTypes().get("scores"));
    }

    @Test
    void unreachableNodeIsReportedAndStillEmitted() throws Exception {
        var result = new GraphGenerator().generate(GraphFixtures.withOrphan());
        assertEquals(List.of(Diagnostic.unreachableNode("orphan")), result.diagnostics());
        assertTrue(result.artifact().section("node:orphan").isPresent());
        assertEquals(List.of("orphan"), result.resolved().unreachableNodes());
    }

    @Test
    void topologyErrorsAbortGeneration() {
        var dangling = GraphInfo.builder().node("a").edge("a", "ghost").entryPoint("a").build();
        var ex = assertThrows(GraphException.class, () -> new GraphGenerator().generate(dangling));
        assertEquals(GraphErrorKind.DANGLING_EDGE, ex.kind());

        var tiny = new GraphGenerator(GenerationConfiguration.builder().maxGraphSize(3).build());
        var limit = assertThrows(GraphException.class, () -> tiny.generate(GraphFixtures.linear()));
        assertEquals(GraphErrorKind.LIMIT_EXCEEDED, limit.kind());
    }

    @Test
    void typeAliasesReduceFallbacks() throws Exception {
        var graph = GraphInfoLoader.load(GraphFixtures.resource("customer_support.json"));
        var plain = new GraphGenerator().generate(graph);
        assertEquals(List.of("metadata", "customer"),
            plain.diagnostics().stream().map(Diagnostic::subject).toList());

        var aliased = new GraphGenerator(GenerationConfiguration.builder()
            .typeAlias("CustomerRecord", DynamicTypeDescriptor.mapping(DynamicTypeDescriptor.string(), DynamicTypeDescriptor.string()))
            .build()).generate(graph);
        assertEquals(List.of("metadata"), aliased.diagnostics().stream().map(Diagnostic::subject).toList());
        assertEquals(
            StaticType.nullable(StaticType.orderedDictionary(StaticType.text(), StaticType.text())),
            aliased.fieldTypes().get("customer")
        );
    }

    @Test
    void classNameFollowsGraphNameUnlessConfigured() throws Exception {
        var derived = new GraphGenerator().generate(GraphFixtures.retryLoop());
        assertEquals("RetryLoop.java", derived.artifact().mainFileName());
        var clashing = new GraphGenerator().generate(GraphFixtures.awkwardNames());
        assertEquals("ObjectsWorkflow.java", clashing.artifact().mainFileName());

        var configured = new GraphGenerator(GenerationConfiguration.builder()
            .className("Retrier")
            .packageName("com.acme.flows")
            .emitTests(false)
            .build()).generate(GraphFixtures.retryLoop());
        assertEquals(List.of("com/acme/flows/Retrier.java"), List.copyOf(configured.artifact().files().keySet()));

        var rust = new GraphGenerator(GenerationConfiguration.builder().target(TargetLanguage.RUST).build())
            .generate(GraphFixtures.retryLoop());
        assertEquals("retry_loop.rs", rust.artifact().mainFileName());
    }

    @Test
    void largeGraphGeneratesBothTargetsQuickly() {
        var graph = GraphFixtures.chain(TopologyResolver.DEFAULT_MAX_GRAPH_SIZE / 2);
        for (var target : TargetLanguage.values()) {
            var generator = new GraphGenerator(GenerationConfiguration.builder().target(target).build());
            var result = assertTimeout(Duration.ofSeconds(20), () -> generator.generate(graph));
            assertFalse(result.hasWarnings());
            assertTrue(result.artifact().section("node:n4999").isPresent());
        }
    }

    @Test
    void generationIsDeterministic() throws Exception {
        var generator = new GraphGenerator();
        var first = generator.generate(GraphFixtures.retryLoop());
        var second = generator.generate(GraphFixtures.retryLoop());
        assertEquals(first.artifact().files(), second.artifact().files());
        assertEquals(first.toPrettyJson(), second.toPrettyJson());
    }

    @Test
    void summaryNamesFilesAndDiagnostics() throws Exception {
        var summary = new GraphGenerator().generate(GraphFixtures.withOrphan()).toSerializableMap();
        assertEquals("java", summary.get("target"));
        assertEquals(List.of("a"), summary.get("reachable"));
        assertEquals(List.of("orphan"), summary.get("unreachable"));
        assertEquals(1, ((List<?>) summary.get("diagnostics")).size());
    }
}
