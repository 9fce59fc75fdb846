package work.lcod.graphgen.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.graphgen.ir.DynamicTypeDescriptor;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.support.Generation;
import work.lcod.graphgen.support.GraphFixtures;

class JavaEmitterTest {
    private final JavaEmitter emitter = new JavaEmitter(EmitterOptions.defaults());

    @Test
    void linearGraphProducesOneStubPerNodeAndChainedDispatch() throws Exception {
        var artifact = Generation.emit(emitter, GraphFixtures.linear());
        assertEquals(
            List.of("state_type", "node:a", "node:b", "node:c", "dispatch", "tests"),
            List.copyOf(artifact.sections().keySet())
        );
        var nodeA = artifact.section("node:a").orElseThrow();
        assertTrue(nodeA.contains("// Node \"a\": First step"));
        assertTrue(nodeA.contains("public static GraphState a(GraphState state) throws NodeException {"));
        assertTrue(nodeA.contains("throw NodeException.notImplemented(\"a\");"));

        var dispatch = artifact.section("dispatch").orElseThrow();
        assertTrue(dispatch.contains("String current = \"a\";"));
        assertTrue(dispatch.contains("while (!TERMINAL.equals(current)) {"));
        assertTrue(dispatch.contains("current = \"b\";"));
        assertTrue(dispatch.contains("current = TERMINAL;"));
        assertTrue(dispatch.contains("default -> throw new DispatchException(current, null);"));
        assertFalse(dispatch.contains("selectBranch"));
    }

    @Test
    void assemblesCompilationUnitWithErrorTypes() throws Exception {
        var artifact = Generation.emit(emitter, GraphFixtures.linear());
        assertEquals("GeneratedWorkflow.java", artifact.mainFileName());
        var source = artifact.mainSource();
        assertTrue(source.startsWith("import java.util.Objects;"));
        assertTrue(source.contains("public final class GeneratedWorkflow {"));
        assertTrue(source.contains("public static final String TERMINAL = \"__end__\";"));
        assertTrue(source.contains("public static final class NodeException extends WorkflowException {"));
        assertTrue(source.contains("public static final class DispatchException extends WorkflowException {"));
        assertTrue(source.contains("GraphState apply(GraphState state) throws NodeException;"));
        assertTrue(source.contains("public String message = \"\";"));
        assertTrue(source.contains("public long count = 0L;"));
        assertTrue(source.strip().endsWith("}"));
    }

    @Test
    void routerDispatchUsesBranchTable() throws Exception {
        var artifact = Generation.emit(emitter, GraphFixtures.branching());
        var router = artifact.section("router:route_based_on_value").orElseThrow();
        assertTrue(router.contains("returns one of: \"high\", \"low\""));
        assertTrue(router.contains("public static String route_based_on_value(GraphState state) {"));

        var dispatch = artifact.section("dispatch").orElseThrow();
        assertTrue(dispatch.contains("current = selectBranch(\"start\", route_based_on_value(state));"));
        assertTrue(dispatch.contains("public static String selectBranch(String node, String label) throws DispatchException {"));
        assertTrue(dispatch.contains("case \"high\" -> {"));
        assertTrue(dispatch.contains("return \"high_path\";"));
        assertTrue(dispatch.contains("return \"low_path\";"));
        assertTrue(dispatch.contains("throw new DispatchException(node, label);"));
    }

    @Test
    void generatedTestsCoverEveryDeclaredLabel() throws Exception {
        var artifact = Generation.emit(emitter, GraphFixtures.branching());
        assertEquals("GeneratedWorkflowTest.java", artifact.testFileName().orElseThrow());
        var tests = artifact.testSource().orElseThrow();
        assertTrue(tests.contains("class GeneratedWorkflowTest {"));
        assertTrue(tests.contains("void stateStartsWithSchemaDefaults()"));
        assertTrue(tests.contains("assertEquals(0L, state.value);"));
        assertTrue(tests.contains("GeneratedWorkflow.NodeFunction entry = GeneratedWorkflow::start;"));
        assertTrue(tests.contains("void routesFrom_start_coverDeclaredLabels() throws Exception {"));
        assertTrue(tests.contains("assertEquals(\"high_path\", GeneratedWorkflow.selectBranch(\"start\", \"high\"));"));
        assertTrue(tests.contains("assertEquals(\"low_path\", GeneratedWorkflow.selectBranch(\"start\", \"low\"));"));
        assertTrue(tests.contains("GeneratedWorkflow.selectBranch(\"start\", \"__undeclared__\")"));
    }

    @Test
    void loopBackTransitionIsAnnotated() throws Exception {
        var artifact = Generation.emit(emitter, GraphFixtures.retryLoop());
        var dispatch = artifact.section("dispatch").orElseThrow();
        assertTrue(dispatch.contains("// loop-back: check -[retry]-> fetch"));
        assertTrue(dispatch.contains("return TERMINAL;"));
        var tests = artifact.testSource().orElseThrow();
        assertTrue(tests.contains("assertEquals(GeneratedWorkflow.TERMINAL, GeneratedWorkflow.selectBranch(\"check\", \"done\"));"));
    }

    @Test
    void stateFieldsUseMappedTypesAndDefaults() throws Exception {
        var artifact = Generation.emit(emitter, GraphFixtures.retryLoop());
        var state = artifact.section("state_type").orElseThrow();
        assertTrue(state.contains("public long attempts = 0L;"));
        assertTrue(state.contains("public String last_error;"));
        assertTrue(state.contains("public List<String> payload = new ArrayList<>();"));
        assertTrue(artifact.mainSource().contains("import java.util.List;"));
        var tests = artifact.testSource().orElseThrow();
        assertTrue(tests.contains("assertNull(state.last_error);"));
        assertTrue(tests.contains("assertTrue(state.payload.isEmpty());"));
    }

    @Test
    void dynamicFallbackUsesJsonNode() throws Exception {
        var artifact = Generation.emit(emitter, GraphFixtures.opaqueScores());
        var source = artifact.mainSource();
        assertTrue(source.contains("import com.fasterxml.jackson.databind.JsonNode;"));
        assertTrue(source.contains("public Map<String, JsonNode> scores = new LinkedHashMap<>();"));
    }

    @Test
    void unreachableNodeIsStubbedButNotDispatched() throws Exception {
        var artifact = Generation.emit(emitter, GraphFixtures.withOrphan());
        var orphan = artifact.section("node:orphan").orElseThrow();
        assertTrue(orphan.contains("// Unreachable from entry point \"a\""));
        assertTrue(orphan.contains("public static GraphState orphan(GraphState state) throws NodeException {"));
        assertFalse(artifact.section("dispatch").orElseThrow().contains("case \"orphan\""));
    }

    @Test
    void reservedAndInvalidNamesAreSanitized() throws Exception {
        var graph = GraphInfo.builder()
            .node("class")
            .node("run")
            .node("fetch data")
            .edge("class", "run")
            .edge("run", "fetch data")
            .edge("fetch data", "END")
            .field("user name", DynamicTypeDescriptor.string())
            .field("default", DynamicTypeDescriptor.bool())
            .entryPoint("class")
            .build();
        var artifact = Generation.emit(emitter, graph);
        var source = artifact.mainSource();
        assertTrue(source.contains("public static GraphState _class(GraphState state)"));
        assertTrue(source.contains("public static GraphState run_2(GraphState state)"));
        assertTrue(source.contains("public static GraphState fetch_data(GraphState state)"));
        assertTrue(source.contains("case \"fetch data\" -> {"));
        assertTrue(source.contains("// originally \"user name\""));
        assertTrue(source.contains("public String user_name = \"\";"));
        assertTrue(source.contains("public boolean _default = false;"));
    }

    @Test
    void classStateAndFieldNamesStayClearOfImportedTypes() throws Exception {
        var emitter = new JavaEmitter(new EmitterOptions("", "Objects", "List", true));
        var artifact = Generation.emit(emitter, GraphFixtures.awkwardNames());
        assertEquals("ObjectsWorkflow.java", artifact.mainFileName());
        assertEquals("ObjectsWorkflowTest.java", artifact.testFileName().orElseThrow());
        var source = artifact.mainSource();
        assertTrue(source.contains("import java.util.Objects;"));
        assertTrue(source.contains("public final class ObjectsWorkflow {"));
        assertTrue(source.contains("public static final class ListState {"));
        assertTrue(source.contains("public JsonNode NullNode_2 = NullNode.getInstance();"));
        assertTrue(source.contains("public List<String> List_2 = new ArrayList<>();"));
        assertTrue(source.contains("public Map<String, Long> Objects_2 = new LinkedHashMap<>();"));
        assertTrue(source.contains("ListState state = Objects.requireNonNull(initial, \"initial\");"));
        assertTrue(artifact.testSource().orElseThrow().contains("class ObjectsWorkflowTest {"));
    }

    @Test
    void unreservedNamesAreKeptAsConfigured() {
        var emitter = new JavaEmitter(new EmitterOptions("", "Pipeline", "Context", true));
        assertEquals("Pipeline", emitter.className());
        assertEquals("Context", emitter.stateTypeName());
        var test = new JavaEmitter(new EmitterOptions("", "Test", "NodeException", true));
        assertEquals("TestWorkflow", test.className());
        assertEquals("NodeExceptionState", test.stateTypeName());
    }

    @Test
    void packageAndTestToggleAreHonoured() throws Exception {
        var options = EmitterOptions.defaults().withPackage("com.example.flow").withClassName("Pipeline").withTests(false);
        var artifact = Generation.emit(new JavaEmitter(options), GraphFixtures.linear());
        assertEquals("com/example/flow/Pipeline.java", artifact.mainFileName());
        assertTrue(artifact.mainSource().startsWith("package com.example.flow;\n\n"));
        assertTrue(artifact.testSource().isEmpty());
        assertTrue(artifact.section("tests").isEmpty());
        assertEquals(1, artifact.files().size());
    }

    @Test
    void identicalInputsGiveIdenticalOutput() throws Exception {
        var first = Generation.emit(emitter, GraphFixtures.retryLoop());
        var second = Generation.emit(new JavaEmitter(EmitterOptions.defaults()), GraphFixtures.retryLoop());
        assertEquals(first.mainSource(), second.mainSource());
        assertEquals(first.testSource(), second.testSource());
    }
}
