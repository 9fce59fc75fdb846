package work.lcod.graphgen.emit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.topology.DispatchEntry;
import work.lcod.graphgen.topology.ResolvedGraph;
import work.lcod.graphgen.topology.Transition;
import work.lcod.graphgen.types.StaticType;

/**
 * Writes one final class holding the state type, node and router stubs and the dispatch loop, plus a JUnit 5 test
 * class next to it. The dynamic fallback type is Jackson's {@code JsonNode}.
 */
public final class JavaEmitter implements CodeEmitter {
    private static final List<String> RESERVED_FUNCTIONS = List.of(
        "run", "selectBranch", "main", "state", "initial", "current", "label", "node",
        "TERMINAL", "WorkflowException", "NodeException", "DispatchException", "NodeFunction", "RouterFunction"
    );

    /**
     * Simple type names the generated sources refer to. Generated type and field names must not shadow or obscure
     * any of them.
     */
    static final Set<String> RESERVED_TYPES = Set.of(
        "Objects", "List", "ArrayList", "Map", "LinkedHashMap", "JsonNode", "NullNode",
        "Object", "String", "Long", "Double", "Boolean", "Exception", "Throwable", "UnsupportedOperationException",
        "FunctionalInterface", "WorkflowException", "NodeException", "DispatchException", "NodeFunction",
        "RouterFunction", "Test"
    );

    private final EmitterOptions options;
    private final TemplateCache templates;
    private final String className;
    private final String stateTypeName;

    public JavaEmitter(EmitterOptions options) {
        this(options, TemplateCache.shared());
    }

    JavaEmitter(EmitterOptions options, TemplateCache templates) {
        this.options = options == null ? EmitterOptions.defaults() : options;
        this.templates = templates;
        this.className = clearOf(RESERVED_TYPES, this.options.className(), "Workflow");
        var state = new HashSet<>(RESERVED_TYPES);
        state.add(className);
        this.stateTypeName = clearOf(state, this.options.stateTypeName(), "State");
    }

    /**
     * Class and state type names actually written; differ from the options only when those name a reserved type.
     */
    String className() {
        return className;
    }

    String stateTypeName() {
        return stateTypeName;
    }

    private static String clearOf(Set<String> taken, String preferred, String suffix) {
        var name = preferred;
        while (taken.contains(name)) {
            name = name + suffix;
        }
        return name;
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.JAVA;
    }

    @Override
    public SourceArtifact emit(GraphInfo graph, ResolvedGraph resolved, Map<String, StaticType> types) {
        var reservedFunctions = new ArrayList<>(RESERVED_FUNCTIONS);
        reservedFunctions.add(className);
        reservedFunctions.add(stateTypeName);
        var plan = EmissionPlan.build(graph, resolved, types, RESERVED_TYPES, reservedFunctions);

        var sections = new LinkedHashMap<String, String>();
        sections.put(SourceArtifact.STATE_TYPE, stateType(plan));
        for (var node : graph.nodes()) {
            sections.put(SourceArtifact.nodeSection(node.id()), nodeStub(plan, node.id()));
        }
        for (var router : plan.routers()) {
            sections.put(SourceArtifact.routerSection(router.routerName()), routerStub(router));
        }
        sections.put(SourceArtifact.DISPATCH, dispatch(plan));
        Optional<String> tests = options.emitTests() ? Optional.of(tests(plan)) : Optional.empty();
        tests.ifPresent(text -> sections.put(SourceArtifact.TESTS, text));

        var mainSource = mainSource(plan, sections);
        var directory = options.packageName().isEmpty() ? "" : options.packageName().replace('.', '/') + "/";
        return new SourceArtifact(
            TargetLanguage.JAVA,
            sections,
            directory + className + ".java",
            mainSource,
            tests.map(text -> directory + className + "Test.java"),
            tests.map(text -> testSource(plan, text))
        );
    }

    private String mainSource(EmissionPlan plan, Map<String, String> sections) {
        var out = new SourceWriter(0);
        packageLine(out);
        imports(plan).forEach(imported -> out.line("import " + imported + ";"));
        out.blank();
        out.line("/**");
        out.line(" * Generated from workflow graph " + Literals.comment(Literals.javaString(plan.graph().displayName()))
            + ". Node and router bodies are placeholders.");
        out.line(" */");
        out.open("public final class " + className + " {");
        out.line("public static final String TERMINAL = " + Literals.javaString(GraphInfo.TERMINAL) + ";");
        out.blank();
        out.line("private " + className + "() {}");
        out.blank();
        out.raw(sections.get(SourceArtifact.STATE_TYPE)).blank();
        out.raw(templates.render("java/errors", Map.of("state_type", stateTypeName))).blank();
        for (var node : plan.graph().nodes()) {
            out.raw(sections.get(SourceArtifact.nodeSection(node.id()))).blank();
        }
        for (var router : plan.routers()) {
            out.raw(sections.get(SourceArtifact.routerSection(router.routerName()))).blank();
        }
        out.raw(sections.get(SourceArtifact.DISPATCH));
        out.close("}");
        return out.toString();
    }

    private void packageLine(SourceWriter out) {
        if (!options.packageName().isEmpty()) {
            out.line("package " + options.packageName() + ";");
            out.blank();
        }
    }

    private static List<String> imports(EmissionPlan plan) {
        var imports = new TreeSet<String>();
        imports.add("java.util.Objects");
        if (plan.usesType(StaticType.Kind.SEQUENCE)) {
            imports.add("java.util.ArrayList");
            imports.add("java.util.List");
        }
        if (plan.usesType(StaticType.Kind.ORDERED_DICTIONARY)) {
            imports.add("java.util.LinkedHashMap");
            imports.add("java.util.Map");
        }
        if (plan.usesType(StaticType.Kind.DYNAMIC)) {
            imports.add("com.fasterxml.jackson.databind.JsonNode");
            imports.add("com.fasterxml.jackson.databind.node.NullNode");
        }
        return new ArrayList<>(imports);
    }

    private String stateType(EmissionPlan plan) {
        var out = new SourceWriter(1);
        out.line("/**");
        out.line(" * Workflow state; fields follow the original schema order.");
        out.line(" */");
        out.open("public static final class " + stateTypeName + " {");
        for (var field : plan.fields()) {
            if (!field.symbol().equals(field.spec().name())) {
                out.line("// originally \"" + Literals.comment(field.spec().name()) + "\"");
            }
            var declaration = "public " + renderType(field.type(), false) + " " + field.symbol();
            var initializer = initializer(field);
            out.line(initializer.map(value -> declaration + " = " + value + ";").orElse(declaration + ";"));
        }
        out.close("}");
        return out.toString();
    }

    private String nodeStub(EmissionPlan plan, String nodeId) {
        var node = plan.node(nodeId);
        var symbol = plan.nodeSymbol(nodeId);
        var state = stateTypeName;
        var out = new SourceWriter(1);
        out.line("// " + EmissionPlan.traceComment(node));
        if (!plan.isReachable(nodeId)) {
            out.line("// Unreachable from entry point " + Literals.comment(Literals.javaString(plan.resolved().entryPoint()))
                + "; kept for completion, excluded from dispatch.");
        }
        out.open("public static " + state + " " + symbol + "(" + state + " state) throws NodeException {");
        out.line("throw NodeException.notImplemented(" + Literals.javaString(nodeId) + ");");
        out.close("}");
        return out.toString();
    }

    private String routerStub(EmissionPlan.RouterStub router) {
        var labels = router.labels().stream().map(Literals::javaString).toList();
        var out = new SourceWriter(1);
        out.line("// Router \"" + Literals.comment(router.routerName()) + "\"; returns one of: "
            + Literals.comment(String.join(", ", labels)));
        out.open("public static String " + router.symbol() + "(" + stateTypeName + " state) {");
        out.line("throw new UnsupportedOperationException(" + Literals.javaString("router " + router.routerName()
            + " is not implemented") + ");");
        out.close("}");
        return out.toString();
    }

    private String dispatch(EmissionPlan plan) {
        var resolved = plan.resolved();
        var state = stateTypeName;
        var out = new SourceWriter(1);
        out.line("/**");
        out.line(" * Runs the workflow from " + Literals.comment(Literals.javaString(resolved.entryPoint()))
            + " until a transition reaches {@link #TERMINAL}.");
        out.line(" */");
        out.open("public static " + state + " run(" + state + " initial) throws WorkflowException {");
        out.line(state + " state = Objects.requireNonNull(initial, \"initial\");");
        out.line("String current = " + Literals.javaString(resolved.entryPoint()) + ";");
        out.open("while (!TERMINAL.equals(current)) {");
        out.open("switch (current) {");
        for (var entry : resolved.dispatchTable()) {
            out.open("case " + Literals.javaString(entry.nodeId()) + " -> {");
            out.line("state = " + plan.nodeSymbol(entry.nodeId()) + "(state);");
            if (entry.conditional().isPresent()) {
                var conditional = entry.conditional().get();
                conditional.branches().forEach((label, target) -> {
                    var transition = Transition.branch(entry.nodeId(), label, target);
                    if (plan.isLoopBack(transition)) {
                        out.line("// loop-back: " + Literals.comment(transition.toString()));
                    }
                });
                out.line("current = selectBranch(" + Literals.javaString(entry.nodeId()) + ", "
                    + plan.routerSymbol(conditional.routerName()) + "(state));");
            } else {
                var next = entry.unconditionalNext().orElse(GraphInfo.TERMINAL);
                var transition = Transition.unconditional(entry.nodeId(), next);
                if (plan.isLoopBack(transition)) {
                    out.line("// loop-back: " + Literals.comment(transition.toString()));
                }
                out.line("current = " + targetExpression(next) + ";");
            }
            out.close("}");
        }
        out.line("default -> throw new DispatchException(current, null);");
        out.close("}");
        out.close("}");
        out.line("return state;");
        out.close("}");

        var conditionals = plan.conditionalEntries();
        if (!conditionals.isEmpty()) {
            out.blank();
            selectBranch(out, conditionals);
        }
        return out.toString();
    }

    private static void selectBranch(SourceWriter out, List<DispatchEntry> conditionals) {
        out.line("/**");
        out.line(" * Resolves a router label against the branch table of {@code node}; undeclared labels are fatal.");
        out.line(" */");
        out.open("public static String selectBranch(String node, String label) throws DispatchException {");
        out.open("if (label != null) {");
        out.open("switch (node) {");
        for (var entry : conditionals) {
            out.open("case " + Literals.javaString(entry.nodeId()) + " -> {");
            out.open("switch (label) {");
            entry.conditional().orElseThrow().branches().forEach((label, target) -> out
                .open("case " + Literals.javaString(label) + " -> {")
                .line("return " + targetExpression(target) + ";")
                .close("}"));
            out.line("default -> { }");
            out.close("}");
            out.close("}");
        }
        out.line("default -> { }");
        out.close("}");
        out.close("}");
        out.line("throw new DispatchException(node, label);");
        out.close("}");
    }

    private String tests(EmissionPlan plan) {
        var owner = className;
        var state = owner + "." + stateTypeName;
        var out = new SourceWriter(1);
        out.line("@Test");
        out.open("void stateStartsWithSchemaDefaults() {");
        out.line("var state = new " + state + "();");
        for (var field : plan.fields()) {
            out.line(defaultAssertion(field));
        }
        out.close("}");

        var entry = plan.resolved().entryPoint();
        out.blank();
        out.line("@Test");
        out.open("void entryNodeAcceptsAndReturnsState() {");
        out.line(owner + ".NodeFunction entry = " + owner + "::" + plan.nodeSymbol(entry) + ";");
        out.open("try {");
        out.line(state + " result = entry.apply(new " + state + "());");
        out.line("assertNotNull(result);");
        out.reopen("} catch (" + owner + ".NodeException ex) {");
        out.line("assertTrue(ex.isNotImplemented(), ex.getMessage());");
        out.close("}");
        out.close("}");

        for (var conditionalEntry : plan.conditionalEntries()) {
            var conditional = conditionalEntry.conditional().orElseThrow();
            var node = Literals.javaString(conditionalEntry.nodeId());
            var method = plan.symbols().helper("routesFrom_" + plan.nodeSymbol(conditionalEntry.nodeId()) + "_coverDeclaredLabels");
            out.blank();
            out.line("@Test");
            out.open("void " + method + "() throws Exception {");
            out.line(owner + ".RouterFunction router = " + owner + "::" + plan.routerSymbol(conditional.routerName()) + ";");
            out.line("assertNotNull(router);");
            conditional.branches().forEach((label, target) -> out.line("assertEquals("
                + (GraphInfo.isTerminal(target) ? owner + ".TERMINAL" : Literals.javaString(target))
                + ", " + owner + ".selectBranch(" + node + ", " + Literals.javaString(label) + "));"));
            out.line("assertThrows(" + owner + ".DispatchException.class, () -> " + owner + ".selectBranch(" + node + ", "
                + Literals.javaString(EmissionPlan.undeclaredLabel(conditional)) + "));");
            out.close("}");
        }
        return out.toString();
    }

    private String testSource(EmissionPlan plan, String tests) {
        var out = new SourceWriter(0);
        packageLine(out);
        out.line("import static org.junit.jupiter.api.Assertions.assertEquals;");
        out.line("import static org.junit.jupiter.api.Assertions.assertNotNull;");
        out.line("import static org.junit.jupiter.api.Assertions.assertNull;");
        out.line("import static org.junit.jupiter.api.Assertions.assertThrows;");
        out.line("import static org.junit.jupiter.api.Assertions.assertTrue;");
        out.blank();
        out.line("import org.junit.jupiter.api.Test;");
        out.blank();
        out.open("class " + className + "Test {");
        out.raw(tests);
        out.close("}");
        return out.toString();
    }

    private static String defaultAssertion(EmissionPlan.StateField field) {
        var access = "state." + field.symbol();
        var type = field.type();
        return switch (type.kind()) {
            case NULLABLE -> "assertNull(" + access + ");";
            case SEQUENCE, ORDERED_DICTIONARY -> "assertTrue(" + access + ".isEmpty());";
            case DYNAMIC -> "assertTrue(" + access + ".isNull());";
            default -> "assertEquals(" + primitiveLiteral(field) + ", " + access + ");";
        };
    }

    private static Optional<String> initializer(EmissionPlan.StateField field) {
        var type = field.type();
        return switch (type.kind()) {
            case NULLABLE -> Optional.empty();
            case SEQUENCE -> Optional.of("new ArrayList<>()");
            case ORDERED_DICTIONARY -> Optional.of("new LinkedHashMap<>()");
            case DYNAMIC -> Optional.of("NullNode.getInstance()");
            default -> Optional.of(primitiveLiteral(field));
        };
    }

    private static String primitiveLiteral(EmissionPlan.StateField field) {
        var literal = EmissionPlan.literalDefault(field);
        return switch (field.type().kind()) {
            case TEXT -> Literals.javaString((String) literal.orElse(""));
            case INT64 -> literal.orElse(0L) + "L";
            case FLOAT64 -> Double.toString((Double) literal.orElse(0.0d));
            case BOOLEAN -> literal.orElse(Boolean.FALSE).toString();
            default -> throw new IllegalStateException("Not a primitive type: " + field.type());
        };
    }

    private static String targetExpression(String target) {
        return GraphInfo.isTerminal(target) ? "TERMINAL" : Literals.javaString(target);
    }

    /**
     * Java spelling of a static type; {@code boxed} is required inside generic arguments.
     */
    static String renderType(StaticType type, boolean boxed) {
        return switch (type.kind()) {
            case TEXT -> "String";
            case INT64 -> boxed ? "Long" : "long";
            case FLOAT64 -> boxed ? "Double" : "double";
            case BOOLEAN -> boxed ? "Boolean" : "boolean";
            case SEQUENCE -> "List<" + renderType(type.argument(0), true) + ">";
            case ORDERED_DICTIONARY -> "Map<" + renderType(type.argument(0), true) + ", " + renderType(type.argument(1), true) + ">";
            case NULLABLE -> renderType(type.argument(0), true);
            case DYNAMIC -> "JsonNode";
        };
    }
}
