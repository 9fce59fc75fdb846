package work.lcod.graphgen.emit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.topology.DispatchEntry;
import work.lcod.graphgen.topology.ResolvedGraph;
import work.lcod.graphgen.topology.Transition;
import work.lcod.graphgen.types.StaticType;

/**
 * Writes a single Rust module: serde-backed state struct, free functions for nodes and routers, a match-based
 * dispatch loop and an inline {@code #[cfg(test)]} module.
 */
public final class RustEmitter implements CodeEmitter {
    private static final List<String> RESERVED_FUNCTIONS = List.of(
        "run", "select_branch", "main", "state", "initial", "current", "label", "other", "node", "tests", "fmt", "f",
        "TERMINAL", "WorkflowError", "NodeFn", "RouterFn", "Value", "BTreeMap", "Serialize", "Deserialize", "Default",
        "Ok", "Err", "Some", "None", "Option", "Result", "String", "Vec", "Box", "drop"
    );

    private final EmitterOptions options;
    private final TemplateCache templates;
    private final String stateTypeName;

    public RustEmitter(EmitterOptions options) {
        this(options, TemplateCache.shared());
    }

    RustEmitter(EmitterOptions options, TemplateCache templates) {
        this.options = options == null ? EmitterOptions.defaults() : options;
        this.templates = templates;
        var state = this.options.stateTypeName();
        while (RESERVED_FUNCTIONS.contains(state)) {
            state = state + "State";
        }
        this.stateTypeName = state;
    }

    @Override
    public TargetLanguage target() {
        return TargetLanguage.RUST;
    }

    @Override
    public SourceArtifact emit(GraphInfo graph, ResolvedGraph resolved, Map<String, StaticType> types) {
        var reservedFunctions = new ArrayList<>(RESERVED_FUNCTIONS);
        reservedFunctions.add(options.className());
        reservedFunctions.add(stateTypeName);
        var plan = EmissionPlan.build(graph, resolved, types, List.of(), reservedFunctions);

        var sections = new LinkedHashMap<String, String>();
        sections.put(SourceArtifact.STATE_TYPE, stateType(plan));
        for (var node : graph.nodes()) {
            sections.put(SourceArtifact.nodeSection(node.id()), nodeStub(plan, node.id()));
        }
        for (var router : plan.routers()) {
            sections.put(SourceArtifact.routerSection(router.routerName()), routerStub(router));
        }
        sections.put(SourceArtifact.DISPATCH, dispatch(plan));
        if (options.emitTests()) {
            sections.put(SourceArtifact.TESTS, tests(plan));
        }
        var fileName = options.moduleName() + "." + TargetLanguage.RUST.fileExtension();
        return new SourceArtifact(TargetLanguage.RUST, sections, fileName, mainSource(plan, sections), null, null);
    }

    private String mainSource(EmissionPlan plan, Map<String, String> sections) {
        var out = new SourceWriter(0);
        out.line("//! Generated from workflow graph " + Literals.comment(Literals.rustString(plan.graph().displayName()))
            + ". Node and router bodies are placeholders.");
        out.line("#![allow(non_snake_case, non_camel_case_types)]");
        out.blank();
        out.line("use serde::{Deserialize, Serialize};");
        if (plan.usesType(StaticType.Kind.DYNAMIC)) {
            out.line("use serde_json::Value;");
        }
        if (plan.usesType(StaticType.Kind.ORDERED_DICTIONARY)) {
            out.line("use std::collections::BTreeMap;");
        }
        out.line("use std::fmt;");
        out.blank();
        out.line("pub const TERMINAL: &str = " + Literals.rustString(GraphInfo.TERMINAL) + ";");
        out.blank();
        out.raw(sections.get(SourceArtifact.STATE_TYPE)).blank();
        out.raw(templates.render("rust/errors", Map.of("state_type", stateTypeName))).blank();
        for (var node : plan.graph().nodes()) {
            out.raw(sections.get(SourceArtifact.nodeSection(node.id()))).blank();
        }
        for (var router : plan.routers()) {
            out.raw(sections.get(SourceArtifact.routerSection(router.routerName()))).blank();
        }
        out.raw(sections.get(SourceArtifact.DISPATCH));
        var tests = sections.get(SourceArtifact.TESTS);
        if (tests != null) {
            out.blank().raw(tests);
        }
        return out.toString();
    }

    private String stateType(EmissionPlan plan) {
        var state = stateTypeName;
        var out = new SourceWriter(0);
        out.line("/// Workflow state; fields follow the original schema order.");
        out.line("#[derive(Debug, Clone, PartialEq, Serialize, Deserialize)]");
        out.open("pub struct " + state + " {");
        for (var field : plan.fields()) {
            if (!field.symbol().equals(field.spec().name())) {
                out.line("#[serde(rename = " + Literals.rustString(field.spec().name()) + ")]");
            }
            out.line("pub " + field.symbol() + ": " + renderType(field.type()) + ",");
        }
        out.close("}");
        out.blank();
        out.open("impl Default for " + state + " {");
        out.open("fn default() -> Self {");
        out.open("Self {");
        for (var field : plan.fields()) {
            out.line(field.symbol() + ": " + defaultValue(field) + ",");
        }
        out.close("}");
        out.close("}");
        out.close("}");
        return out.toString();
    }

    private String nodeStub(EmissionPlan plan, String nodeId) {
        var state = stateTypeName;
        var out = new SourceWriter(0);
        out.line("// " + EmissionPlan.traceComment(plan.node(nodeId)));
        if (!plan.isReachable(nodeId)) {
            out.line("// Unreachable from entry point " + Literals.comment(Literals.rustString(plan.resolved().entryPoint()))
                + "; kept for completion, excluded from dispatch.");
            out.line("#[allow(dead_code)]");
        }
        out.open("pub fn " + plan.nodeSymbol(nodeId) + "(state: " + state + ") -> Result<" + state + ", WorkflowError> {");
        out.line("let _ = state;");
        out.line("Err(WorkflowError::NotImplemented { node: " + Literals.rustString(nodeId) + " })");
        out.close("}");
        return out.toString();
    }

    private String routerStub(EmissionPlan.RouterStub router) {
        var labels = router.labels().stream().map(Literals::rustString).toList();
        var out = new SourceWriter(0);
        out.line("// Router \"" + Literals.comment(router.routerName()) + "\"; returns one of: "
            + Literals.comment(String.join(", ", labels)));
        out.open("pub fn " + router.symbol() + "(state: &" + stateTypeName + ") -> String {");
        out.line("let _ = state;");
        out.line("unimplemented!(\"{}\", " + Literals.rustString("router " + router.routerName() + " is not implemented") + ")");
        out.close("}");
        return out.toString();
    }

    private String dispatch(EmissionPlan plan) {
        var resolved = plan.resolved();
        var state = stateTypeName;
        var out = new SourceWriter(0);
        out.line("/// Runs the workflow from " + Literals.comment(Literals.rustString(resolved.entryPoint()))
            + " until a transition reaches `TERMINAL`.");
        out.open("pub fn run(initial: " + state + ") -> Result<" + state + ", WorkflowError> {");
        out.line("let mut state = initial;");
        out.line("let mut current: &'static str = " + Literals.rustString(resolved.entryPoint()) + ";");
        out.open("while current != TERMINAL {");
        out.open("match current {");
        for (var entry : resolved.dispatchTable()) {
            out.open(Literals.rustString(entry.nodeId()) + " => {");
            out.line("state = " + plan.nodeSymbol(entry.nodeId()) + "(state)?;");
            if (entry.conditional().isPresent()) {
                var conditional = entry.conditional().get();
                conditional.branches().forEach((label, target) -> {
                    var transition = Transition.branch(entry.nodeId(), label, target);
                    if (plan.isLoopBack(transition)) {
                        out.line("// loop-back: " + Literals.comment(transition.toString()));
                    }
                });
                out.line("let label = " + plan.routerSymbol(conditional.routerName()) + "(&state);");
                out.line("current = select_branch(" + Literals.rustString(entry.nodeId()) + ", &label)?;");
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
        out.line("other => return Err(WorkflowError::Dispatch { node: other.to_string(), label: None }),");
        out.close("}");
        out.close("}");
        out.line("Ok(state)");
        out.close("}");

        var conditionals = plan.conditionalEntries();
        if (!conditionals.isEmpty()) {
            out.blank();
            selectBranch(out, conditionals);
        }
        return out.toString();
    }

    private static void selectBranch(SourceWriter out, List<DispatchEntry> conditionals) {
        out.line("/// Resolves a router label against the branch table of `node`; undeclared labels are fatal.");
        out.open("pub fn select_branch(node: &str, label: &str) -> Result<&'static str, WorkflowError> {");
        out.open("match (node, label) {");
        for (var entry : conditionals) {
            var node = Literals.rustString(entry.nodeId());
            entry.conditional().orElseThrow().branches().forEach((label, target) ->
                out.line("(" + node + ", " + Literals.rustString(label) + ") => Ok(" + targetExpression(target) + "),"));
        }
        out.open("_ => Err(WorkflowError::Dispatch {");
        out.line("node: node.to_string(),");
        out.line("label: Some(label.to_string()),");
        out.close("}),");
        out.close("}");
        out.close("}");
    }

    private String tests(EmissionPlan plan) {
        var state = stateTypeName;
        var out = new SourceWriter(0);
        out.line("#[cfg(test)]");
        out.open("mod tests {");
        out.line("use super::*;");
        out.blank();
        out.line("#[test]");
        out.open("fn state_starts_with_schema_defaults() {");
        out.line("let state = " + state + "::default();");
        for (var field : plan.fields()) {
            out.line(defaultAssertion(field));
        }
        out.close("}");

        out.blank();
        out.line("#[test]");
        out.open("fn entry_node_accepts_and_returns_state() {");
        out.line("let entry: NodeFn = " + plan.nodeSymbol(plan.resolved().entryPoint()) + ";");
        out.open("match entry(" + state + "::default()) {");
        out.line("Ok(_) => {}");
        out.line("Err(WorkflowError::NotImplemented { .. }) => {}");
        out.line("Err(other) => panic!(\"unexpected error: {}\", other),");
        out.close("}");
        out.close("}");

        for (var entry : plan.conditionalEntries()) {
            var conditional = entry.conditional().orElseThrow();
            var node = Literals.rustString(entry.nodeId());
            var name = plan.symbols().helper("routes_from_" + plan.nodeSymbol(entry.nodeId()) + "_cover_declared_labels");
            out.blank();
            out.line("#[test]");
            out.open("fn " + name + "() {");
            out.line("let router: RouterFn = " + plan.routerSymbol(conditional.routerName()) + ";");
            out.line("let _ = router;");
            conditional.branches().forEach((label, target) -> out.line("assert_eq!(select_branch(" + node + ", "
                + Literals.rustString(label) + ").unwrap(), " + targetExpression(target) + ");"));
            out.line("assert!(matches!(select_branch(" + node + ", " + Literals.rustString(EmissionPlan.undeclaredLabel(conditional))
                + "), Err(WorkflowError::Dispatch { .. })));");
            out.close("}");
        }
        out.close("}");
        return out.toString();
    }

    private static String defaultAssertion(EmissionPlan.StateField field) {
        var access = "state." + field.symbol();
        return switch (field.type().kind()) {
            case NULLABLE -> "assert!(" + access + ".is_none());";
            case SEQUENCE, ORDERED_DICTIONARY -> "assert!(" + access + ".is_empty());";
            case DYNAMIC -> "assert!(" + access + ".is_null());";
            default -> "assert_eq!(" + access + ", " + defaultValue(field) + ");";
        };
    }

    private static String defaultValue(EmissionPlan.StateField field) {
        var literal = EmissionPlan.literalDefault(field);
        return switch (field.type().kind()) {
            case TEXT -> literal.map(value -> "String::from(" + Literals.rustString((String) value) + ")").orElse("String::new()");
            case INT64 -> literal.orElse(0L).toString();
            case FLOAT64 -> Double.toString((Double) literal.orElse(0.0d));
            case BOOLEAN -> literal.orElse(Boolean.FALSE).toString();
            case SEQUENCE -> "Vec::new()";
            case ORDERED_DICTIONARY -> "BTreeMap::new()";
            case NULLABLE -> "None";
            case DYNAMIC -> "Value::Null";
        };
    }

    private static String targetExpression(String target) {
        return GraphInfo.isTerminal(target) ? "TERMINAL" : Literals.rustString(target);
    }

    static String renderType(StaticType type) {
        return switch (type.kind()) {
            case TEXT -> "String";
            case INT64 -> "i64";
            case FLOAT64 -> "f64";
            case BOOLEAN -> "bool";
            case SEQUENCE -> "Vec<" + renderType(type.argument(0)) + ">";
            case ORDERED_DICTIONARY -> "BTreeMap<" + renderType(type.argument(0)) + ", " + renderType(type.argument(1)) + ">";
            case NULLABLE -> "Option<" + renderType(type.argument(0)) + ">";
            case DYNAMIC -> "Value";
        };
    }
}
