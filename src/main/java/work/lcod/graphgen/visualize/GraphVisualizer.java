package work.lcod.graphgen.visualize;

import java.util.List;
import work.lcod.graphgen.ir.EdgeSpec;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.naming.SymbolTable;

/**
 * Renders the declared graph as a diagram. Every node and edge is drawn, including unreachable ones; conditional
 * branches carry their label.
 */
public final class GraphVisualizer {
    private static final String START = "__start__";
    private static final List<String> MERMAID_KEYWORDS = List.of(
        "end", "graph", "flowchart", "subgraph", "style", "class", "classDef", "click", "linkStyle", "direction",
        START, GraphInfo.TERMINAL
    );

    private GraphVisualizer() {}

    public static String render(GraphInfo graph, DiagramFormat format) {
        return switch (format) {
            case MERMAID -> mermaid(graph);
            case DOT -> dot(graph);
        };
    }

    public static String mermaid(GraphInfo graph) {
        var symbols = new SymbolTable(List.of(), MERMAID_KEYWORDS);
        var out = new StringBuilder("graph TD\n");
        out.append("    ").append(START).append("((start))\n");
        for (var node : graph.nodes()) {
            out.append("    ").append(symbols.node(node.id())).append("[\"").append(mermaidText(node.displayName())).append("\"]\n");
        }
        out.append("    ").append(START).append(" --> ").append(mermaidNode(symbols, graph.entryPoint())).append('\n');
        for (var edge : graph.edges()) {
            out.append("    ").append(mermaidNode(symbols, edge.from()))
                .append(" --> ").append(mermaidNode(symbols, edge.to())).append('\n');
        }
        for (var edge : graph.conditionalEdges()) {
            edge.mapping().forEach((label, target) -> out.append("    ").append(mermaidNode(symbols, edge.from()))
                .append(" -.->|\"").append(mermaidText(label)).append("\"| ")
                .append(mermaidNode(symbols, target)).append('\n'));
        }
        if (usesTerminal(graph)) {
            out.append("    ").append(GraphInfo.TERMINAL).append("((end))\n");
        }
        return out.toString();
    }

    public static String dot(GraphInfo graph) {
        var out = new StringBuilder("digraph ").append(dotId(graph.displayName())).append(" {\n");
        out.append("    rankdir=TB;\n");
        out.append("    ").append(dotId(START)).append(" [shape=point];\n");
        for (var node : graph.nodes()) {
            out.append("    ").append(dotId(node.id()));
            if (!node.displayName().equals(node.id())) {
                out.append(" [label=").append(dotId(node.displayName())).append(']');
            }
            out.append(";\n");
        }
        if (usesTerminal(graph)) {
            out.append("    ").append(dotId(GraphInfo.TERMINAL)).append(" [shape=doublecircle, label=\"end\"];\n");
        }
        out.append("    ").append(dotId(START)).append(" -> ").append(dotId(graph.entryPoint())).append(";\n");
        for (var edge : graph.edges()) {
            out.append("    ").append(dotId(edge.from())).append(" -> ").append(dotId(edge.to())).append(";\n");
        }
        for (var edge : graph.conditionalEdges()) {
            edge.mapping().forEach((label, target) -> out.append("    ").append(dotId(edge.from())).append(" -> ")
                .append(dotId(target)).append(" [label=").append(dotId(label)).append(", style=dashed];\n"));
        }
        return out.append("}\n").toString();
    }

    private static boolean usesTerminal(GraphInfo graph) {
        return graph.edges().stream().anyMatch(EdgeSpec::isTerminal)
            || graph.conditionalEdges().stream().anyMatch(edge -> edge.mapping().values().stream().anyMatch(GraphInfo::isTerminal));
    }

    private static String mermaidNode(SymbolTable symbols, String id) {
        return GraphInfo.isTerminal(id) ? GraphInfo.TERMINAL : symbols.node(id);
    }

    private static String mermaidText(String text) {
        return text.replace("\"", "#quot;").replaceAll("\\s+", " ");
    }

    private static String dotId(String text) {
        var escaped = text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "");
        return "\"" + escaped + "\"";
    }
}
