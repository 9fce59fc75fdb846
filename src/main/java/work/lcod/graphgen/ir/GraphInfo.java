package work.lcod.graphgen.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Root of the intermediate representation: nodes, edges, conditional routers, state schema and entry point.
 * Immutable once built; endpoint membership is checked when the graph is resolved.
 */
public record GraphInfo(
    Optional<String> name,
    List<NodeSpec> nodes,
    List<EdgeSpec> edges,
    List<ConditionalEdgeSpec> conditionalEdges,
    StateSchema stateSchema,
    String entryPoint
) {
    public static final String TERMINAL = "__end__";
    private static final String TERMINAL_ALIAS = "END";

    public GraphInfo {
        name = name == null ? Optional.empty() : name.filter(value -> !value.isBlank());
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        conditionalEdges = conditionalEdges == null ? List.of() : List.copyOf(conditionalEdges);
        stateSchema = stateSchema == null ? StateSchema.empty() : stateSchema;
        Objects.requireNonNull(entryPoint, "entryPoint");
        var ids = new HashSet<String>();
        for (var node : nodes) {
            if (isTerminal(node.id())) {
                throw new IllegalArgumentException("Node id '" + node.id() + "' is reserved for the terminal marker");
            }
            if (!ids.add(node.id())) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
    }

    public static boolean isTerminal(String target) {
        return TERMINAL.equals(target) || TERMINAL_ALIAS.equals(target);
    }

    static String normalizeTarget(String target) {
        return isTerminal(target) ? TERMINAL : target;
    }

    public Optional<NodeSpec> node(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    /**
     * Nodes indexed by id in declaration order.
     */
    public Map<String, NodeSpec> nodesById() {
        var byId = new LinkedHashMap<String, NodeSpec>();
        for (var node : nodes) {
            byId.put(node.id(), node);
        }
        return byId;
    }

    public String displayName() {
        return name.orElse("workflow");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private final List<NodeSpec> nodes = new ArrayList<>();
        private final Set<EdgeSpec> edges = new LinkedHashSet<>();
        private final List<ConditionalEdgeSpec> conditionalEdges = new ArrayList<>();
        private final List<FieldSpec> fields = new ArrayList<>();
        private String entryPoint;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder node(NodeSpec node) {
            nodes.add(node);
            return this;
        }

        public Builder node(String id) {
            return node(NodeSpec.of(id));
        }

        public Builder node(String id, String doc) {
            return node(NodeSpec.of(id, doc));
        }

        public Builder edge(String from, String to) {
            edges.add(new EdgeSpec(from, to));
            return this;
        }

        public Builder conditional(String from, String routerName, Map<String, String> mapping) {
            conditionalEdges.add(new ConditionalEdgeSpec(from, routerName, mapping));
            return this;
        }

        public Builder field(FieldSpec field) {
            fields.add(field);
            return this;
        }

        public Builder field(String name, DynamicTypeDescriptor type) {
            return field(FieldSpec.of(name, type));
        }

        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public GraphInfo build() {
            return new GraphInfo(
                Optional.ofNullable(name),
                nodes,
                List.copyOf(edges),
                conditionalEdges,
                new StateSchema(fields),
                entryPoint
            );
        }
    }
}
