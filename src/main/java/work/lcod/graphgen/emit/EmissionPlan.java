package work.lcod.graphgen.emit;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.graphgen.ir.FieldSpec;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.ir.NodeSpec;
import work.lcod.graphgen.naming.SymbolTable;
import work.lcod.graphgen.topology.ConditionalDispatch;
import work.lcod.graphgen.topology.DispatchEntry;
import work.lcod.graphgen.topology.ResolvedGraph;
import work.lcod.graphgen.topology.Transition;
import work.lcod.graphgen.types.StaticType;

/**
 * Target-independent facts an emitter needs: symbols for every field, node and router, field types and the
 * routers in first-use order. Symbols are allocated fields first, then nodes, then routers, always in declaration
 * order, so the same graph always yields the same names.
 */
final class EmissionPlan {
    static final String UNDECLARED_LABEL = "__undeclared__";

    private final GraphInfo graph;
    private final ResolvedGraph resolved;
    private final SymbolTable symbols;
    private final List<StateField> fields;
    private final List<RouterStub> routers;
    private final Map<String, NodeSpec> nodesById;
    private final Set<String> reachable;
    private final Set<Transition> loopBacks;

    private EmissionPlan(GraphInfo graph, ResolvedGraph resolved, SymbolTable symbols, List<StateField> fields, List<RouterStub> routers) {
        this.graph = graph;
        this.resolved = resolved;
        this.symbols = symbols;
        this.fields = fields;
        this.routers = routers;
        this.nodesById = graph.nodesById();
        this.reachable = new HashSet<>(resolved.reachableOrder());
        this.loopBacks = new HashSet<>(resolved.loopBackEdges());
    }

    static EmissionPlan build(
        GraphInfo graph,
        ResolvedGraph resolved,
        Map<String, StaticType> types,
        Collection<String> reservedFields,
        Collection<String> reservedFunctions
    ) {
        var symbols = new SymbolTable(reservedFields, reservedFunctions);
        var fields = new ArrayList<StateField>();
        for (var field : graph.stateSchema().fields()) {
            var type = types.getOrDefault(field.name(), StaticType.dynamic());
            fields.add(new StateField(field, symbols.field(field.name()), type));
        }
        for (var node : graph.nodes()) {
            symbols.node(node.id());
        }
        var labelsByRouter = new LinkedHashMap<String, LinkedHashSet<String>>();
        for (var entry : resolved.dispatchTable()) {
            entry.conditional().ifPresent(conditional -> labelsByRouter
                .computeIfAbsent(conditional.routerName(), key -> new LinkedHashSet<>())
                .addAll(conditional.branches().keySet()));
        }
        var routers = new ArrayList<RouterStub>();
        labelsByRouter.forEach((name, labels) -> routers.add(new RouterStub(name, symbols.router(name), List.copyOf(labels))));
        return new EmissionPlan(graph, resolved, symbols, List.copyOf(fields), List.copyOf(routers));
    }

    GraphInfo graph() {
        return graph;
    }

    ResolvedGraph resolved() {
        return resolved;
    }

    SymbolTable symbols() {
        return symbols;
    }

    List<StateField> fields() {
        return fields;
    }

    List<RouterStub> routers() {
        return routers;
    }

    List<DispatchEntry> conditionalEntries() {
        return resolved.dispatchTable().stream().filter(DispatchEntry::isConditional).toList();
    }

    boolean usesType(StaticType.Kind kind) {
        return fields.stream().anyMatch(field -> uses(field.type(), kind));
    }

    String nodeSymbol(String nodeId) {
        return symbols.requireNode(nodeId);
    }

    String routerSymbol(String routerName) {
        return symbols.requireRouter(routerName);
    }

    NodeSpec node(String nodeId) {
        var node = nodesById.get(nodeId);
        if (node == null) {
            throw new IllegalStateException("Unknown node " + nodeId);
        }
        return node;
    }

    boolean isReachable(String nodeId) {
        return reachable.contains(nodeId);
    }

    boolean isLoopBack(Transition transition) {
        return loopBacks.contains(transition);
    }

    /**
     * One-line traceability text: display name plus the original doc when there is one.
     */
    static String traceComment(NodeSpec node) {
        var text = new StringBuilder("Node \"").append(node.id()).append('"');
        if (!node.displayName().equals(node.id())) {
            text.append(" (").append(node.displayName()).append(')');
        }
        node.doc().ifPresent(doc -> text.append(": ").append(doc));
        node.sourceLocation().ifPresent(location -> text.append(" [").append(location).append(']'));
        return Literals.comment(text.toString());
    }

    static String undeclaredLabel(ConditionalDispatch conditional) {
        var label = UNDECLARED_LABEL;
        while (conditional.branches().containsKey(label)) {
            label = label + "_";
        }
        return label;
    }

    private static boolean uses(StaticType type, StaticType.Kind kind) {
        return type.kind() == kind || type.arguments().stream().anyMatch(argument -> uses(argument, kind));
    }

    /**
     * The producer's default literal, normalised to String, Long, Double or Boolean, when it fits the mapped type.
     */
    static Optional<Object> literalDefault(StateField field) {
        var raw = field.spec().defaultValue().orElse(null);
        if (raw == null) {
            return Optional.empty();
        }
        return switch (field.type().kind()) {
            case TEXT -> raw instanceof String text ? Optional.of(text) : Optional.empty();
            case BOOLEAN -> raw instanceof Boolean flag ? Optional.of(flag) : Optional.empty();
            case INT64 -> integral(raw);
            case FLOAT64 -> raw instanceof Number number && Double.isFinite(number.doubleValue())
                ? Optional.of(number.doubleValue())
                : Optional.empty();
            default -> Optional.empty();
        };
    }

    private static Optional<Object> integral(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return Optional.of(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big && big.bitLength() < 64) {
            return Optional.of(big.longValue());
        }
        if (raw instanceof BigDecimal decimal) {
            try {
                return Optional.of(decimal.longValueExact());
            } catch (ArithmeticException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    record StateField(FieldSpec spec, String symbol, StaticType type) {}

    record RouterStub(String routerName, String symbol, List<String> labels) {}
}
