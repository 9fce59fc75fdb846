package work.lcod.graphgen.topology;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.graphgen.diagnostics.Diagnostic;
import work.lcod.graphgen.ir.ConditionalEdgeSpec;
import work.lcod.graphgen.ir.EdgeSpec;
import work.lcod.graphgen.ir.GraphInfo;

/**
 * Turns a graph's edge set into a dispatch plan: validates endpoints, picks one outgoing transition per node,
 * walks the graph from the entry point and flags the transitions that close loops.
 */
public final class TopologyResolver {
    public static final int DEFAULT_MAX_GRAPH_SIZE = 10_000;
    private static final Logger LOG = LoggerFactory.getLogger(TopologyResolver.class);

    private final int maxGraphSize;

    public TopologyResolver() {
        this(DEFAULT_MAX_GRAPH_SIZE);
    }

    public TopologyResolver(int maxGraphSize) {
        if (maxGraphSize <= 0) {
            throw new IllegalArgumentException("maxGraphSize must be positive: " + maxGraphSize);
        }
        this.maxGraphSize = maxGraphSize;
    }

    public ResolvedGraph resolve(GraphInfo graph) throws GraphException {
        checkSize(graph);
        var ids = graph.nodesById().keySet();
        checkEndpoints(graph, ids);
        var entry = graph.entryPoint();
        if (!ids.contains(entry)) {
            throw GraphException.unreachableEntry(entry, "is not a declared node");
        }

        var warnings = new ArrayList<Diagnostic>();
        var chosen = chooseTransitions(graph, warnings);
        if (!chosen.containsKey(entry)) {
            throw GraphException.unreachableEntry(entry, "has no outgoing edge");
        }

        var reachable = breadthFirst(entry, chosen);
        var loopBacks = findLoopBacks(entry, chosen);

        var unreachable = new ArrayList<String>();
        for (var node : graph.nodes()) {
            if (!reachable.contains(node.id())) {
                unreachable.add(node.id());
                warnings.add(Diagnostic.unreachableNode(node.id()));
            }
        }

        var table = new ArrayList<DispatchEntry>();
        for (var nodeId : reachable) {
            table.add(chosen.getOrDefault(nodeId, Outgoing.implicitTerminal(nodeId)).toEntry());
        }
        LOG.debug("Resolved '{}': {} reachable, {} unreachable, {} loop-back transitions",
            graph.displayName(), reachable.size(), unreachable.size(), loopBacks.size());
        return new ResolvedGraph(entry, List.copyOf(reachable), table, loopBacks, unreachable, warnings);
    }

    private void checkSize(GraphInfo graph) throws GraphException {
        int size = graph.nodes().size() + graph.edges().size();
        for (var conditional : graph.conditionalEdges()) {
            size += conditional.mapping().size();
        }
        if (size > maxGraphSize) {
            throw new GraphException(GraphErrorKind.LIMIT_EXCEEDED, graph.displayName(),
                "Graph '" + graph.displayName() + "' has " + size + " nodes and edges; the limit is " + maxGraphSize);
        }
    }

    private static void checkEndpoints(GraphInfo graph, Set<String> ids) throws GraphException {
        for (var edge : graph.edges()) {
            if (!ids.contains(edge.from())) {
                throw GraphException.danglingEdge(edge.display(), edge.from());
            }
            if (!edge.isTerminal() && !ids.contains(edge.to())) {
                throw GraphException.danglingEdge(edge.display(), edge.to());
            }
        }
        for (var conditional : graph.conditionalEdges()) {
            if (!ids.contains(conditional.from())) {
                throw GraphException.danglingEdge(conditional.display(), conditional.from());
            }
            for (var target : conditional.mapping().values()) {
                if (!GraphInfo.isTerminal(target) && !ids.contains(target)) {
                    throw GraphException.danglingEdge(conditional.display(), target);
                }
            }
        }
    }

    /**
     * One outgoing transition per node. A conditional edge beats unconditional ones; among edges of the same kind
     * the first declared wins. Losers are reported as dead edges.
     */
    private static Map<String, Outgoing> chooseTransitions(GraphInfo graph, List<Diagnostic> warnings) {
        var unconditional = new LinkedHashMap<String, List<EdgeSpec>>();
        for (var edge : new LinkedHashSet<>(graph.edges())) {
            unconditional.computeIfAbsent(edge.from(), key -> new ArrayList<>()).add(edge);
        }
        var conditional = new LinkedHashMap<String, List<ConditionalEdgeSpec>>();
        for (var edge : graph.conditionalEdges()) {
            conditional.computeIfAbsent(edge.from(), key -> new ArrayList<>()).add(edge);
        }

        var chosen = new LinkedHashMap<String, Outgoing>();
        for (var node : graph.nodes()) {
            var id = node.id();
            var routed = conditional.getOrDefault(id, List.of());
            var direct = unconditional.getOrDefault(id, List.of());
            if (!routed.isEmpty()) {
                var winner = routed.get(0);
                chosen.put(id, Outgoing.routed(winner));
                for (var edge : direct) {
                    warnings.add(Diagnostic.deadEdge(edge.display(),
                        "unconditional edge " + edge.display() + " is shadowed by router '" + winner.routerName() + "'"));
                }
                for (var extra : routed.subList(1, routed.size())) {
                    warnings.add(Diagnostic.deadEdge(extra.display(),
                        "node '" + id + "' already routes through '" + winner.routerName()
                            + "'; router '" + extra.routerName() + "' is ignored"));
                }
            } else if (!direct.isEmpty()) {
                var winner = direct.get(0);
                chosen.put(id, Outgoing.direct(winner));
                for (var extra : direct.subList(1, direct.size())) {
                    warnings.add(Diagnostic.deadEdge(extra.display(),
                        "node '" + id + "' already continues to '" + winner.to() + "'; edge "
                            + extra.display() + " is ignored"));
                }
            }
        }
        return chosen;
    }

    private static LinkedHashSet<String> breadthFirst(String entry, Map<String, Outgoing> chosen) {
        var visited = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        visited.add(entry);
        queue.add(entry);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            var outgoing = chosen.get(current);
            if (outgoing == null) {
                continue;
            }
            for (var transition : outgoing.transitions()) {
                if (!GraphInfo.isTerminal(transition.to()) && visited.add(transition.to())) {
                    queue.add(transition.to());
                }
            }
        }
        return visited;
    }

    /**
     * Depth-first walk with in-progress marking; a transition into a node still on the stack closes a loop.
     */
    private static List<Transition> findLoopBacks(String entry, Map<String, Outgoing> chosen) {
        var state = new HashMap<String, Mark>();
        var loopBacks = new ArrayList<Transition>();
        var stack = new ArrayDeque<Frame>();
        state.put(entry, Mark.IN_PROGRESS);
        stack.push(new Frame(entry, transitionsOf(entry, chosen)));
        while (!stack.isEmpty()) {
            var frame = stack.peek();
            if (frame.next >= frame.transitions.size()) {
                state.put(frame.nodeId, Mark.DONE);
                stack.pop();
                continue;
            }
            var transition = frame.transitions.get(frame.next++);
            var target = transition.to();
            if (GraphInfo.isTerminal(target)) {
                continue;
            }
            var mark = state.get(target);
            if (mark == Mark.IN_PROGRESS) {
                loopBacks.add(transition);
            } else if (mark == null) {
                state.put(target, Mark.IN_PROGRESS);
                stack.push(new Frame(target, transitionsOf(target, chosen)));
            }
        }
        return loopBacks;
    }

    private static List<Transition> transitionsOf(String nodeId, Map<String, Outgoing> chosen) {
        var outgoing = chosen.get(nodeId);
        return outgoing == null ? List.of() : outgoing.transitions();
    }

    private enum Mark {
        IN_PROGRESS,
        DONE
    }

    private static final class Frame {
        private final String nodeId;
        private final List<Transition> transitions;
        private int next;

        private Frame(String nodeId, List<Transition> transitions) {
            this.nodeId = nodeId;
            this.transitions = transitions;
        }
    }

    private record Outgoing(String nodeId, Optional<String> next, Optional<ConditionalEdgeSpec> router) {
        static Outgoing direct(EdgeSpec edge) {
            return new Outgoing(edge.from(), Optional.of(edge.to()), Optional.empty());
        }

        static Outgoing routed(ConditionalEdgeSpec edge) {
            return new Outgoing(edge.from(), Optional.empty(), Optional.of(edge));
        }

        static Outgoing implicitTerminal(String nodeId) {
            return new Outgoing(nodeId, Optional.of(GraphInfo.TERMINAL), Optional.empty());
        }

        List<Transition> transitions() {
            if (router.isPresent()) {
                var transitions = new ArrayList<Transition>();
                router.get().mapping().forEach((label, target) -> transitions.add(Transition.branch(nodeId, label, target)));
                return transitions;
            }
            return List.of(Transition.unconditional(nodeId, next.orElse(GraphInfo.TERMINAL)));
        }

        DispatchEntry toEntry() {
            if (router.isPresent()) {
                var edge = router.get();
                return DispatchEntry.routed(nodeId, new ConditionalDispatch(edge.routerName(), edge.mapping()));
            }
            return DispatchEntry.next(nodeId, next.orElse(GraphInfo.TERMINAL));
        }
    }
}
