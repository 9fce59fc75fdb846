package work.lcod.graphgen.topology;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.graphgen.diagnostics.Diagnostic;

/**
 * Dispatch plan derived from a graph: reachable nodes in discovery order, one entry per reachable node, the
 * transitions that close a loop, and the non-fatal findings.
 */
public record ResolvedGraph(
    String entryPoint,
    List<String> reachableOrder,
    List<DispatchEntry> dispatchTable,
    List<Transition> loopBackEdges,
    List<String> unreachableNodes,
    List<Diagnostic> warnings
) {
    public ResolvedGraph {
        reachableOrder = List.copyOf(reachableOrder);
        dispatchTable = List.copyOf(dispatchTable);
        loopBackEdges = List.copyOf(loopBackEdges);
        unreachableNodes = List.copyOf(unreachableNodes);
        warnings = List.copyOf(warnings);
    }

    public Optional<DispatchEntry> entry(String nodeId) {
        return dispatchTable.stream().filter(entry -> entry.nodeId().equals(nodeId)).findFirst();
    }

    public boolean hasLoops() {
        return !loopBackEdges.isEmpty();
    }

    /**
     * Unconditional successors keyed by node, terminal included; conditional nodes are omitted.
     */
    public Map<String, String> unconditionalTargets() {
        var targets = new LinkedHashMap<String, String>();
        for (var entry : dispatchTable) {
            entry.unconditionalNext().ifPresent(next -> targets.put(entry.nodeId(), next));
        }
        return targets;
    }
}
