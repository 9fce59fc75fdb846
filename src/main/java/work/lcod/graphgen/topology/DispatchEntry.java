package work.lcod.graphgen.topology;

import java.util.Optional;

/**
 * How execution leaves a node: either a fixed successor or a router-selected branch. Exactly one is present.
 */
public record DispatchEntry(String nodeId, Optional<String> unconditionalNext, Optional<ConditionalDispatch> conditional) {
    public DispatchEntry {
        unconditionalNext = unconditionalNext == null ? Optional.empty() : unconditionalNext;
        conditional = conditional == null ? Optional.empty() : conditional;
        if (unconditionalNext.isPresent() == conditional.isPresent()) {
            throw new IllegalArgumentException("Dispatch entry for '" + nodeId + "' needs exactly one outgoing transition");
        }
    }

    public static DispatchEntry next(String nodeId, String target) {
        return new DispatchEntry(nodeId, Optional.of(target), Optional.empty());
    }

    public static DispatchEntry routed(String nodeId, ConditionalDispatch conditional) {
        return new DispatchEntry(nodeId, Optional.empty(), Optional.of(conditional));
    }

    public boolean isConditional() {
        return conditional.isPresent();
    }
}
