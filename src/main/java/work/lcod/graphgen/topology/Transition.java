package work.lcod.graphgen.topology;

import java.util.Optional;

/**
 * One traversable step of the dispatch plan. {@code label} is set for conditional branches.
 */
public record Transition(String from, Optional<String> label, String to) {
    public Transition {
        label = label == null ? Optional.empty() : label;
    }

    public static Transition unconditional(String from, String to) {
        return new Transition(from, Optional.empty(), to);
    }

    public static Transition branch(String from, String label, String to) {
        return new Transition(from, Optional.of(label), to);
    }

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    @Override
    public String toString() {
        return label.map(value -> from + " -[" + value + "]-> " + to).orElse(from + " -> " + to);
    }
}
