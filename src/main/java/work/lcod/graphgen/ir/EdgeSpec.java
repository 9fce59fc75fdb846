package work.lcod.graphgen.ir;

import java.util.Objects;

/**
 * Unconditional transition; {@code to} may be {@link GraphInfo#TERMINAL}.
 */
public record EdgeSpec(String from, String to) {
    public EdgeSpec {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        to = GraphInfo.normalizeTarget(to);
    }

    public boolean isTerminal() {
        return GraphInfo.TERMINAL.equals(to);
    }

    public String display() {
        return from + " -> " + to;
    }
}
