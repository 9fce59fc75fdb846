package work.lcod.graphgen.topology;

import java.util.Objects;

/**
 * Raised when a graph cannot be resolved into a dispatch plan. Carries the offending node or edge.
 */
public final class GraphException extends Exception {
    private final GraphErrorKind kind;
    private final String subject;

    public GraphException(GraphErrorKind kind, String subject, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.subject = Objects.requireNonNull(subject, "subject");
    }

    public static GraphException unreachableEntry(String entryPoint, String reason) {
        return new GraphException(GraphErrorKind.UNREACHABLE_ENTRY, entryPoint,
            "Entry point '" + entryPoint + "' " + reason);
    }

    public static GraphException danglingEdge(String edge, String missingId) {
        return new GraphException(GraphErrorKind.DANGLING_EDGE, edge,
            "Edge " + edge + " references undeclared node '" + missingId + "'");
    }

    public GraphErrorKind kind() {
        return kind;
    }

    public String subject() {
        return subject;
    }
}
