package work.lcod.graphgen.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A warning attached to the generated artifact. {@code subject} is the field, node or edge it concerns.
 */
public record Diagnostic(DiagnosticKind kind, String subject, String message) {
    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic opaqueFallback(String field, String message) {
        return new Diagnostic(DiagnosticKind.OPAQUE_FALLBACK, field, message);
    }

    public static Diagnostic unreachableNode(String nodeId) {
        return new Diagnostic(DiagnosticKind.UNREACHABLE_NODE, nodeId,
            "node '" + nodeId + "' is not reachable from the entry point; emitted as a stub only");
    }

    public static Diagnostic deadEdge(String edge, String reason) {
        return new Diagnostic(DiagnosticKind.DEAD_EDGE, edge, reason);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", kind.name().toLowerCase());
        map.put("subject", subject);
        map.put("message", message);
        return map;
    }

    @Override
    public String toString() {
        return kind + "[" + subject + "]: " + message;
    }
}
