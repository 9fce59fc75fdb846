package work.lcod.graphgen.diagnostics;

/**
 * Non-fatal conditions found during a conversion.
 */
public enum DiagnosticKind {
    OPAQUE_FALLBACK,
    UNREACHABLE_NODE,
    DEAD_EDGE
}
