package work.lcod.graphgen.topology;

/**
 * Fatal topology problems; any of them stops a conversion before emission.
 */
public enum GraphErrorKind {
    UNREACHABLE_ENTRY,
    DANGLING_EDGE,
    LIMIT_EXCEEDED
}
