package work.lcod.graphgen.types;

import java.util.List;
import java.util.Objects;

/**
 * Result of a mapping: the static type plus one reason per place where precision was given up.
 */
public record MappedType(StaticType type, List<String> fallbackReasons) {
    public MappedType {
        Objects.requireNonNull(type, "type");
        fallbackReasons = fallbackReasons == null ? List.of() : List.copyOf(fallbackReasons);
    }

    public boolean degraded() {
        return !fallbackReasons.isEmpty();
    }
}
