package work.lcod.graphgen.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Router-driven transition: the router's label selects one branch of {@code mapping}.
 */
public record ConditionalEdgeSpec(String from, String routerName, Map<String, String> mapping) {
    public ConditionalEdgeSpec {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(routerName, "routerName");
        Objects.requireNonNull(mapping, "mapping");
        if (routerName.isBlank()) {
            throw new IllegalArgumentException("Conditional edge from '" + from + "' has a blank router name");
        }
        if (mapping.isEmpty()) {
            throw new IllegalArgumentException("Conditional edge from '" + from + "' declares no branches");
        }
        var copy = new LinkedHashMap<String, String>();
        for (var entry : mapping.entrySet()) {
            var label = Objects.requireNonNull(entry.getKey(), "branch label");
            var target = Objects.requireNonNull(entry.getValue(), "branch target for label " + label);
            copy.put(label, GraphInfo.normalizeTarget(target));
        }
        mapping = Collections.unmodifiableMap(copy);
    }

    public String display() {
        return from + " -[" + routerName + "]-> " + mapping;
    }
}
