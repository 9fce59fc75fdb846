package work.lcod.graphgen.ir;

import java.util.Objects;
import java.util.Optional;

/**
 * A named unit of work in the workflow graph. Identity is the id.
 */
public record NodeSpec(String id, String displayName, Optional<String> doc, Optional<String> sourceLocation) {
    public NodeSpec {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
        doc = doc == null ? Optional.empty() : doc.filter(value -> !value.isBlank());
        sourceLocation = sourceLocation == null ? Optional.empty() : sourceLocation.filter(value -> !value.isBlank());
    }

    public static NodeSpec of(String id) {
        return new NodeSpec(id, id, Optional.empty(), Optional.empty());
    }

    public static NodeSpec of(String id, String doc) {
        return new NodeSpec(id, id, Optional.ofNullable(doc), Optional.empty());
    }
}
