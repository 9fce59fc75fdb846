package work.lcod.graphgen.ir;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered state fields; names are unique (case-sensitive).
 */
public record StateSchema(List<FieldSpec> fields) {
    public StateSchema {
        fields = fields == null ? List.of() : List.copyOf(fields);
        var seen = new HashSet<String>();
        for (var field : fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException("Duplicate state field: " + field.name());
            }
        }
    }

    public static StateSchema empty() {
        return new StateSchema(List.of());
    }

    public static StateSchema of(FieldSpec... fields) {
        return new StateSchema(List.of(fields));
    }

    public Optional<FieldSpec> field(String name) {
        Objects.requireNonNull(name, "name");
        return fields.stream().filter(field -> field.name().equals(name)).findFirst();
    }
}
