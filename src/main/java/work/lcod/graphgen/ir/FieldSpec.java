package work.lcod.graphgen.ir;

import java.util.Objects;
import java.util.Optional;

/**
 * One state field as observed on the dynamic side. {@code defaultValue} holds a JSON scalar literal when the
 * producer saw one.
 */
public record FieldSpec(String name, DynamicTypeDescriptor dynamicType, boolean optional, Optional<Object> defaultValue) {
    public FieldSpec {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        dynamicType = dynamicType == null ? DynamicTypeDescriptor.opaque() : dynamicType;
        defaultValue = defaultValue == null ? Optional.empty() : defaultValue;
    }

    public static FieldSpec of(String name, DynamicTypeDescriptor type) {
        return new FieldSpec(name, type, false, Optional.empty());
    }

    public static FieldSpec optional(String name, DynamicTypeDescriptor type) {
        return new FieldSpec(name, type, true, Optional.empty());
    }

    public FieldSpec withDefault(Object value) {
        return new FieldSpec(name, dynamicType, optional, Optional.ofNullable(value));
    }
}
