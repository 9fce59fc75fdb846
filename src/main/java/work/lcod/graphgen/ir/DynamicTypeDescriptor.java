package work.lcod.graphgen.ir;

import java.util.Objects;
import java.util.Optional;

/**
 * Runtime-observed type of a state field. Instances are one of the nested records; {@link Opaque} stands for any
 * shape that could not be characterised.
 */
public interface DynamicTypeDescriptor {

    Kind kind();

    /**
     * Human-readable form close to the source annotation, e.g. {@code list[dict[str, int]]}.
     */
    String describe();

    enum Kind {
        PRIMITIVE,
        COLLECTION,
        MAPPING,
        OPTIONAL,
        OPAQUE
    }

    enum PrimitiveKind {
        STRING("str"),
        INTEGER("int"),
        FLOAT("float"),
        BOOL("bool");

        private final String annotation;

        PrimitiveKind(String annotation) {
            this.annotation = annotation;
        }

        public String annotation() {
            return annotation;
        }
    }

    static DynamicTypeDescriptor primitive(PrimitiveKind kind) {
        return new Primitive(kind);
    }

    static DynamicTypeDescriptor string() {
        return new Primitive(PrimitiveKind.STRING);
    }

    static DynamicTypeDescriptor integer() {
        return new Primitive(PrimitiveKind.INTEGER);
    }

    static DynamicTypeDescriptor floating() {
        return new Primitive(PrimitiveKind.FLOAT);
    }

    static DynamicTypeDescriptor bool() {
        return new Primitive(PrimitiveKind.BOOL);
    }

    static DynamicTypeDescriptor collection(DynamicTypeDescriptor element) {
        return new Collection(element);
    }

    static DynamicTypeDescriptor mapping(DynamicTypeDescriptor key, DynamicTypeDescriptor value) {
        return new Mapping(key, value);
    }

    static DynamicTypeDescriptor optional(DynamicTypeDescriptor inner) {
        return new OptionalOf(inner);
    }

    static DynamicTypeDescriptor opaque() {
        return new Opaque(Optional.empty());
    }

    static DynamicTypeDescriptor opaque(String hint) {
        return new Opaque(Optional.ofNullable(hint).filter(value -> !value.isBlank()));
    }

    record Primitive(PrimitiveKind primitiveKind) implements DynamicTypeDescriptor {
        public Primitive {
            Objects.requireNonNull(primitiveKind, "primitiveKind");
        }

        @Override
        public Kind kind() {
            return Kind.PRIMITIVE;
        }

        @Override
        public String describe() {
            return primitiveKind.annotation();
        }
    }

    record Collection(DynamicTypeDescriptor element) implements DynamicTypeDescriptor {
        public Collection {
            element = element == null ? opaque() : element;
        }

        @Override
        public Kind kind() {
            return Kind.COLLECTION;
        }

        @Override
        public String describe() {
            return "list[" + element.describe() + "]";
        }
    }

    record Mapping(DynamicTypeDescriptor key, DynamicTypeDescriptor value) implements DynamicTypeDescriptor {
        public Mapping {
            key = key == null ? opaque() : key;
            value = value == null ? opaque() : value;
        }

        @Override
        public Kind kind() {
            return Kind.MAPPING;
        }

        @Override
        public String describe() {
            return "dict[" + key.describe() + ", " + value.describe() + "]";
        }
    }

    record OptionalOf(DynamicTypeDescriptor inner) implements DynamicTypeDescriptor {
        public OptionalOf {
            inner = inner == null ? opaque() : inner;
        }

        @Override
        public Kind kind() {
            return Kind.OPTIONAL;
        }

        @Override
        public String describe() {
            return "Optional[" + inner.describe() + "]";
        }
    }

    record Opaque(Optional<String> hint) implements DynamicTypeDescriptor {
        public Opaque {
            hint = hint == null ? Optional.empty() : hint;
        }

        @Override
        public Kind kind() {
            return Kind.OPAQUE;
        }

        @Override
        public String describe() {
            return hint.orElse("Any");
        }
    }
}
