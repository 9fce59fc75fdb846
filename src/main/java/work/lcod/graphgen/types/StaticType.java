package work.lcod.graphgen.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Canonical, target-neutral static type. Targets render it into their own syntax.
 */
public record StaticType(Kind kind, List<StaticType> arguments) {
    private static final StaticType TEXT = new StaticType(Kind.TEXT, List.of());
    private static final StaticType INT64 = new StaticType(Kind.INT64, List.of());
    private static final StaticType FLOAT64 = new StaticType(Kind.FLOAT64, List.of());
    private static final StaticType BOOLEAN = new StaticType(Kind.BOOLEAN, List.of());
    private static final StaticType DYNAMIC = new StaticType(Kind.DYNAMIC, List.of());

    public StaticType {
        Objects.requireNonNull(kind, "kind");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        if (arguments.size() != kind.arity()) {
            throw new IllegalArgumentException(kind + " expects " + kind.arity() + " type arguments, got " + arguments.size());
        }
    }

    public enum Kind {
        TEXT("text", 0),
        INT64("int64", 0),
        FLOAT64("float64", 0),
        BOOLEAN("boolean", 0),
        SEQUENCE("sequence", 1),
        ORDERED_DICTIONARY("ordered-dictionary", 2),
        NULLABLE("nullable", 1),
        DYNAMIC("dynamic", 0);

        private final String label;
        private final int arity;

        Kind(String label, int arity) {
            this.label = label;
            this.arity = arity;
        }

        public String label() {
            return label;
        }

        public int arity() {
            return arity;
        }
    }

    public static StaticType text() {
        return TEXT;
    }

    public static StaticType int64() {
        return INT64;
    }

    public static StaticType float64() {
        return FLOAT64;
    }

    public static StaticType bool() {
        return BOOLEAN;
    }

    public static StaticType dynamic() {
        return DYNAMIC;
    }

    public static StaticType sequence(StaticType element) {
        return new StaticType(Kind.SEQUENCE, List.of(element));
    }

    public static StaticType orderedDictionary(StaticType key, StaticType value) {
        return new StaticType(Kind.ORDERED_DICTIONARY, List.of(key, value));
    }

    /**
     * Wraps in {@link Kind#NULLABLE} unless already nullable.
     */
    public static StaticType nullable(StaticType inner) {
        if (inner.kind() == Kind.NULLABLE) {
            return inner;
        }
        return new StaticType(Kind.NULLABLE, List.of(inner));
    }

    /**
     * Whether the type can key an ordered dictionary in every target (hashable and totally ordered).
     */
    public boolean isKeyable() {
        return kind == Kind.TEXT || kind == Kind.INT64 || kind == Kind.BOOLEAN;
    }

    public StaticType argument(int index) {
        return arguments.get(index);
    }

    public boolean containsDynamic() {
        return kind == Kind.DYNAMIC || arguments.stream().anyMatch(StaticType::containsDynamic);
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return kind.label();
        }
        return kind.label() + arguments.stream().map(StaticType::toString).collect(Collectors.joining(", ", "<", ">"));
    }
}
