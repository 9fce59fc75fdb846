package work.lcod.graphgen.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.graphgen.ir.DynamicTypeDescriptor;
import work.lcod.graphgen.ir.FieldSpec;

/**
 * Converts observed dynamic types into {@link StaticType}s. Total: shapes it cannot represent degrade to
 * {@link StaticType#dynamic()} with a recorded reason, never to an exception. Instances are immutable.
 */
public final class TypeMapper {
    private final Map<String, DynamicTypeDescriptor> aliases;

    public TypeMapper(Map<String, DynamicTypeDescriptor> aliases) {
        this.aliases = aliases == null || aliases.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public static TypeMapper standard() {
        return new TypeMapper(Map.of());
    }

    public Map<String, DynamicTypeDescriptor> aliases() {
        return aliases;
    }

    public MappedType map(DynamicTypeDescriptor descriptor) {
        var reasons = new ArrayList<String>();
        var type = map(descriptor, reasons, new HashSet<>());
        return new MappedType(type, reasons);
    }

    /**
     * Maps a state field; optional fields become nullable even when the observed type was not.
     */
    public MappedType mapField(FieldSpec field) {
        var mapped = map(field.dynamicType());
        if (!field.optional()) {
            return mapped;
        }
        return new MappedType(StaticType.nullable(mapped.type()), mapped.fallbackReasons());
    }

    private StaticType map(DynamicTypeDescriptor descriptor, List<String> reasons, Set<String> expanding) {
        if (descriptor == null) {
            reasons.add("missing type descriptor");
            return StaticType.dynamic();
        }
        if (descriptor instanceof DynamicTypeDescriptor.Primitive primitive) {
            return mapPrimitive(primitive.primitiveKind());
        }
        if (descriptor instanceof DynamicTypeDescriptor.Collection collection) {
            return StaticType.sequence(map(collection.element(), reasons, expanding));
        }
        if (descriptor instanceof DynamicTypeDescriptor.Mapping mapping) {
            return mapMapping(mapping, reasons, expanding);
        }
        if (descriptor instanceof DynamicTypeDescriptor.OptionalOf optional) {
            return StaticType.nullable(map(optional.inner(), reasons, expanding));
        }
        if (descriptor instanceof DynamicTypeDescriptor.Opaque opaque) {
            return mapOpaque(opaque, reasons, expanding);
        }
        reasons.add("unrecognised descriptor " + descriptor.getClass().getSimpleName());
        return StaticType.dynamic();
    }

    private static StaticType mapPrimitive(DynamicTypeDescriptor.PrimitiveKind kind) {
        return switch (kind) {
            case STRING -> StaticType.text();
            case INTEGER -> StaticType.int64();
            case FLOAT -> StaticType.float64();
            case BOOL -> StaticType.bool();
        };
    }

    private StaticType mapMapping(DynamicTypeDescriptor.Mapping mapping, List<String> reasons, Set<String> expanding) {
        var keyReasons = new ArrayList<String>();
        var key = map(mapping.key(), keyReasons, expanding);
        if (!key.isKeyable()) {
            reasons.add("mapping key " + mapping.key().describe() + " maps to " + key
                + ", which cannot key an ordered dictionary; " + mapping.describe() + " uses the dynamic fallback");
            return StaticType.dynamic();
        }
        reasons.addAll(keyReasons);
        var value = map(mapping.value(), reasons, expanding);
        return StaticType.orderedDictionary(key, value);
    }

    private StaticType mapOpaque(DynamicTypeDescriptor.Opaque opaque, List<String> reasons, Set<String> expanding) {
        var hint = opaque.hint().orElse(null);
        if (hint != null && aliases.containsKey(hint)) {
            if (!expanding.add(hint)) {
                reasons.add("type alias cycle through " + hint);
                return StaticType.dynamic();
            }
            try {
                return map(aliases.get(hint), reasons, expanding);
            } finally {
                expanding.remove(hint);
            }
        }
        reasons.add(hint == null
            ? "opaque value uses the dynamic fallback"
            : "type '" + hint + "' is not statically representable; uses the dynamic fallback");
        return StaticType.dynamic();
    }
}
