package work.lcod.graphgen.ir.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.lcod.graphgen.ir.DynamicTypeDescriptor;

/**
 * Reads Python-style type annotations ({@code list[dict[str, int]]}, {@code Optional[str]}, {@code str | None},
 * {@code Literal['a', 'b']}) into descriptors. Anything unrecognised becomes {@link DynamicTypeDescriptor#opaque(String)}
 * carrying the annotation as its hint, so aliases can still resolve it later.
 */
public final class TypeAnnotationParser {
    private static final Set<String> SEQUENCES = Set.of(
        "list", "List", "Sequence", "MutableSequence", "Iterable", "set", "Set", "frozenset", "FrozenSet", "tuple", "Tuple"
    );
    private static final Set<String> MAPPINGS = Set.of("dict", "Dict", "Mapping", "MutableMapping", "OrderedDict");
    private static final Set<String> NONE = Set.of("None", "NoneType");
    private static final Set<String> ANY = Set.of("Any", "object");
    private static final String[] MODULE_PREFIXES = {"typing.", "typing_extensions.", "collections.abc.", "builtins."};

    private TypeAnnotationParser() {}

    public static DynamicTypeDescriptor parse(String annotation) {
        if (annotation == null || annotation.isBlank()) {
            return DynamicTypeDescriptor.opaque();
        }
        var text = stripModule(annotation.trim());
        var union = splitTopLevel(text, '|');
        if (union == null) {
            return DynamicTypeDescriptor.opaque(text);
        }
        if (union.size() > 1) {
            return union(text, union);
        }
        int open = text.indexOf('[');
        if (open < 0) {
            return simple(text);
        }
        if (!text.endsWith("]") || open == 0) {
            return DynamicTypeDescriptor.opaque(text);
        }
        var head = stripModule(text.substring(0, open).trim());
        var args = splitTopLevel(text.substring(open + 1, text.length() - 1), ',');
        if (args == null) {
            return DynamicTypeDescriptor.opaque(text);
        }
        if (SEQUENCES.contains(head)) {
            return sequence(head, args);
        }
        if (MAPPINGS.contains(head)) {
            return args.size() == 2
                ? DynamicTypeDescriptor.mapping(parse(args.get(0)), parse(args.get(1)))
                : DynamicTypeDescriptor.mapping(DynamicTypeDescriptor.string(), DynamicTypeDescriptor.opaque());
        }
        return switch (head) {
            case "Optional" -> args.size() == 1 ? DynamicTypeDescriptor.optional(parse(args.get(0))) : DynamicTypeDescriptor.opaque(text);
            case "Union" -> union(text, args);
            case "Annotated", "Required", "NotRequired", "ReadOnly", "Final" -> parse(args.get(0));
            case "Literal" -> literal(text, args);
            default -> DynamicTypeDescriptor.opaque(text);
        };
    }

    private static DynamicTypeDescriptor simple(String text) {
        if (ANY.contains(text)) {
            return DynamicTypeDescriptor.opaque();
        }
        if (SEQUENCES.contains(text)) {
            return DynamicTypeDescriptor.collection(DynamicTypeDescriptor.opaque());
        }
        if (MAPPINGS.contains(text)) {
            return DynamicTypeDescriptor.mapping(DynamicTypeDescriptor.string(), DynamicTypeDescriptor.opaque());
        }
        return switch (text) {
            case "str", "string" -> DynamicTypeDescriptor.string();
            case "int" -> DynamicTypeDescriptor.integer();
            case "float" -> DynamicTypeDescriptor.floating();
            case "bool" -> DynamicTypeDescriptor.bool();
            default -> DynamicTypeDescriptor.opaque(text);
        };
    }

    private static DynamicTypeDescriptor sequence(String head, List<String> args) {
        // tuple[int, ...] is homogeneous; fixed-arity tuples only when every element agrees
        if ((head.equals("tuple") || head.equals("Tuple")) && args.size() > 1) {
            var elements = args.stream().filter(arg -> !arg.equals("...")).map(TypeAnnotationParser::parse).distinct().toList();
            return DynamicTypeDescriptor.collection(elements.size() == 1 ? elements.get(0) : DynamicTypeDescriptor.opaque());
        }
        return DynamicTypeDescriptor.collection(args.size() == 1 ? parse(args.get(0)) : DynamicTypeDescriptor.opaque());
    }

    private static DynamicTypeDescriptor union(String text, List<String> members) {
        var present = new ArrayList<String>();
        boolean nullable = false;
        for (var member : members) {
            if (NONE.contains(stripModule(member))) {
                nullable = true;
            } else {
                present.add(member);
            }
        }
        if (present.isEmpty()) {
            return DynamicTypeDescriptor.opaque("None");
        }
        var inner = present.size() == 1 ? parse(present.get(0)) : DynamicTypeDescriptor.opaque(text);
        return nullable ? DynamicTypeDescriptor.optional(inner) : inner;
    }

    private static DynamicTypeDescriptor literal(String text, List<String> values) {
        if (values.stream().allMatch(TypeAnnotationParser::isQuoted)) {
            return DynamicTypeDescriptor.string();
        }
        if (values.stream().allMatch(value -> value.equals("True") || value.equals("False"))) {
            return DynamicTypeDescriptor.bool();
        }
        if (values.stream().allMatch(value -> value.matches("-?\\d+"))) {
            return DynamicTypeDescriptor.integer();
        }
        return DynamicTypeDescriptor.opaque(text);
    }

    private static boolean isQuoted(String value) {
        return value.length() >= 2
            && (value.startsWith("'") && value.endsWith("'") || value.startsWith("\"") && value.endsWith("\""));
    }

    private static String stripModule(String text) {
        for (var prefix : MODULE_PREFIXES) {
            if (text.startsWith(prefix)) {
                return text.substring(prefix.length());
            }
        }
        return text;
    }

    /**
     * Splits on {@code separator} outside brackets and quotes; returns null when brackets do not balance.
     */
    static List<String> splitTopLevel(String text, char separator) {
        var parts = new ArrayList<String>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '\'', '"' -> quote = c;
                case '[' -> depth++;
                case ']' -> {
                    if (--depth < 0) {
                        return null;
                    }
                }
                default -> {
                    if (c == separator && depth == 0) {
                        parts.add(text.substring(start, i).trim());
                        start = i + 1;
                    }
                }
            }
        }
        if (depth != 0 || quote != 0) {
            return null;
        }
        parts.add(text.substring(start).trim());
        return parts;
    }
}
