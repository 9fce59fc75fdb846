package work.lcod.graphgen.naming;

import java.util.Set;
import java.util.TreeSet;

/**
 * Reserved words of every supported target. A sanitized identifier must avoid all of them.
 */
public final class ReservedWords {
    private static final Set<String> JAVA = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp", "super",
        "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void", "volatile", "while",
        "true", "false", "null", "var", "yield", "record", "sealed", "permits", "_"
    );

    private static final Set<String> RUST = Set.of(
        "as", "async", "await", "break", "const", "continue", "crate", "dyn", "else", "enum",
        "extern", "false", "fn", "for", "if", "impl", "in", "let", "loop", "match",
        "mod", "move", "mut", "pub", "ref", "return", "self", "Self", "static", "struct",
        "super", "trait", "true", "type", "unsafe", "use", "where", "while", "abstract", "become",
        "box", "do", "final", "macro", "override", "priv", "typeof", "unsized", "virtual", "yield",
        "try", "union", "_"
    );

    private static final Set<String> ALL;

    static {
        var all = new TreeSet<String>();
        all.addAll(JAVA);
        all.addAll(RUST);
        ALL = Set.copyOf(all);
    }

    private ReservedWords() {}

    public static boolean isReserved(String candidate) {
        return ALL.contains(candidate);
    }

    public static Set<String> java() {
        return JAVA;
    }

    public static Set<String> rust() {
        return RUST;
    }

    public static Set<String> all() {
        return ALL;
    }
}
