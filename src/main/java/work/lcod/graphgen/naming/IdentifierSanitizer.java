package work.lcod.graphgen.naming;

import java.util.Objects;
import java.util.Set;

/**
 * Maps arbitrary graph names to identifiers valid in every supported target: ASCII letters, digits and
 * underscores, never digit-leading, never a reserved word, never already in {@code used}.
 */
public final class IdentifierSanitizer {
    public static final String ESCAPE_PREFIX = "_";
    static final String EMPTY_REPLACEMENT = "unnamed";

    private IdentifierSanitizer() {}

    /**
     * Returns the sanitized name and records it in {@code used}.
     */
    public static String sanitize(String raw, Set<String> used) {
        Objects.requireNonNull(used, "used");
        var base = escape(clean(raw));
        var candidate = base;
        int suffix = 2;
        while (used.contains(candidate)) {
            candidate = base + "_" + suffix++;
        }
        used.add(candidate);
        return candidate;
    }

    /**
     * Character replacement and escaping only, without collision handling.
     */
    public static String normalize(String raw) {
        return escape(clean(raw));
    }

    public static boolean isValid(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        if (Character.isDigit(identifier.charAt(0))) {
            return false;
        }
        for (int i = 0; i < identifier.length(); i++) {
            if (!isIdentifierChar(identifier.charAt(i))) {
                return false;
            }
        }
        return !ReservedWords.isReserved(identifier);
    }

    private static String clean(String raw) {
        if (raw == null) {
            return EMPTY_REPLACEMENT;
        }
        var builder = new StringBuilder(raw.length());
        boolean meaningful = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (isIdentifierChar(c)) {
                builder.append(c);
                meaningful |= c != '_';
            } else {
                builder.append('_');
            }
        }
        return meaningful ? builder.toString() : EMPTY_REPLACEMENT;
    }

    private static String escape(String cleaned) {
        if (Character.isDigit(cleaned.charAt(0)) || ReservedWords.isReserved(cleaned)) {
            return ESCAPE_PREFIX + cleaned;
        }
        return cleaned;
    }

    private static boolean isIdentifierChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
