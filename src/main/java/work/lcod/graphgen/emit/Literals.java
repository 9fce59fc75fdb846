package work.lcod.graphgen.emit;

/**
 * Escaping for string literals and comments in generated sources.
 */
final class Literals {
    private Literals() {}

    static String javaString(String value) {
        var builder = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        // octal escape; unicode escapes would be decoded before lexing
                        builder.append(String.format("\\%03o", (int) c));
                    } else {
                        builder.append(c);
                    }
                }
            }
        }
        return builder.append('"').toString();
    }

    static String rustString(String value) {
        var builder = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        builder.append(String.format("\\u{%x}", (int) c));
                    } else {
                        builder.append(c);
                    }
                }
            }
        }
        return builder.append('"').toString();
    }

    /**
     * Collapses text onto one line that is safe inside a {@code //} comment in either target.
     */
    static String comment(String text) {
        if (text == null) {
            return "";
        }
        var collapsed = text.strip().replaceAll("\\s+", " ");
        return collapsed.replace("\\", "\\\\").replace("*/", "*\\/");
    }
}
