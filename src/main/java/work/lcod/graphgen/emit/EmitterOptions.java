package work.lcod.graphgen.emit;

import java.util.Arrays;
import java.util.stream.Collectors;
import work.lcod.graphgen.naming.IdentifierSanitizer;

/**
 * Naming knobs for generated sources. Names are normalised into valid identifiers on construction.
 */
public record EmitterOptions(String packageName, String className, String stateTypeName, boolean emitTests) {
    public static final String DEFAULT_CLASS_NAME = "GeneratedWorkflow";
    public static final String DEFAULT_STATE_TYPE = "GraphState";

    public EmitterOptions {
        packageName = normalizePackage(packageName);
        className = className == null || className.isBlank() ? DEFAULT_CLASS_NAME : IdentifierSanitizer.normalize(className);
        stateTypeName = stateTypeName == null || stateTypeName.isBlank()
            ? DEFAULT_STATE_TYPE
            : IdentifierSanitizer.normalize(stateTypeName);
        if (className.equals(stateTypeName)) {
            throw new IllegalArgumentException("Class name and state type name must differ: " + className);
        }
    }

    public static EmitterOptions defaults() {
        return new EmitterOptions("", DEFAULT_CLASS_NAME, DEFAULT_STATE_TYPE, true);
    }

    public EmitterOptions withPackage(String value) {
        return new EmitterOptions(value, className, stateTypeName, emitTests);
    }

    public EmitterOptions withClassName(String value) {
        return new EmitterOptions(packageName, value, stateTypeName, emitTests);
    }

    public EmitterOptions withTests(boolean value) {
        return new EmitterOptions(packageName, className, stateTypeName, value);
    }

    /**
     * Snake-case form of the class name, used for Rust module files.
     */
    public String moduleName() {
        var builder = new StringBuilder();
        for (int i = 0; i < className.length(); i++) {
            char c = className.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && className.charAt(i - 1) != '_') {
                    builder.append('_');
                }
                builder.append(Character.toLowerCase(c));
            } else {
                builder.append(c);
            }
        }
        return IdentifierSanitizer.normalize(builder.toString());
    }

    private static String normalizePackage(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return Arrays.stream(raw.trim().split("\\."))
            .filter(segment -> !segment.isBlank())
            .map(IdentifierSanitizer::normalize)
            .collect(Collectors.joining("."));
    }
}
