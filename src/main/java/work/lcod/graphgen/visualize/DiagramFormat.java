package work.lcod.graphgen.visualize;

import java.util.Locale;

/**
 * Diagram languages {@link GraphVisualizer} can write.
 */
public enum DiagramFormat {
    MERMAID("mmd"),
    DOT("dot");

    private final String fileExtension;

    DiagramFormat(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public static DiagramFormat from(String value) {
        if (value == null || value.isBlank()) {
            return MERMAID;
        }
        try {
            return DiagramFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported diagram format: " + value);
        }
    }
}
