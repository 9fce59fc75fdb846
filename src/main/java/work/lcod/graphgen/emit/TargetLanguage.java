package work.lcod.graphgen.emit;

import java.util.Locale;

/**
 * Languages the emitter can write.
 */
public enum TargetLanguage {
    JAVA("java"),
    RUST("rs");

    private final String fileExtension;

    TargetLanguage(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public CodeEmitter emitter(EmitterOptions options) {
        return switch (this) {
            case JAVA -> new JavaEmitter(options);
            case RUST -> new RustEmitter(options);
        };
    }

    public static TargetLanguage from(String value) {
        if (value == null || value.isBlank()) {
            return JAVA;
        }
        try {
            return TargetLanguage.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported target language: " + value);
        }
    }
}
