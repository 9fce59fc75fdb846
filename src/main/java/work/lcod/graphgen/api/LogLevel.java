package work.lcod.graphgen.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Log thresholds accepted by {@code --log-level}, {@value #ENVIRONMENT_VARIABLE} and the settings file.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static final String ENVIRONMENT_VARIABLE = "GRAPHGEN_LOG_LEVEL";

    public static LogLevel from(String value) {
        return parse(value).orElse(WARN);
    }

    /**
     * The first non-blank candidate, parsed. Later candidates are only consulted when earlier ones are blank.
     */
    public static Optional<LogLevel> firstOf(String... candidates) {
        for (var candidate : candidates) {
            var parsed = parse(candidate);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LogLevel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}
