package work.lcod.graphgen.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.graphgen.emit.TargetLanguage;
import work.lcod.graphgen.ir.io.TypeAnnotationParser;

/**
 * Reads {@code graphgen.toml}: a {@code [generator]} table of naming and limit settings and a {@code [types]} table
 * of type aliases ({@code UserId = "str"}).
 */
public final class GeneratorSettingsLoader {
    public static final String DEFAULT_FILE_NAME = "graphgen.toml";

    private GeneratorSettingsLoader() {}

    /**
     * Applies the file's settings on top of {@code builder}; keys that are absent leave the builder untouched.
     */
    public static GenerationConfiguration.Builder apply(Path path, GenerationConfiguration.Builder builder) {
        String raw;
        try {
            raw = Files.readString(path);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
        return apply(raw, path.toString(), builder);
    }

    static GenerationConfiguration.Builder apply(String raw, String source, GenerationConfiguration.Builder builder) {
        TomlParseResult result = Toml.parse(raw);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalStateException("Invalid settings in " + source + ": " + errors);
        }
        var generator = result.getTable("generator");
        if (generator != null) {
            applyGenerator(generator, source, builder);
        }
        var types = result.getTable("types");
        if (types != null) {
            for (var key : types.keySet()) {
                var value = types.get(List.of(key));
                if (!(value instanceof String annotation)) {
                    throw new IllegalStateException("Type alias '" + key + "' in " + source + " must be a string");
                }
                builder.typeAlias(key, TypeAnnotationParser.parse(annotation));
            }
        }
        return builder;
    }

    private static void applyGenerator(TomlTable generator, String source, GenerationConfiguration.Builder builder) {
        try {
            var target = generator.getString("target");
            if (target != null) {
                builder.target(TargetLanguage.from(target));
            }
            var packageName = generator.getString("package");
            if (packageName != null) {
                builder.packageName(packageName);
            }
            var className = generator.getString("class_name");
            if (className != null) {
                builder.className(className);
            }
            var stateType = generator.getString("state_type");
            if (stateType != null) {
                builder.stateTypeName(stateType);
            }
            var maxGraphSize = generator.getLong("max_graph_size");
            if (maxGraphSize != null) {
                builder.maxGraphSize(Math.toIntExact(maxGraphSize));
            }
            var emitTests = generator.getBoolean("emit_tests");
            if (emitTests != null) {
                builder.emitTests(emitTests);
            }
            var logLevel = generator.getString("log_level");
            if (logLevel != null) {
                builder.logLevel(LogLevel.from(logLevel));
            }
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Invalid [generator] settings in " + source + ": " + ex.getMessage(), ex);
        }
    }
}
