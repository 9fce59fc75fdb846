package work.lcod.graphgen.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.graphgen.emit.EmitterOptions;
import work.lcod.graphgen.emit.TargetLanguage;
import work.lcod.graphgen.ir.DynamicTypeDescriptor;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.topology.TopologyResolver;

/**
 * Immutable settings for one {@link GraphGenerator}. When no class name is given the graph's own name is used.
 */
public record GenerationConfiguration(
    TargetLanguage target,
    String packageName,
    Optional<String> className,
    String stateTypeName,
    boolean emitTests,
    Map<String, DynamicTypeDescriptor> typeAliases,
    int maxGraphSize,
    LogLevel logLevel
) {
    public GenerationConfiguration {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(logLevel, "logLevel");
        packageName = packageName == null ? "" : packageName;
        className = className == null ? Optional.empty() : className.filter(value -> !value.isBlank());
        stateTypeName = stateTypeName == null || stateTypeName.isBlank() ? EmitterOptions.DEFAULT_STATE_TYPE : stateTypeName;
        typeAliases = typeAliases == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(typeAliases));
        if (maxGraphSize <= 0) {
            throw new IllegalArgumentException("maxGraphSize must be positive: " + maxGraphSize);
        }
    }

    public static GenerationConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Emitter naming for {@code graph}: the configured class name, else the graph name in PascalCase.
     */
    public EmitterOptions emitterOptions(GraphInfo graph) {
        var name = className.orElseGet(() -> graph.name()
            .map(GenerationConfiguration::pascalCase)
            .filter(value -> !value.isEmpty())
            .orElse(EmitterOptions.DEFAULT_CLASS_NAME));
        if (className.isEmpty() && name.equals(stateTypeName)) {
            name = name + "Workflow";
        }
        return new EmitterOptions(packageName, name, stateTypeName, emitTests);
    }

    static String pascalCase(String raw) {
        var out = new StringBuilder();
        boolean upper = true;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < 128 && Character.isLetterOrDigit(c)) {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            } else {
                upper = true;
            }
        }
        return out.toString();
    }

    public static final class Builder {
        private TargetLanguage target = TargetLanguage.JAVA;
        private String packageName = "";
        private String className;
        private String stateTypeName = EmitterOptions.DEFAULT_STATE_TYPE;
        private boolean emitTests = true;
        private final Map<String, DynamicTypeDescriptor> typeAliases = new LinkedHashMap<>();
        private int maxGraphSize = TopologyResolver.DEFAULT_MAX_GRAPH_SIZE;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder target(TargetLanguage target) {
            this.target = target;
            return this;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        public Builder stateTypeName(String stateTypeName) {
            this.stateTypeName = stateTypeName;
            return this;
        }

        public Builder emitTests(boolean emitTests) {
            this.emitTests = emitTests;
            return this;
        }

        public Builder typeAlias(String name, DynamicTypeDescriptor type) {
            typeAliases.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(type, "type"));
            return this;
        }

        public Builder typeAliases(Map<String, DynamicTypeDescriptor> aliases) {
            aliases.forEach(this::typeAlias);
            return this;
        }

        public Builder maxGraphSize(int maxGraphSize) {
            this.maxGraphSize = maxGraphSize;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public GenerationConfiguration build() {
            return new GenerationConfiguration(
                target,
                packageName,
                Optional.ofNullable(className),
                stateTypeName,
                emitTests,
                typeAliases,
                maxGraphSize,
                logLevel
            );
        }
    }
}
