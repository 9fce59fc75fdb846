package work.lcod.graphgen.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.graphgen.diagnostics.Diagnostic;
import work.lcod.graphgen.diagnostics.Diagnostics;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.topology.GraphException;
import work.lcod.graphgen.topology.TopologyResolver;
import work.lcod.graphgen.types.StaticType;
import work.lcod.graphgen.types.TypeMapper;

/**
 * Public entry point: resolves topology, maps state types and emits source for one graph at a time. Instances hold
 * no per-run state and may be shared between threads.
 */
public final class GraphGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(GraphGenerator.class);

    private final GenerationConfiguration configuration;
    private final TopologyResolver resolver;
    private final TypeMapper typeMapper;

    public GraphGenerator() {
        this(GenerationConfiguration.defaults());
    }

    public GraphGenerator(GenerationConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.resolver = new TopologyResolver(configuration.maxGraphSize());
        this.typeMapper = new TypeMapper(configuration.typeAliases());
    }

    public GenerationConfiguration configuration() {
        return configuration;
    }

    /**
     * Runs the whole pipeline. Fatal topology problems abort with {@link GraphException} and produce no artifact.
     */
    public GenerationResult generate(GraphInfo graph) throws GraphException {
        Objects.requireNonNull(graph, "graph");
        LOG.debug("Generating {} source for graph '{}' ({} nodes)", configuration.target(), graph.displayName(), graph.nodes().size());
        var diagnostics = new Diagnostics();

        var resolved = resolver.resolve(graph);
        diagnostics.reportAll(resolved.warnings());

        var types = mapTypes(graph, diagnostics);

        var options = configuration.emitterOptions(graph);
        var artifact = configuration.target().emitter(options).emit(graph, resolved, types);
        LOG.debug("Emitted {} with {} sections", artifact.mainFileName(), artifact.sections().size());
        return new GenerationResult(artifact, resolved, types, diagnostics.snapshot());
    }

    /**
     * Static type per state field, keyed by original field name; one {@code OPAQUE_FALLBACK} per degraded field.
     */
    public Map<String, StaticType> mapTypes(GraphInfo graph, Diagnostics diagnostics) {
        var types = new LinkedHashMap<String, StaticType>();
        for (var field : graph.stateSchema().fields()) {
            var mapped = typeMapper.mapField(field);
            types.put(field.name(), mapped.type());
            if (mapped.degraded()) {
                diagnostics.report(Diagnostic.opaqueFallback(field.name(), String.join("; ", mapped.fallbackReasons())));
            }
        }
        LOG.debug("Mapped {} state fields", types.size());
        return types;
    }
}
