package work.lcod.graphgen.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.graphgen.diagnostics.Diagnostic;
import work.lcod.graphgen.emit.SourceArtifact;
import work.lcod.graphgen.topology.ResolvedGraph;
import work.lcod.graphgen.types.StaticType;

/**
 * Outcome of a {@link GraphGenerator} run: the artifact plus every non-fatal diagnostic.
 */
public record GenerationResult(
    SourceArtifact artifact,
    ResolvedGraph resolved,
    Map<String, StaticType> fieldTypes,
    List<Diagnostic> diagnostics
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public GenerationResult {
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(resolved, "resolved");
        fieldTypes = Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasWarnings() {
        return !diagnostics.isEmpty();
    }

    /**
     * Summary without source text, suitable for {@code --json} output.
     */
    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("target", artifact.target().name().toLowerCase());
        serializable.put("files", new ArrayList<>(artifact.files().keySet()));
        serializable.put("entryPoint", resolved.entryPoint());
        serializable.put("reachable", resolved.reachableOrder());
        serializable.put("unreachable", resolved.unreachableNodes());
        serializable.put("loopBacks", resolved.loopBackEdges().stream().map(Object::toString).toList());
        var types = new LinkedHashMap<String, String>();
        fieldTypes.forEach((field, type) -> types.put(field, type.toString()));
        serializable.put("fieldTypes", types);
        serializable.put("diagnostics", diagnostics.stream().map(Diagnostic::toSerializableMap).toList());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }
}
