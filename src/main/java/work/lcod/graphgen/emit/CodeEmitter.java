package work.lcod.graphgen.emit;

import java.util.Map;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.topology.ResolvedGraph;
import work.lcod.graphgen.types.StaticType;

/**
 * Renders a resolved graph into source for one target. Never fails on a graph the resolver accepted.
 */
public interface CodeEmitter {
    TargetLanguage target();

    /**
     * @param types mapped static type per state field name
     */
    SourceArtifact emit(GraphInfo graph, ResolvedGraph resolved, Map<String, StaticType> types);
}
