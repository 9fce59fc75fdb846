package work.lcod.graphgen.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Router call plus its branch table (label to node id or terminal), in declaration order.
 */
public record ConditionalDispatch(String routerName, Map<String, String> branches) {
    public ConditionalDispatch {
        branches = Collections.unmodifiableMap(new LinkedHashMap<>(branches));
    }
}
