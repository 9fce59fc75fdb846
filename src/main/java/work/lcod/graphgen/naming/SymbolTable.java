package work.lcod.graphgen.naming;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-emission symbol assignment. Fields and functions live in separate namespaces; both are pre-seeded with the
 * symbols the emitter writes itself.
 */
public final class SymbolTable {
    private final Set<String> usedFields = new HashSet<>();
    private final Set<String> usedFunctions = new HashSet<>();
    private final Map<String, String> fields = new LinkedHashMap<>();
    private final Map<String, String> nodes = new LinkedHashMap<>();
    private final Map<String, String> routers = new LinkedHashMap<>();

    public SymbolTable(Collection<String> reservedFields, Collection<String> reservedFunctions) {
        usedFields.addAll(reservedFields);
        usedFunctions.addAll(reservedFunctions);
    }

    public String field(String name) {
        return fields.computeIfAbsent(name, raw -> IdentifierSanitizer.sanitize(raw, usedFields));
    }

    public String node(String id) {
        return nodes.computeIfAbsent(id, raw -> IdentifierSanitizer.sanitize(raw, usedFunctions));
    }

    public String router(String routerName) {
        return routers.computeIfAbsent(routerName, raw -> IdentifierSanitizer.sanitize(raw, usedFunctions));
    }

    /**
     * Symbol allocated for a helper the emitter derives from user names (test method names, for instance).
     */
    public String helper(String raw) {
        return IdentifierSanitizer.sanitize(raw, usedFunctions);
    }

    public String requireNode(String id) {
        return Objects.requireNonNull(nodes.get(id), () -> "No symbol allocated for node " + id);
    }

    public String requireRouter(String routerName) {
        return Objects.requireNonNull(routers.get(routerName), () -> "No symbol allocated for router " + routerName);
    }
}
