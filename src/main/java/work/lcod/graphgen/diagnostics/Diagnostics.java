package work.lcod.graphgen.diagnostics;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects warnings for a single conversion run. Not shared between runs.
 */
public final class Diagnostics {
    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        LOG.warn("{}", diagnostic);
        entries.add(diagnostic);
    }

    public void reportAll(List<Diagnostic> diagnostics) {
        diagnostics.forEach(this::report);
    }

    public List<Diagnostic> snapshot() {
        return List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
