package work.lcod.graphgen.emit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generated output: named text sections plus the assembled files. Writing them anywhere is the caller's job.
 */
public record SourceArtifact(
    TargetLanguage target,
    Map<String, String> sections,
    String mainFileName,
    String mainSource,
    Optional<String> testFileName,
    Optional<String> testSource
) {
    public static final String STATE_TYPE = "state_type";
    public static final String DISPATCH = "dispatch";
    public static final String TESTS = "tests";
    private static final String NODE_PREFIX = "node:";
    private static final String ROUTER_PREFIX = "router:";

    public SourceArtifact {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(mainFileName, "mainFileName");
        Objects.requireNonNull(mainSource, "mainSource");
        sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
        testFileName = testFileName == null ? Optional.empty() : testFileName;
        testSource = testSource == null ? Optional.empty() : testSource;
    }

    public static String nodeSection(String nodeId) {
        return NODE_PREFIX + nodeId;
    }

    public static String routerSection(String routerName) {
        return ROUTER_PREFIX + routerName;
    }

    public Optional<String> section(String name) {
        return Optional.ofNullable(sections.get(name));
    }

    /**
     * Relative path to file content, main source first.
     */
    public Map<String, String> files() {
        var files = new LinkedHashMap<String, String>();
        files.put(mainFileName, mainSource);
        if (testFileName.isPresent() && testSource.isPresent()) {
            files.put(testFileName.get(), testSource.get());
        }
        return files;
    }
}
