package work.lcod.graphgen.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.graphgen.api.GraphGenerator;
import work.lcod.graphgen.ir.io.GraphInfoLoader;

@CommandLine.Command(
    name = "inspect",
    description = "Print the normalised graph description, optionally with its resolved topology.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class InspectCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectWriter YAML_WRITER = new ObjectMapper(new YAMLFactory()).writer();
    private static final ObjectWriter TOML_WRITER = new TomlMapper().writer();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    LoggingOptions logging = new LoggingOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "GRAPH", description = "Graph description (.json, .yaml or .yml).")
    Path graphFile;

    @CommandLine.Option(names = {"-f", "--format"}, description = "Output format (json|yaml|toml).", defaultValue = "json")
    String format;

    @CommandLine.Option(names = "--resolve", description = "Include reachability, loops and diagnostics.")
    boolean resolve;

    @Override
    public Integer call() throws Exception {
        logging.apply();
        var writer = switch (format.trim().toLowerCase()) {
            case "json" -> JSON_WRITER;
            case "yaml", "yml" -> YAML_WRITER;
            case "toml" -> TOML_WRITER;
            default -> throw new CommandLine.ParameterException(spec.commandLine(), "Unsupported format: " + format);
        };
        var graph = GraphInfoLoader.load(graphFile);
        var payload = new LinkedHashMap<String, Object>(GraphInfoLoader.toSerializableMap(graph));
        if (resolve) {
            var result = new GraphGenerator().generate(graph);
            var resolution = result.toSerializableMap();
            resolution.remove("target");
            resolution.remove("files");
            payload.put("resolution", resolution);
        }
        var out = spec.commandLine().getOut();
        out.println(writer.writeValueAsString(payload).stripTrailing());
        out.flush();
        return 0;
    }
}
