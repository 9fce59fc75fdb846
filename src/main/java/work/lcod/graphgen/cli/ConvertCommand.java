package work.lcod.graphgen.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.graphgen.api.GenerationConfiguration;
import work.lcod.graphgen.api.GeneratorSettingsLoader;
import work.lcod.graphgen.api.GraphGenerator;
import work.lcod.graphgen.emit.TargetLanguage;
import work.lcod.graphgen.ir.io.GraphInfoLoader;

@CommandLine.Command(
    name = "convert",
    description = "Generate source files from a serialized workflow graph.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class ConvertCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(ConvertCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    LoggingOptions logging = new LoggingOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "GRAPH", description = "Graph description (.json, .yaml or .yml).")
    Path graphFile;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output directory.", defaultValue = "./generated")
    Path output;

    @CommandLine.Option(
        names = {"-t", "--target"},
        description = "Target language (java|rust).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String target;

    @CommandLine.Option(names = {"-p", "--package"}, description = "Java package of the generated class.")
    String packageName;

    @CommandLine.Option(names = "--class-name", description = "Generated class name (default: derived from the graph name).")
    String className;

    @CommandLine.Option(names = "--state-type", description = "Name of the generated state type.")
    String stateType;

    @CommandLine.Option(
        names = "--tests",
        negatable = true,
        description = "Emit the generated test scaffold (--no-tests to skip).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Boolean tests;

    @CommandLine.Option(names = "--max-graph-size", description = "Largest accepted node plus edge count.")
    Integer maxGraphSize;

    @CommandLine.Option(
        names = "--settings",
        description = "Settings file (default: graphgen.toml next to GRAPH, when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path settings;

    @CommandLine.Option(names = "--json", description = "Print a JSON summary instead of the file list.")
    boolean json;

    @Override
    public Integer call() throws Exception {
        var configuration = configuration().build();
        LoggingOptions.apply(configuration.logLevel());
        var graph = GraphInfoLoader.load(graphFile);
        var result = new GraphGenerator(configuration).generate(graph);

        var out = spec.commandLine().getOut();
        Files.createDirectories(output);
        for (var file : result.artifact().files().entrySet()) {
            var path = write(file.getKey(), file.getValue());
            LOG.info("Wrote {}", path);
            if (!json) {
                out.println(path);
            }
        }
        if (json) {
            out.println(result.toPrettyJson());
        }
        out.flush();
        return 0;
    }

    GenerationConfiguration.Builder configuration() {
        var builder = GenerationConfiguration.builder();
        var settingsFile = settingsFile();
        if (settingsFile != null) {
            LOG.debug("Reading settings from {}", settingsFile);
            GeneratorSettingsLoader.apply(settingsFile, builder);
        }
        if (target != null) {
            builder.target(TargetLanguage.from(target));
        }
        if (packageName != null) {
            builder.packageName(packageName);
        }
        if (className != null) {
            builder.className(className);
        }
        if (stateType != null) {
            builder.stateTypeName(stateType);
        }
        if (tests != null) {
            builder.emitTests(tests);
        }
        if (maxGraphSize != null) {
            builder.maxGraphSize(maxGraphSize);
        }
        logging.requested().ifPresent(builder::logLevel);
        return builder;
    }

    private Path settingsFile() {
        if (settings != null) {
            return settings;
        }
        var parent = graphFile.toAbsolutePath().getParent();
        if (parent == null) {
            return null;
        }
        var candidate = parent.resolve(GeneratorSettingsLoader.DEFAULT_FILE_NAME);
        return Files.isRegularFile(candidate) ? candidate : null;
    }

    private Path write(String relative, String content) throws IOException {
        var path = output.resolve(relative).normalize();
        if (!path.startsWith(output.normalize())) {
            throw new IllegalStateException("Refusing to write outside the output directory: " + relative);
        }
        var parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content);
        return path;
    }
}
