package work.lcod.graphgen.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.graphgen.ir.io.GraphInfoLoader;
import work.lcod.graphgen.visualize.DiagramFormat;
import work.lcod.graphgen.visualize.GraphVisualizer;

@CommandLine.Command(
    name = "visualize",
    description = "Render a serialized workflow graph as a Mermaid or Graphviz diagram.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class VisualizeCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    LoggingOptions logging = new LoggingOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "GRAPH", description = "Graph description (.json, .yaml or .yml).")
    Path graphFile;

    @CommandLine.Option(names = {"-f", "--format"}, description = "Diagram format (mermaid|dot).", defaultValue = "mermaid")
    String format;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the diagram to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path output;

    @Override
    public Integer call() throws Exception {
        logging.apply();
        var diagram = GraphVisualizer.render(GraphInfoLoader.load(graphFile), DiagramFormat.from(format));
        if (output != null) {
            var parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, diagram);
        } else {
            var out = spec.commandLine().getOut();
            out.print(diagram);
            out.flush();
        }
        return 0;
    }
}
