package work.lcod.graphgen.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "graphgen",
    description = "Generate statically-typed workflow sources from serialized workflow graphs.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {ConvertCommand.class, InspectCommand.class, VisualizeCommand.class}
)
final class GraphGenCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
