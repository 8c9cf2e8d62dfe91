package work.lcod.rlm.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.rlm.api.RlmRunner;

@CommandLine.Command(name = "bundle", mixinStandardHelpOptions = true, description = "Build the context bundle of a task.")
final class BundleCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private RlmCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--task", required = true, description = "Task file (JSON or YAML).")
    private Path task;

    @CommandLine.Option(
        names = "--output-root",
        description = "Directory receiving <task_id>/ (default: <workspace>/.rlm/bundles).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path outputRoot;

    @Override
    public Integer call() {
        var configuration = parent.configuration().taskPath(task).bundleRoot(outputRoot).build();
        return RlmCommand.emit(spec.commandLine(), new RlmRunner().bundle(configuration));
    }
}
