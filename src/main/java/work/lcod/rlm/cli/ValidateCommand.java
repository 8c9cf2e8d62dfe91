package work.lcod.rlm.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.rlm.api.RlmRunner;

@CommandLine.Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a task document.")
final class ValidateCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private RlmCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "TASK", description = "Task file (JSON or YAML).")
    private Path task;

    @Override
    public Integer call() {
        var configuration = parent.configuration().taskPath(task).build();
        return RlmCommand.emit(spec.commandLine(), new RlmRunner().validate(configuration));
    }
}
