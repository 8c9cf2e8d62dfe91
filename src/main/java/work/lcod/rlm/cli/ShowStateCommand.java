package work.lcod.rlm.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.rlm.api.RlmRunner;

@CommandLine.Command(name = "show-state", mixinStandardHelpOptions = true, description = "Print the persisted state of a run.")
final class ShowStateCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private RlmCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--run-dir", required = true, description = "Run directory.")
    private Path runDir;

    @Override
    public Integer call() {
        var configuration = parent.configuration().runDirectory(runDir).build();
        return RlmCommand.emit(spec.commandLine(), new RlmRunner().showState(configuration));
    }
}
