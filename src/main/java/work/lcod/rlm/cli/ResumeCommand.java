package work.lcod.rlm.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.rlm.api.CacheMode;
import work.lcod.rlm.api.RlmRunner;

@CommandLine.Command(name = "resume", mixinStandardHelpOptions = true, description = "Continue an existing run from its persisted cursor.")
final class ResumeCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private RlmCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--run-dir", required = true, description = "Run directory holding executor state.")
    private Path runDir;

    @CommandLine.Option(
        names = "--cache",
        paramLabel = "off|readonly|readwrite",
        description = "Must match the cache mode recorded when the run started.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private CacheMode cache;

    @Override
    public Integer call() {
        var configuration = parent.configuration().runDirectory(runDir).cacheMode(cache).build();
        return RlmCommand.emit(spec.commandLine(), new RlmRunner().resume(configuration));
    }
}
