package work.lcod.rlm.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.rlm.api.CacheMode;
import work.lcod.rlm.api.RlmRunner;

@CommandLine.Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Validate, bundle and execute a task until it completes, blocks or hits a limit."
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private RlmCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--task", required = true, description = "Task file (JSON or YAML).")
    private Path task;

    @CommandLine.Option(
        names = "--run-dir",
        description = "Run directory (default: <workspace>/.rlm/runs/<task_id>).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path runDir;

    @CommandLine.Option(names = "--fresh", description = "Discard any previous state of this run directory first.")
    private boolean fresh;

    @CommandLine.Option(
        names = "--cache",
        paramLabel = "off|readonly|readwrite",
        description = "Subcall cache mode; required for subcalls-mode tasks.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private CacheMode cache;

    @CommandLine.Option(
        names = "--cache-path",
        description = "Cache log (default: <workspace>/.rlm/cache/<task_id>.jsonl).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path cachePath;

    @CommandLine.Option(
        names = "--bundle-root",
        description = "Bundle output root (default: <workspace>/.rlm/bundles).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path bundleRoot;

    @Override
    public Integer call() {
        var configuration = parent.configuration()
            .taskPath(task)
            .runDirectory(runDir)
            .bundleRoot(bundleRoot)
            .cachePath(cachePath)
            .cacheMode(cache)
            .fresh(fresh)
            .build();
        return RlmCommand.emit(spec.commandLine(), new RlmRunner().run(configuration));
    }
}
