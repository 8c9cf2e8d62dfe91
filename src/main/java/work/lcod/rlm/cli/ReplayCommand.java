package work.lcod.rlm.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.rlm.api.RlmRunner;

/**
 * {@code rlm replay summary|compare}.
 */
@CommandLine.Command(
    name = "replay",
    mixinStandardHelpOptions = true,
    description = "Summarize and compare run traces for replay verification.",
    subcommands = { ReplayCommand.Summary.class, ReplayCommand.Compare.class }
)
final class ReplayCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private RlmCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    @CommandLine.Command(name = "summary", mixinStandardHelpOptions = true, description = "Summarize one run directory.")
    static final class Summary implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ReplayCommand replay;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(names = "--run-dir", required = true, description = "Run directory.")
        private Path runDir;

        @Override
        public Integer call() {
            var configuration = replay.parent.configuration().runDirectory(runDir).build();
            return RlmCommand.emit(spec.commandLine(), new RlmRunner().replaySummary(configuration));
        }
    }

    @CommandLine.Command(name = "compare", mixinStandardHelpOptions = true, description = "Compare two run directories.")
    static final class Compare implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ReplayCommand replay;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(names = "--run-a", required = true, description = "First run directory.")
        private Path runA;

        @CommandLine.Option(names = "--run-b", required = true, description = "Second run directory.")
        private Path runB;

        @Override
        public Integer call() {
            var configuration = replay.parent.configuration().build();
            return RlmCommand.emit(spec.commandLine(), new RlmRunner().replayCompare(configuration, runA, runB));
        }
    }
}
