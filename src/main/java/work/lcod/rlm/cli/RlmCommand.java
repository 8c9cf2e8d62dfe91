package work.lcod.rlm.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.rlm.api.LogLevel;
import work.lcod.rlm.api.RunConfiguration;
import work.lcod.rlm.api.RunResult;
import work.lcod.rlm.subcall.ProviderRegistry;
import work.lcod.rlm.subcall.ProviderSettings;

/**
 * Top-level {@code rlm} command. Holds the options shared by every subcommand.
 */
@CommandLine.Command(
    name = "rlm",
    description = "Validate, bundle, run and replay deterministic recursive-model tasks.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        ValidateCommand.class,
        BundleCommand.class,
        RunCommand.class,
        StepCommand.class,
        ResumeCommand.class,
        ShowStateCommand.class,
        ReplayCommand.class,
        CommandLine.HelpCommand.class
    }
)
final class RlmCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-w", "--workspace"},
        description = "Workspace root that relative task, output and trace paths resolve against (default: current directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path workspace;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold on stderr (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    Path workspaceRoot() {
        Path root = workspace == null ? Path.of("") : workspace;
        return root.toAbsolutePath().normalize();
    }

    RunConfiguration.Builder configuration() {
        Path root = workspaceRoot();
        return RunConfiguration.builder()
            .workspaceRoot(root)
            .logLevel(LogLevel.from(logLevelRaw))
            .providers(ProviderRegistry.discover(ProviderSettings.load(root)));
    }

    /**
     * Prints the JSON status summary on stdout (and the error on stderr) and returns the exit code.
     */
    static int emit(CommandLine commandLine, RunResult result) {
        commandLine.getOut().print(result.toPrettyJson());
        commandLine.getOut().flush();
        if (result.status() == RunResult.Status.FAILURE) {
            Object error = result.metadata().get("error");
            commandLine.getErr().println(commandLine.getColorScheme().errorText(String.valueOf(error)));
        }
        return result.exitCode();
    }
}
