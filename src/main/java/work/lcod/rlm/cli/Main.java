package work.lcod.rlm.cli;

import picocli.CommandLine;
import work.lcod.rlm.api.CacheMode;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new RlmCommand())
            .registerConverter(CacheMode.class, CacheMode::from)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
