package work.lcod.rlm.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.lcod.rlm.subcall.ProviderRegistry;

/**
 * Immutable configuration passed to {@link RlmRunner}. Commands that start from a task need {@code taskPath};
 * commands that re-enter a run need {@code runDirectory}. Other optional paths fall back to the defaults
 * under {@code <workspace>/.rlm/}.
 */
public record RunConfiguration(
    Path workspaceRoot,
    Optional<Path> taskPath,
    Optional<Path> runDirectory,
    Optional<Path> bundleRoot,
    Optional<Path> cachePath,
    Optional<CacheMode> cacheMode,
    boolean fresh,
    LogLevel logLevel,
    ProviderRegistry providers
) {
    public RunConfiguration {
        Objects.requireNonNull(workspaceRoot, "workspaceRoot");
        Objects.requireNonNull(taskPath, "taskPath");
        Objects.requireNonNull(runDirectory, "runDirectory");
        Objects.requireNonNull(bundleRoot, "bundleRoot");
        Objects.requireNonNull(cachePath, "cachePath");
        Objects.requireNonNull(cacheMode, "cacheMode");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(providers, "providers");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path workspaceRoot = Path.of("").toAbsolutePath();
        private Optional<Path> taskPath = Optional.empty();
        private Optional<Path> runDirectory = Optional.empty();
        private Optional<Path> bundleRoot = Optional.empty();
        private Optional<Path> cachePath = Optional.empty();
        private Optional<CacheMode> cacheMode = Optional.empty();
        private boolean fresh;
        private LogLevel logLevel = LogLevel.WARN;
        private ProviderRegistry providers;

        public Builder workspaceRoot(Path workspaceRoot) {
            this.workspaceRoot = workspaceRoot;
            return this;
        }

        public Builder taskPath(Path taskPath) {
            this.taskPath = Optional.ofNullable(taskPath);
            return this;
        }

        public Builder runDirectory(Path runDirectory) {
            this.runDirectory = Optional.ofNullable(runDirectory);
            return this;
        }

        public Builder bundleRoot(Path bundleRoot) {
            this.bundleRoot = Optional.ofNullable(bundleRoot);
            return this;
        }

        public Builder cachePath(Path cachePath) {
            this.cachePath = Optional.ofNullable(cachePath);
            return this;
        }

        public Builder cacheMode(CacheMode cacheMode) {
            this.cacheMode = Optional.ofNullable(cacheMode);
            return this;
        }

        public Builder fresh(boolean fresh) {
            this.fresh = fresh;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder providers(ProviderRegistry providers) {
            this.providers = providers;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(
                workspaceRoot,
                taskPath,
                runDirectory,
                bundleRoot,
                cachePath,
                cacheMode,
                fresh,
                logLevel,
                providers == null ? new ProviderRegistry() : providers
            );
        }
    }
}
