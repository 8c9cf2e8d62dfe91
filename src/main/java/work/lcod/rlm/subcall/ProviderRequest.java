package work.lcod.rlm.subcall;

import java.time.Duration;

/**
 * One attempt against one provider. {@code attempt} starts at 1. {@code timeout} comes from the task's
 * {@code limits.timeout_s} and bounds this attempt; {@code config.timeout()} is only the provider's default
 * from {@code providers.toml}.
 */
public record ProviderRequest(String prompt, ProviderConfig config, int attempt, Duration timeout) {}
