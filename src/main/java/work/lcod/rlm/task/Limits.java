package work.lcod.rlm.task;

/**
 * Hard resource budgets of a run. {@code timeoutSeconds} is only handed to provider transports.
 */
public record Limits(
    int maxRootIters,
    int maxDepth,
    int maxSubcallsTotal,
    int maxSubcallsPerIter,
    int timeoutSeconds,
    int maxStdoutChars
) {}
