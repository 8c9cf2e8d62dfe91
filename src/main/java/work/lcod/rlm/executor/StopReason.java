package work.lcod.rlm.executor;

public enum StopReason {
    MAX_ROOT_ITERS,
    PROGRAM_EXHAUSTED,
    STEP_ERROR,
    FINAL
}
