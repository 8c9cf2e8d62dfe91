package work.lcod.rlm.shared;

import java.nio.file.Path;
import org.slf4j.MDC;

/**
 * MDC keys attached to every log line emitted while a run is being driven.
 */
public final class RunMdc {
    public static final String TASK_ID = "taskId";
    public static final String RUN_DIR = "runDir";
    public static final String ITERATION = "iteration";

    private RunMdc() {}

    public static void setRun(String taskId, Path runDir) {
        MDC.put(TASK_ID, taskId);
        MDC.put(RUN_DIR, runDir.toString());
    }

    public static void setIteration(int iteration) {
        MDC.put(ITERATION, String.valueOf(iteration));
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(RUN_DIR);
        MDC.remove(ITERATION);
    }
}
