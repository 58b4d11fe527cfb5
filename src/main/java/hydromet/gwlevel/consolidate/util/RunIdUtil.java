package hydromet.gwlevel.consolidate.util;

import org.slf4j.MDC;

/**
 * Utility class for tagging log lines with the id of the consolidation run.
 * Uses SLF4J MDC (Mapped Diagnostic Context) for thread-local storage.
 *
 * Usage:
 * - Set by ConsolidationPipelineService at the start of a run
 * - Propagated to worker threads by the executor task decorator
 */
public final class RunIdUtil {

    public static final String RUN_ID_KEY = "runId";

    private RunIdUtil() {
    }

    /**
     * Gets the current run ID from MDC
     * @return run ID or "NO-RUN-ID" if not set
     */
    public static String getCurrentRunId() {
        String runId = MDC.get(RUN_ID_KEY);
        return runId != null ? runId : "NO-RUN-ID";
    }

    public static void setRunId(String runId) {
        MDC.put(RUN_ID_KEY, runId);
    }

    /**
     * Removes run ID from MDC
     * IMPORTANT: Always call this in finally blocks, pool threads are reused
     */
    public static void clearRunId() {
        MDC.remove(RUN_ID_KEY);
    }

    public static boolean hasRunId() {
        return MDC.get(RUN_ID_KEY) != null;
    }
}
