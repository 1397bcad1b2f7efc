package teranet.mapdev.listings.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Utility class for the id of the current pipeline run.
 * Uses SLF4J MDC so every log line of a run carries the same id (see the %X{runId}
 * conversion word in the log patterns).
 */
public class RunIdUtil {

    public static final String RUN_ID_KEY = "runId";

    private RunIdUtil() {
    }

    /**
     * Generates a new run id and puts it in MDC.
     * @return the new run id
     */
    public static String startRun() {
        String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID_KEY, runId);
        return runId;
    }

    /**
     * @return current run id or "NO-RUN-ID" if none is set
     */
    public static String getCurrentRunId() {
        String runId = MDC.get(RUN_ID_KEY);
        return runId != null ? runId : "NO-RUN-ID";
    }

    /**
     * Removes the run id from MDC. Always call this in a finally block.
     */
    public static void clearRunId() {
        MDC.remove(RUN_ID_KEY);
    }

    public static boolean hasRunId() {
        return MDC.get(RUN_ID_KEY) != null;
    }
}
