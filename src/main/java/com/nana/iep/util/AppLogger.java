package com.nana.iep.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * AppLogger - Logging Utility
 *
 * <p>Per-class logging uses SLF4J directly:
 * <pre>
 *     private static final Logger log = LoggerFactory.getLogger(MyClass.class);
 * </pre>
 * {@code AppLogger} adds run-level helpers on top of that:
 * <ul>
 *   <li>startup and shutdown banners marking where each audit run begins
 *       and ends in the log file;</li>
 *   <li>MDC management: {@code operation} (READ_EXTRACT, RECONCILE, ...)
 *       and {@code run} (one id per audit run), printed by the Logback
 *       pattern on every line;</li>
 *   <li>structured {@code [EVENT]} lines for run milestones such as
 *       {@code AUDIT_RUN_COMPLETE} or {@code EXTRACT_ROW_REJECTED};</li>
 *   <li>log file path resolution, mirroring {@code logback.xml}.</li>
 * </ul>
 */
public final class AppLogger {

    // -----------------------------------------------------------------------
    // PRIVATE CONSTANTS
    // -----------------------------------------------------------------------

    private static final Logger APP_LOG =
            LoggerFactory.getLogger("com.nana.iep.APP");

    private static final DateTimeFormatter EVENT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** MDC key for the current operation name. */
    public static final String MDC_OPERATION = "operation";

    /** MDC key for the current audit run id. */
    public static final String MDC_RUN = "run";

    private static final String APP_VERSION = "1.0.0-SNAPSHOT";

    private static final String APP_NAME = "IEP Audit";

    private AppLogger() {
        throw new UnsupportedOperationException(
                "AppLogger is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STARTUP / SHUTDOWN BANNERS
    // -----------------------------------------------------------------------

    /**
     * Logs a banner marking the start of an audit run, with the Java and OS
     * details of the machine running the weekly job.
     */
    public static void logStartup() {
        String separator = "=".repeat(60);
        APP_LOG.info(separator);
        APP_LOG.info("  {} v{}", APP_NAME, APP_VERSION);
        APP_LOG.info("  Starting up - {}",
                LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Java:    {} ({})",
                System.getProperty("java.version"),
                System.getProperty("java.vendor"));
        APP_LOG.info("  OS:      {} {} ({})",
                System.getProperty("os.name"),
                System.getProperty("os.version"),
                System.getProperty("os.arch"));
        APP_LOG.info("  User:    {}",
                System.getProperty("user.name"));
        APP_LOG.info(separator);
    }

    /**
     * Logs a banner marking the end of an audit run.
     *
     * @param startTime when the run started; used for the duration line
     */
    public static void logShutdown(LocalDateTime startTime) {
        String separator = "-".repeat(60);
        long millis = 0;
        if (startTime != null) {
            millis = Duration.between(startTime, LocalDateTime.now()).toMillis();
        }
        APP_LOG.info(separator);
        APP_LOG.info("  {} finished - {}",
                APP_NAME, LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Run duration: {}.{}s", millis / 1000, String.format("%03d", millis % 1000));
        APP_LOG.info(separator);
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Logs a run milestone. Format: {@code [EVENT] <eventName> | <details>}
     *
     * @param eventName a short event label (e.g. "AUDIT_RUN_COMPLETE")
     * @param details   additional context
     */
    public static void logEvent(String eventName, String details) {
        APP_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs a warning-level milestone, such as a rejected extract row or a
     * batch with no usable facts.
     *
     * @param eventName a short event label
     * @param details   additional context
     */
    public static void logWarningEvent(String eventName, String details) {
        APP_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs a failed run or stage with its exception.
     *
     * @param eventName a short event label
     * @param details   what was attempted
     * @param throwable the cause
     */
    public static void logErrorEvent(String eventName,
                                     String details,
                                     Throwable throwable) {
        APP_LOG.error("[ERROR_EVENT] {} | {}", eventName, details, throwable);
    }

    // -----------------------------------------------------------------------
    // MDC CONTEXT MANAGEMENT
    // -----------------------------------------------------------------------

    /**
     * Tags every following log line on this thread with the operation name.
     * Pair with {@link #clearOperationContext()} in a {@code finally} block.
     *
     * @param operationName e.g. "READ_EXTRACT", "RECONCILE"
     */
    public static void setOperationContext(String operationName) {
        MDC.put(MDC_OPERATION, operationName);
    }

    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
    }

    /**
     * Tags every following log line on this thread with the run id.
     *
     * @param runId see {@link #generateRunId()}
     */
    public static void setRunContext(String runId) {
        MDC.put(MDC_RUN, runId);
    }

    public static void clearAllContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_RUN);
    }

    /**
     * @return a timestamp-based run id (e.g. "RUN-20250203-070012")
     */
    public static String generateRunId() {
        return "RUN-" + LocalDateTime.now()
                .format(DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss"));
    }

    // -----------------------------------------------------------------------
    // LOG FILE PATH RESOLUTION
    // -----------------------------------------------------------------------

    /**
     * Returns the active log file path. Mirrors {@code logback.xml}:
     * {@code ${user.home}/IEP_Audit/logs/iep_audit.log}.
     *
     * @return absolute path of the log file
     */
    public static Path getLogFilePath() {
        return Paths.get(System.getProperty("user.home"), "IEP_Audit", "logs", "iep_audit.log");
    }
}
