package com.yizhaoqi.kb.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured business logging. Every line is prefixed with the operation name so that one run of
 * the ingestion pipeline can be followed across threads with a single grep.
 */
public final class LogUtils {

    private static final Logger BUSINESS_LOGGER = LoggerFactory.getLogger("kb.business");
    private static final Logger PERFORMANCE_LOGGER = LoggerFactory.getLogger("kb.performance");

    public static final String MDC_DOCUMENT_ID = "documentId";
    public static final String MDC_RUN_ID = "runId";

    private LogUtils() {
    }

    public static void logBusiness(String operation, String subject, String message, Object... args) {
        if (BUSINESS_LOGGER.isInfoEnabled()) {
            BUSINESS_LOGGER.info("[{}] [{}] {}", operation, subject, format(message, args));
        }
    }

    public static void logBusinessError(String operation, String subject, String message, Throwable error,
                                        Object... args) {
        BUSINESS_LOGGER.error("[{}] [{}] {}", operation, subject, format(message, args), error);
    }

    public static void logDocumentOperation(String subject, String operation, Long documentId, String documentName,
                                            String status) {
        BUSINESS_LOGGER.info("[DOCUMENT] [{}] operation={}, documentId={}, name={}, status={}",
                subject, operation, documentId, documentName, status);
    }

    /**
     * Puts the document and run ids on the MDC for the current thread.
     */
    public static void bindRun(Long documentId, String runId) {
        MDC.put(MDC_DOCUMENT_ID, String.valueOf(documentId));
        if (runId != null) {
            MDC.put(MDC_RUN_ID, runId);
        }
    }

    public static void clearRun() {
        MDC.remove(MDC_DOCUMENT_ID);
        MDC.remove(MDC_RUN_ID);
    }

    public static PerformanceMonitor startPerformanceMonitor(String operation) {
        return new PerformanceMonitor(operation);
    }

    private static String format(String message, Object... args) {
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }

    public static final class PerformanceMonitor {

        private final String operation;
        private final long startNanos;

        private PerformanceMonitor(String operation) {
            this.operation = operation;
            this.startNanos = System.nanoTime();
        }

        public long elapsedMillis() {
            return (System.nanoTime() - startNanos) / 1_000_000;
        }

        public void end(String result) {
            long elapsed = elapsedMillis();
            if (elapsed > 5000) {
                PERFORMANCE_LOGGER.warn("[{}] slow operation: {} ms, result={}", operation, elapsed, result);
            } else {
                PERFORMANCE_LOGGER.info("[{}] took {} ms, result={}", operation, elapsed, result);
            }
        }
    }
}
