package dev.pekelund.zuvp.processor;

import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted while a submission
 * moves through the pipeline share the same identifiers (request id, file, stage).
 */
final class PermitProcessingMdc {

    static final String KEY_REQUEST_ID = "permit.requestId";
    static final String KEY_FILE = "permit.file";
    static final String KEY_STAGE = "permit.stage";

    private PermitProcessingMdc() {
        // Utility class
    }

    static Context open(String requestId) {
        return new Context(requestId);
    }

    static void attachFile(String fileName) {
        putIfHasText(KEY_FILE, fileName);
    }

    static void setStage(PipelineStage stage) {
        if (stage == null) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage.name());
        }
    }

    /**
     * Wraps a task so it runs with the caller's MDC entries on whichever thread executes it.
     */
    static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                return task.call();
            } finally {
                if (previous == null) {
                    MDC.clear();
                } else {
                    MDC.setContextMap(previous);
                }
            }
        };
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String requestId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_REQUEST_ID, requestId);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
