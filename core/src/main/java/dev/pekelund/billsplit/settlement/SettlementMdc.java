package dev.pekelund.billsplit.settlement;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates mapped diagnostic context (MDC) entries so log lines emitted while settling a
 * session share the session id and the current pipeline stage.
 */
final class SettlementMdc {

    private static final String KEY_SESSION_ID = "split.sessionId";
    private static final String KEY_STAGE = "split.stage";

    private SettlementMdc() {
        // Utility class
    }

    static Context open(String sessionId) {
        return new Context(sessionId);
    }

    static void setStage(String stage) {
        if (!StringUtils.hasText(stage)) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String sessionId) {
            this.previous = MDC.getCopyOfContextMap();
            if (StringUtils.hasText(sessionId)) {
                MDC.put(KEY_SESSION_ID, sessionId);
            } else {
                MDC.remove(KEY_SESSION_ID);
            }
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
