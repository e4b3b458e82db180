package com.tessera.core.logging;

import com.tessera.core.engine.RequestContext;
import org.slf4j.MDC;

/**
 * Utility for managing Tessera-specific MDC keys for structured logging.
 */
public final class MdcContext {

    static final String REQUEST_ID = "requestId";
    static final String INTENT_HASH = "intentHash";
    static final String STAGE = "stage";

    private MdcContext() {}

    public static void setRequest(String requestId, String intentHash) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(INTENT_HASH, intentHash);
    }

    public static void setStage(String stage) {
        MDC.put(STAGE, stage);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(INTENT_HASH);
        MDC.remove(STAGE);
    }

    /**
     * Sets the request keys until the returned scope is closed.
     */
    public static Scope scope(RequestContext context) {
        setRequest(context.requestId(), context.intentHash());
        return new Scope();
    }

    /**
     * Clears the request keys on close.
     */
    public static final class Scope implements AutoCloseable {

        private Scope() {}

        @Override
        public void close() {
            clear();
        }
    }
}
