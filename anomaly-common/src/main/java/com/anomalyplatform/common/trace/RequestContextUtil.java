package com.anomalyplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Request id for one detection call. Lives in the Reactor Context and is copied into MDC
 * only while a log statement runs, since per-metric work moves between scheduler threads.
 */
public final class RequestContextUtil {

    public static final String REQUEST_ID_KEY = "requestId";
    public static final String UNASSIGNED     = "unassigned";

    private RequestContextUtil() {}

    public static <T> Mono<T> withRequestId(Mono<T> mono, String requestId) {
        return mono.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    public static String getRequestId(ContextView ctx) {
        return ctx.getOrDefault(REQUEST_ID_KEY, UNASSIGNED);
    }

    /**
     * Runs {@code logAction} with {@code requestId} in MDC. Any id the calling thread already
     * carried (a blocking caller's own request, for instance) is restored afterwards.
     */
    public static void withMdc(String requestId, Runnable logAction) {
        String previous = MDC.get(REQUEST_ID_KEY);
        MDC.put(REQUEST_ID_KEY, requestId);
        try {
            logAction.run();
        } finally {
            if (previous != null) {
                MDC.put(REQUEST_ID_KEY, previous);
            } else {
                MDC.remove(REQUEST_ID_KEY);
            }
        }
    }
}
