package com.anomalyplatform.common.trace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestContextUtilTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("request id written at the end of assembly is visible upstream")
    void contextPropagation() {
        Mono<String> pipeline = Mono.deferContextual(ctx -> Mono.just(RequestContextUtil.getRequestId(ctx)));

        assertEquals("req-1", RequestContextUtil.withRequestId(pipeline, "req-1").block());
        assertEquals(RequestContextUtil.UNASSIGNED, pipeline.block());
    }

    @Test
    @DisplayName("MDC holds the id only while the log action runs")
    void mdcScoped() {
        AtomicReference<String> seen = new AtomicReference<>();

        RequestContextUtil.withMdc("req-2", () -> seen.set(MDC.get(RequestContextUtil.REQUEST_ID_KEY)));

        assertEquals("req-2", seen.get());
        assertNull(MDC.get(RequestContextUtil.REQUEST_ID_KEY));
    }

    @Test
    @DisplayName("an id already on the calling thread is restored")
    void restoresCallerId() {
        MDC.put(RequestContextUtil.REQUEST_ID_KEY, "outer");

        RequestContextUtil.withMdc("inner", () ->
            assertEquals("inner", MDC.get(RequestContextUtil.REQUEST_ID_KEY)));

        assertEquals("outer", MDC.get(RequestContextUtil.REQUEST_ID_KEY));
    }
}
