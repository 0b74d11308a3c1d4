package com.exportscan.config;

import org.slf4j.MDC;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;

/**
 * Trace id handling for HTTP requests: reuse the caller's X-Trace-Id or generate one,
 * put it in MDC and echo it on the response.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private TraceContextManager() {}

    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = MDC.get(TRACE_ID);
        }
        if (traceId == null || traceId.isBlank()) {
            traceId = generateTraceId();
        }
        MDC.put(TRACE_ID, traceId);
        if (response != null) {
            response.setHeader(TRACE_HEADER, traceId);
        }
        return traceId;
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
    }
}
