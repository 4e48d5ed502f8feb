package com.talksql.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a trace id and logs one completion line per request.
 *
 * <p>The caller's {@code X-Request-Id} (or {@code X-Trace-Id}) is reused when it is a plain token;
 * anything else is replaced by a fresh UUID so header content never reaches the log verbatim.
 * The id is echoed in {@code X-Request-Id} and exposed to logging as MDC {@code trace_id}.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String MDC_TRACE_ID = "trace_id";
    static final String TRACE_ID_HEADER = "X-Request-Id";
    static final List<String> INBOUND_HEADERS = List.of(TRACE_ID_HEADER, "X-Trace-Id");

    private static final Pattern SAFE_TRACE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String traceId = resolveTraceId(request);
        MDC.put(MDC_TRACE_ID, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        long started = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("{} {} -> {} in {} ms", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), (System.nanoTime() - started) / 1_000_000);
            }
            MDC.remove(MDC_TRACE_ID);
        }
    }

    static String resolveTraceId(HttpServletRequest request) {
        for (String header : INBOUND_HEADERS) {
            String candidate = request.getHeader(header);
            if (candidate != null && SAFE_TRACE_ID.matcher(candidate.trim()).matches()) {
                return candidate.trim();
            }
        }
        return UUID.randomUUID().toString();
    }
}
