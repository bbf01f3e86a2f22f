package com.expertrelay.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * HTTP 链路日志过滤器：注入 traceId / requestId 到 MDC 与响应头，记录入口耗时。
 * <p>
 * 请求体包含用户原始提问，不落日志。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";

    private final long slowRequestThresholdMs;

    public RequestTraceLoggingFilter(@Value("${relay.http-log.slow-request-threshold-ms:1000}") long slowRequestThresholdMs) {
        this.slowRequestThresholdMs = Math.max(slowRequestThresholdMs, 0L);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request == null || !StringUtils.startsWith(request.getRequestURI(), "/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreate(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreate(request.getHeader(HEADER_REQUEST_ID));
        String method = request.getMethod();
        String path = request.getRequestURI();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        long startNs = System.nanoTime();
        Throwable error = null;
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, response.getStatus(), costMs,
                        error.getClass().getSimpleName(), StringUtils.abbreviate(error.getMessage(), 200));
            } else if (costMs >= slowRequestThresholdMs) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=slow",
                        method, path, response.getStatus(), costMs);
            } else {
                log.info("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=success",
                        method, path, response.getStatus(), costMs);
            }
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreate(String value) {
        if (StringUtils.isNotBlank(value)) {
            return StringUtils.abbreviate(value.trim(), 64);
        }
        return UUID.randomUUID().toString().replace("-", "");
    }
}
