package tech.noetzold.coverage_api;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with a trace id (taken from {@code X-Request-Id} when the
 * caller sends one) and logs method, path, status and elapsed time.
 */
@Component
@Order(1)
public class RequestTraceFilter implements Filter {

    public static final String TRACE_ID = "trace_id";
    static final String HEADER = "X-Request-Id";

    private static final Logger logger = LoggerFactory.getLogger(RequestTraceFilter.class);

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) req;
        HttpServletResponse httpResponse = (HttpServletResponse) res;

        String traceId = resolveTraceId(httpRequest);
        long startTime = System.currentTimeMillis();
        MDC.put(TRACE_ID, traceId);
        httpResponse.setHeader(HEADER, traceId);

        try {
            chain.doFilter(req, res);
        } finally {
            long elapsed = System.currentTimeMillis() - startTime;
            String query = httpRequest.getQueryString();
            logger.info("{} {}{} -> {} in {}ms",
                    httpRequest.getMethod(),
                    httpRequest.getRequestURI(),
                    query != null ? "?" + query : "",
                    httpResponse.getStatus(),
                    elapsed);
            if (elapsed > 2000) {
                logger.warn("Slow request: {}ms for {}", elapsed, httpRequest.getRequestURI());
            }
            MDC.remove(TRACE_ID);
        }
    }

    private String resolveTraceId(HttpServletRequest request) {
        String incoming = request.getHeader(HEADER);
        if (incoming != null && !incoming.isBlank() && incoming.length() <= 120) {
            return incoming;
        }
        return "req_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
