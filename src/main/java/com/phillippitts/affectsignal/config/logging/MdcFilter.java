package com.phillippitts.affectsignal.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID (echoed in the response)</li>
 *   <li>sessionId: from a {@code /api/sessions/{sessionId}/...} path</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>The context is always cleared after the request to avoid leakage across threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern SESSION_PATH = Pattern.compile("^/api/sessions/([^/]+)");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = headerOrGenerate(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }

                Matcher m = SESSION_PATH.matcher(http.getRequestURI());
                if (m.find()) {
                    ThreadContext.put("sessionId", m.group(1));
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
