package com.phillippitts.guardian.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts request correlation values into Log4j2's ThreadContext for the duration of a request.
 *
 * <ul>
 *   <li>requestId: X-Request-ID header, or a generated UUID</li>
 *   <li>method and uri of the request</li>
 * </ul>
 *
 * <p>Only the keys set here are removed afterwards, so a servlet thread never carries them into
 * the next request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String REQUEST_ID = "requestId";
    private static final String METHOD = "method";
    private static final String URI = "uri";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                ThreadContext.put(REQUEST_ID, requestIdOf(http));
                ThreadContext.put(METHOD, http.getMethod());
                ThreadContext.put(URI, http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.remove(REQUEST_ID);
            ThreadContext.remove(METHOD);
            ThreadContext.remove(URI);
        }
    }

    private static String requestIdOf(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
