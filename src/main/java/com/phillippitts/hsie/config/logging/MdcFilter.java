package com.phillippitts.hsie.config.logging;

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
 * Puts request-scoped keys into the Log4j2 ThreadContext for every REST call:
 * {@code requestId} (from {@value #REQUEST_ID_HEADER} or a fresh UUID, echoed back in the
 * response), {@code method}, {@code uri} and, for {@code /evidence/{id}/...} paths,
 * {@code evidenceId}. The pipeline overrides {@code evidenceId} per stage. Everything is cleared
 * when the request ends.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern EVIDENCE_PATH = Pattern.compile("^/evidence/([0-9a-f]{64})(?:/.*)?$");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        String requestId = http.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        try {
            ThreadContext.put("requestId", requestId);
            ThreadContext.put("method", http.getMethod());
            ThreadContext.put("uri", http.getRequestURI());
            String evidenceId = evidenceIdOf(http.getRequestURI());
            if (evidenceId != null) {
                ThreadContext.put("evidenceId", evidenceId);
            }
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String evidenceIdOf(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher m = EVIDENCE_PATH.matcher(uri);
        return m.matches() ? m.group(1) : null;
    }
}
