package com.phillippitts.interviewengine.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every interview API request with correlation keys in the Log4j2 ThreadContext.
 *
 * <ul>
 *   <li>{@code requestId}: {@code X-Request-ID}, or a generated UUID; echoed on the response</li>
 *   <li>{@code userId}: {@code X-User-ID}, when it has text</li>
 *   <li>{@code sessionId} and {@code operation}: taken from
 *       {@code /api/interview/{sessionId}/{operation}}</li>
 * </ul>
 *
 * <p>Lines logged by the controller and the exception advice therefore carry the session id
 * even outside the engine. Keys are restored to their previous values when the request
 * completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";

    static final String REQUEST_ID = "requestId";
    static final String USER_ID = "userId";
    static final String SESSION_ID = "sessionId";
    static final String OPERATION = "operation";

    private static final Pattern SESSION_PATH = Pattern.compile("^/api/interview/([^/]+)/([^/]+)/?$");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        String requestId = headerOrGenerate(http, REQUEST_ID_HEADER);
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        }
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put(REQUEST_ID, requestId)) {
            String userId = http.getHeader(USER_ID_HEADER);
            if (userId != null && !userId.isBlank()) {
                ctc.put(USER_ID, userId);
            }
            Matcher m = SESSION_PATH.matcher(pathWithinApplication(http));
            if (m.matches()) {
                ctc.put(SESSION_ID, m.group(1)).put(OPERATION, m.group(2));
            }
            chain.doFilter(request, response);
        }
    }

    private static String pathWithinApplication(HttpServletRequest http) {
        String uri = http.getRequestURI();
        if (uri == null) {
            return "";
        }
        String contextPath = http.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String value = req.getHeader(headerName);
        return (value == null || value.isBlank()) ? UUID.randomUUID().toString() : value;
    }
}
