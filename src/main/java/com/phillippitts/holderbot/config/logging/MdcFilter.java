package com.phillippitts.holderbot.config.logging;

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
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts request-scoped keys into the Log4j2 ThreadContext so every line logged while serving
 * a subject carries the request and the subject it concerns.
 *
 * <ul>
 *   <li>{@value #REQUEST_ID}: the caller's X-Request-ID when it is usable, else a fresh UUID.
 *       Echoed back on the response.</li>
 *   <li>{@value #SUBJECT_ID}: the {id} segment of {@code /api/subjects/{id}/...} routes</li>
 *   <li>{@value #SURVEYOR}: X-Surveyor-ID, the person submitting corrections (if present)</li>
 *   <li>method and uri</li>
 * </ul>
 *
 * <p>The decision engine sets {@value #SUBJECT_ID} itself for batch work. The context is
 * cleared when the request ends.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    public static final String REQUEST_ID = "requestId";
    public static final String SUBJECT_ID = "subjectId";
    public static final String SURVEYOR = "surveyor";

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String SURVEYOR_HEADER = "X-Surveyor-ID";

    private static final int MAX_HEADER_VALUE = 64;
    private static final Pattern SAFE_VALUE = Pattern.compile("[A-Za-z0-9._:-]+");
    private static final Pattern SUBJECT_PATH = Pattern.compile("^/api/subjects/([^/]+)(?:/.*)?$");

    // collection routes under /api/subjects that are not subject ids
    private static final Set<String> COLLECTION_ROUTES = Set.of("decisions", "export", "import", "statistics");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = safeHeader(http, REQUEST_ID_HEADER);
                if (requestId == null) {
                    requestId = UUID.randomUUID().toString();
                }
                ThreadContext.put(REQUEST_ID, requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }

                String surveyor = safeHeader(http, SURVEYOR_HEADER);
                if (surveyor != null) {
                    ThreadContext.put(SURVEYOR, surveyor);
                }

                String subjectId = subjectIdOf(http.getRequestURI());
                if (subjectId != null) {
                    ThreadContext.put(SUBJECT_ID, subjectId);
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    /**
     * The subject id addressed by {@code uri}, or null for collection routes and anything
     * outside {@code /api/subjects}.
     */
    static String subjectIdOf(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher m = SUBJECT_PATH.matcher(uri);
        if (!m.matches()) {
            return null;
        }
        String segment = m.group(1).strip();
        if (segment.isEmpty() || COLLECTION_ROUTES.contains(segment) || !SAFE_VALUE.matcher(segment).matches()) {
            return null;
        }
        return segment.length() > MAX_HEADER_VALUE ? segment.substring(0, MAX_HEADER_VALUE) : segment;
    }

    // header values end up verbatim in log lines; anything with line breaks or markup is dropped
    private static String safeHeader(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        if (v == null) {
            return null;
        }
        v = v.strip();
        if (v.isEmpty() || v.length() > MAX_HEADER_VALUE || !SAFE_VALUE.matcher(v).matches()) {
            return null;
        }
        return v;
    }
}
