package com.phillippitts.holderbot.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void setsRequestValuesDuringChain() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-xyz");
        when(request.getHeader("X-Surveyor-ID")).thenReturn("surveyor-7");
        when(request.getMethod()).thenReturn("PUT");
        when(request.getRequestURI()).thenReturn("/api/subjects/42/correction");

        doAnswer(invocation -> {
            Map<String, String> ctx = ThreadContext.getContext();
            assertThat(ctx).containsEntry(MdcFilter.REQUEST_ID, "req-xyz");
            assertThat(ctx).containsEntry(MdcFilter.SURVEYOR, "surveyor-7");
            assertThat(ctx).containsEntry(MdcFilter.SUBJECT_ID, "42");
            assertThat(ctx).containsEntry("method", "PUT");
            assertThat(ctx).containsEntry("uri", "/api/subjects/42/correction");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
        verify(response).setHeader("X-Request-ID", "req-xyz");
    }

    @Test
    void generatesUuidIfRequestIdHeaderMissingOrBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn(null, "   ");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/subjects/1/decision");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get(MdcFilter.REQUEST_ID)).matches(UUID_PATTERN);
            assertThat(ThreadContext.get(MdcFilter.SURVEYOR)).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
        filter.doFilter(request, response, chain);
    }

    @Test
    void replacesUnsafeRequestIdAndSurveyor() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("abc\r\nFAKE log line");
        when(request.getHeader("X-Surveyor-ID")).thenReturn("x".repeat(65));
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/subjects/7");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get(MdcFilter.REQUEST_ID)).matches(UUID_PATTERN);
            assertThat(ThreadContext.get(MdcFilter.SURVEYOR)).isNull();
            assertThat(ThreadContext.get(MdcFilter.SUBJECT_ID)).isEqualTo("7");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void subjectIdComesOnlyFromSubjectRoutes() {
        assertThat(MdcFilter.subjectIdOf("/api/subjects/42")).isEqualTo("42");
        assertThat(MdcFilter.subjectIdOf("/api/subjects/42/learned")).isEqualTo("42");
        assertThat(MdcFilter.subjectIdOf("/api/subjects/statistics")).isNull();
        assertThat(MdcFilter.subjectIdOf("/api/subjects/decisions/stop")).isNull();
        assertThat(MdcFilter.subjectIdOf("/api/subjects/import")).isNull();
        assertThat(MdcFilter.subjectIdOf("/api/calibration/bins")).isNull();
        assertThat(MdcFilter.subjectIdOf("/api/subjects/")).isNull();
        assertThat(MdcFilter.subjectIdOf(null)).isNull();
    }

    @Test
    void clearsContextAfterRequest() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/subjects/statistics");
        doAnswer(invocation -> {
            // engine-added values are cleared too
            ThreadContext.put(MdcFilter.SUBJECT_ID, "42");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/subjects/import");
        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get(MdcFilter.REQUEST_ID)).isNull();
    }

    @Test
    void handlesNonHttpServletRequest() throws ServletException, IOException {
        ServletRequest nonHttpRequest = mock(ServletRequest.class);

        filter.doFilter(nonHttpRequest, response, chain);

        verify(chain).doFilter(nonHttpRequest, response);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
