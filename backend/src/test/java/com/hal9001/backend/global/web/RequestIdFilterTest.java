package com.hal9001.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void reusesWellFormedCallerId() {
        assertThat(RequestIdFilter.resolveRequestId("  req-2001.a:b_c ")).isEqualTo("req-2001.a:b_c");
    }

    @Test
    void replacesIdsThatCouldForgeLogLines() {
        assertThat(RequestIdFilter.resolveRequestId("abc\nINFO forged")).matches("[0-9a-f-]{36}");
        assertThat(RequestIdFilter.resolveRequestId("x".repeat(129))).matches("[0-9a-f-]{36}");
        assertThat(RequestIdFilter.resolveRequestId("")).matches("[0-9a-f-]{36}");
        assertThat(RequestIdFilter.resolveRequestId(null)).matches("[0-9a-f-]{36}");
    }

    @Test
    void exposesIdInMdcOnlyWhileRequestRuns() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "req-3001");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            }
        });

        assertThat(seen.get()).isEqualTo("req-3001");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("req-3001");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }
}
