package com.shopnest.authservice.utils;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void plainIdIsKept() throws Exception {
        MockHttpServletResponse resp = run(" order-42_retry.1 ");

        assertThat(resp.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("order-42_retry.1");
    }

    @Test
    void idWithLineBreakIsReplaced() throws Exception {
        MockHttpServletResponse resp = run("abc\nINFO forged log line");

        assertThat(resp.getHeader(RequestIdFilter.REQUEST_ID_HEADER))
                .doesNotContain("forged")
                .matches("[0-9a-f-]{36}");
    }

    @Test
    void idWithSpacesOrSymbolsIsReplaced() throws Exception {
        assertThat(run("a b").getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isNotEqualTo("a b");
        assertThat(run("id;drop").getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isNotEqualTo("id;drop");
    }

    @Test
    void overlongIdIsReplaced() throws Exception {
        String longId = "a".repeat(129);

        assertThat(run(longId).getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isNotEqualTo(longId);
    }

    @Test
    void missingIdIsGeneratedAndStoredOnRequest() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/users/profile");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        filter.doFilter(req, resp, new MockFilterChain());

        assertThat(resp.getHeader(RequestIdFilter.REQUEST_ID_HEADER))
                .isNotBlank()
                .isEqualTo(req.getAttribute(RequestIdFilter.REQUEST_ID_ATTR));
    }

    private MockHttpServletResponse run(String header) throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/users/profile");
        req.addHeader(RequestIdFilter.REQUEST_ID_HEADER, header);
        MockHttpServletResponse resp = new MockHttpServletResponse();
        filter.doFilter(req, resp, new MockFilterChain());
        return resp;
    }
}
