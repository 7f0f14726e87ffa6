package com.flamingo.ai.redline.api.filter;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

  private final RequestIdFilter filter = new RequestIdFilter();

  @Test
  void shouldEchoSafeRequestId_andExposeItToLogs() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/read");
    request.addHeader(RequestIdFilter.HEADER, "req-42.a:b");
    MockHttpServletResponse response = new MockHttpServletResponse();
    AtomicReference<String> seenInMdc = new AtomicReference<>();

    filter.doFilter(
        request,
        response,
        new MockFilterChain(
            new HttpServlet() {
              @Override
              protected void service(
                  HttpServletRequest req,
                  HttpServletResponse res) {
                seenInMdc.set(MDC.get(RequestIdFilter.MDC_KEY));
              }
            }));

    assertThat(response.getHeader(RequestIdFilter.HEADER)).isEqualTo("req-42.a:b");
    assertThat(seenInMdc.get()).isEqualTo("req-42.a:b");
    assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isNull();
  }

  @Test
  void shouldGenerateId_whenNoneSupplied() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(
        new MockHttpServletRequest("GET", "/health"), response, new MockFilterChain());

    assertThat(response.getHeader(RequestIdFilter.HEADER))
        .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
  }

  @Test
  void shouldReplaceUnsafeId() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
    request.addHeader(RequestIdFilter.HEADER, "bad id\r\ninjected: yes");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, new MockFilterChain());

    assertThat(response.getHeader(RequestIdFilter.HEADER)).doesNotContain("injected");
  }
}
