package com.dragonfly.jobs.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void putsRequestContextAndRemovesItAfterCompletion() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/import-runs/claim");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Trace-Id", "trace-1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();
    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("trace_id")).isEqualTo("trace-1");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/import-runs/claim");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("trace_id")).isNull();
    assertThat(MDC.get("http_method")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderIsMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ops/queues");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("trace_id")).isNull();
  }
}
