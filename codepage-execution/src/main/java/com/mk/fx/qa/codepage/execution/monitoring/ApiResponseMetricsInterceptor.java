package com.mk.fx.qa.codepage.execution.monitoring;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/** Records an API response metric set for every request served under {@code /api}. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiResponseMetricsInterceptor implements HandlerInterceptor {

  private static final String STARTED_AT = ApiResponseMetricsInterceptor.class.getName() + ".start";

  private final MetricsService metrics;

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    request.setAttribute(STARTED_AT, System.nanoTime());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
    if (!(request.getAttribute(STARTED_AT) instanceof Long started)) {
      return;
    }
    var elapsedMs = (System.nanoTime() - started) / 1_000_000;
    try {
      metrics.recordApiResponse(
          request.getRequestURI(),
          request.getMethod(),
          response.getStatus(),
          elapsedMs,
          Math.max(request.getContentLengthLong(), 0),
          responseSize(response));
    } catch (RuntimeException e) {
      log.error("Failed to record API metrics for {} {}", request.getMethod(), request.getRequestURI(), e);
    }
  }

  private static long responseSize(HttpServletResponse response) {
    var header = response.getHeader("Content-Length");
    if (header == null) {
      return 0;
    }
    try {
      return Long.parseLong(header);
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
