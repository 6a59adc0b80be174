/*
 * どこで: Email 配信の Web 設定
 * 何を: API リクエストごとに request_id/correlation_id/HTTP 情報を MDC へ積み、完了時に外す
 * なぜ: 受付ログと配信ログを同じキーで突き合わせるため
 */
package com.example.email.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  public static final String HEADER_REQUEST_ID = "X-Request-Id";
  public static final String HEADER_CORRELATION_ID = "X-Correlation-Id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String httpRequestId = resolveHttpRequestId(request);
    put(keys, "request_id", httpRequestId);
    put(keys, "correlation_id", firstNonBlank(request.getHeader(HEADER_CORRELATION_ID), httpRequestId));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    response.setHeader(HEADER_REQUEST_ID, httpRequestId);
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  private String resolveHttpRequestId(HttpServletRequest request) {
    return firstNonBlank(request.getHeader(HEADER_REQUEST_ID), UUID.randomUUID().toString());
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    // 先頭がクライアント、以降はプロキシ
    final int commaIndex = forwarded.indexOf(',');
    return commaIndex < 0 ? forwarded.trim() : forwarded.substring(0, commaIndex).trim();
  }

  private String firstNonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
