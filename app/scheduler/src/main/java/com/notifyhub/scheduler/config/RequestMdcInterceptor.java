package com.notifyhub.scheduler.config;

import com.notifyhub.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";

  private static final String KEY_REQUEST_ID = "request_id";
  private static final String KEY_HTTP_METHOD = "http_method";
  private static final String KEY_HTTP_PATH = "http_path";
  private static final String KEY_CLIENT_IP = "client_ip";
  private static final String KEY_USER_ID = "user_id";
  private static final String KEY_NOTIFICATION_ID = "notification_id";
  private static final List<String> KEYS =
      List.of(
          KEY_REQUEST_ID,
          KEY_HTTP_METHOD,
          KEY_HTTP_PATH,
          KEY_CLIENT_IP,
          KEY_USER_ID,
          KEY_NOTIFICATION_ID);

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = resolveRequestId(request);
    put(KEY_REQUEST_ID, requestId);
    put(KEY_HTTP_METHOD, request.getMethod());
    put(KEY_HTTP_PATH, request.getRequestURI());
    put(KEY_CLIENT_IP, request.getRemoteAddr());
    final Map<String, String> pathVariables = pathVariables(request);
    put(KEY_USER_ID, pathVariables.get("userId"));
    put(KEY_NOTIFICATION_ID, pathVariables.get("notificationId"));
    response.setHeader(REQUEST_ID_HEADER, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    KEYS.forEach(MDC::remove);
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return TraceIds.newTraceId();
  }

  @SuppressWarnings("unchecked")
  private Map<String, String> pathVariables(HttpServletRequest request) {
    final Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (attribute instanceof Map<?, ?> variables) {
      return (Map<String, String>) variables;
    }
    return Map.of();
  }

  private void put(String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
  }
}
