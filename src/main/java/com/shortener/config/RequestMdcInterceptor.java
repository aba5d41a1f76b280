package com.shortener.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Puts per-request keys into the SLF4J MDC so every log line of a request carries them.
 */
public class RequestMdcInterceptor implements HandlerInterceptor {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        List<String> keys = new ArrayList<>();
        String requestId = resolveRequestId(request);
        put(keys, "request_id", requestId);
        put(keys, "http_method", request.getMethod());
        put(keys, "http_path", request.getRequestURI());
        put(keys, "client_ip", resolveClientIp(request));
        request.setAttribute(ATTRIBUTE_KEYS, keys);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, @Nullable Exception ex) {
        Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
        if (!(attribute instanceof List<?> rawKeys)) {
            return;
        }
        for (Object rawKey : rawKeys) {
            if (rawKey instanceof String key) {
                MDC.remove(key);
            }
        }
    }

    private String resolveRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId != null && !requestId.isBlank()) {
            return requestId;
        }
        return UUID.randomUUID().toString();
    }

    private String resolveClientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor == null || forwardedFor.isBlank()) {
            return request.getRemoteAddr();
        }
        int commaIndex = forwardedFor.indexOf(',');
        return commaIndex < 0 ? forwardedFor.trim() : forwardedFor.substring(0, commaIndex).trim();
    }

    private void put(List<String> keys, String key, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        MDC.put(key, value);
        keys.add(key);
    }
}
