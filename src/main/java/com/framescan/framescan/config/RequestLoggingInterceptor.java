package com.framescan.framescan.config;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Logs each HTTP request against the session it targets, if any.
 */
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingInterceptor.class);
    private static final String START_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".start";

    @Value("${logging.request.enabled:false}")
    private boolean enabled;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!enabled) {
            return true;
        }
        request.setAttribute(START_ATTRIBUTE, System.nanoTime());
        String handlerInfo = (handler instanceof HandlerMethod) ? ((HandlerMethod) handler).getShortLogMessage() : String.valueOf(handler);
        logger.info("{} {} session={} handler={} remoteAddr={}", request.getMethod(), request.getRequestURI(),
                sessionIdOf(request), handlerInfo, request.getRemoteAddr());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        if (!enabled) {
            return;
        }
        Object start = request.getAttribute(START_ATTRIBUTE);
        long tookMillis = start instanceof Long ? (System.nanoTime() - (Long) start) / 1_000_000 : -1;
        logger.info("{} {} session={} status={} took={}ms", request.getMethod(), request.getRequestURI(),
                sessionIdOf(request), response.getStatus(), tookMillis);
    }

    /**
     * The {@code sessionId} path variable of the matched route, or "-" for routes without one.
     */
    @SuppressWarnings("unchecked")
    static String sessionIdOf(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map) {
            String id = ((Map<String, String>) variables).get("sessionId");
            if (id != null) {
                return id;
            }
        }
        return "-";
    }
}
