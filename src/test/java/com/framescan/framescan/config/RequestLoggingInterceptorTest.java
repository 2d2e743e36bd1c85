package com.framescan.framescan.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.servlet.HandlerMapping;

class RequestLoggingInterceptorTest {

    @Test
    void sessionIdComesFromTheMatchedRoute() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/get-video/abc-123");
        request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("sessionId", "abc-123"));

        assertEquals("abc-123", RequestLoggingInterceptor.sessionIdOf(request));
    }

    @Test
    void routesWithoutASessionLogADash() {
        MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/cleanup");

        assertEquals("-", RequestLoggingInterceptor.sessionIdOf(request));

        request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of());
        assertEquals("-", RequestLoggingInterceptor.sessionIdOf(request));
    }

    @Test
    void neverBlocksTheRequest() throws Exception {
        RequestLoggingInterceptor interceptor = new RequestLoggingInterceptor();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertTrue(interceptor.preHandle(request, response, new Object()));

        ReflectionTestUtils.setField(interceptor, "enabled", true);
        assertTrue(interceptor.preHandle(request, response, new Object()));
        assertDoesNotThrow(() -> interceptor.afterCompletion(request, response, new Object(), null));
    }
}
