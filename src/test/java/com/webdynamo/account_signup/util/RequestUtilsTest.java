package com.webdynamo.account_signup.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RequestUtilsTest {

    @Test
    @DisplayName("Should prefer the first X-Forwarded-For hop")
    void getClientIP_ForwardedFor() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " 203.0.113.7 , 10.0.0.1");
        request.addHeader("X-Real-IP", "198.51.100.2");

        assertEquals("203.0.113.7", RequestUtils.getClientIP(request));
    }

    @Test
    @DisplayName("Should fall back to X-Real-IP, then the remote address")
    void getClientIP_Fallbacks() {
        MockHttpServletRequest proxied = new MockHttpServletRequest();
        proxied.addHeader("X-Forwarded-For", " ");
        proxied.addHeader("X-Real-IP", "198.51.100.2");
        MockHttpServletRequest direct = new MockHttpServletRequest();
        direct.setRemoteAddr("192.0.2.10");

        assertEquals("198.51.100.2", RequestUtils.getClientIP(proxied));
        assertEquals("192.0.2.10", RequestUtils.getClientIP(direct));
    }

    @Test
    @DisplayName("Should describe a request as method and path")
    void describe_MethodAndPath() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/signup");

        assertEquals("POST /signup", RequestUtils.describe(request));
    }
}
