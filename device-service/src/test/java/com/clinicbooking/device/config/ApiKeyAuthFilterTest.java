package com.clinicbooking.device.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeyAuthFilterTest {

    private ApiKeyAuthFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ApiKeyAuthFilter(new ObjectMapper().findAndRegisterModules());
        ReflectionTestUtils.setField(filter, "apiKey", "secret");
        ReflectionTestUtils.setField(filter, "apiExtra", "extra");
    }

    private static MockHttpServletRequest request(String uri) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", uri);
        request.setRequestURI(uri);
        return request;
    }

    @Test
    @DisplayName("matching key and extra pass through")
    void validCredentials_passThrough() throws Exception {
        MockHttpServletRequest request = request("/api/book-device");
        request.addHeader("x-api-key", "secret");
        request.addHeader("x-api-extra", "extra");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("wrong extra header is rejected with 401 and UNAUTHORIZED body")
    void wrongExtra_rejected() throws Exception {
        MockHttpServletRequest request = request("/api/devices");
        request.addHeader("x-api-key", "secret");
        request.addHeader("x-api-extra", "nope");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("\"errorCode\":\"UNAUTHORIZED\"");
    }

    @Test
    @DisplayName("user API paths are not checked")
    void userApi_notFiltered() throws Exception {
        MockHttpServletRequest request = request("/api/v1/device-bookings");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("no configured key disables the check")
    void blankKey_disablesCheck() throws Exception {
        ReflectionTestUtils.setField(filter, "apiKey", "");
        MockHttpServletRequest request = request("/api/book-device");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }
}
