package com.clinicbooking.device.config;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.common.exception.ErrorCodes;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-key authentication for the API used by room-service.
 * Both {@code x-api-key} and {@code x-api-extra} must match; when no key is configured the check is off.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyAuthFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "x-api-key";
    public static final String API_EXTRA_HEADER = "x-api-extra";

    private final ObjectMapper objectMapper;

    @Value("${device.api.key:}")
    private String apiKey;

    @Value("${device.api.extra:}")
    private String apiExtra;

    @PostConstruct
    public void init() {
        if (!StringUtils.hasText(apiKey)) {
            log.warn("device.api.key is not set: external device API is unauthenticated");
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI();
        return !(path.startsWith("/api/devices") || path.startsWith("/api/book-device"));
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (!StringUtils.hasText(apiKey)
                || (matches(apiKey, request.getHeader(API_KEY_HEADER))
                && matches(apiExtra, request.getHeader(API_EXTRA_HEADER)))) {
            filterChain.doFilter(request, response);
            return;
        }
        log.warn("Rejected {} {} from {}: bad API credentials",
                request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(),
                BaseResponse.error("invalid API credentials", ErrorCodes.UNAUTHORIZED));
    }

    private static boolean matches(String expected, String actual) {
        String expectedValue = expected == null ? "" : expected;
        String actualValue = actual == null ? "" : actual;
        return MessageDigest.isEqual(
                expectedValue.getBytes(StandardCharsets.UTF_8),
                actualValue.getBytes(StandardCharsets.UTF_8));
    }
}
