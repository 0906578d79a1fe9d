package com.foundryrelay.app.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foundryrelay.common.logging.CredentialMask;
import com.foundryrelay.gateway.auth.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * Requires a valid {@code x-api-key} header on REST calls.
 */
@Slf4j
@Component
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String API_KEY_HEADER = "x-api-key";

    private final AuthService authService;
    private final ObjectMapper objectMapper;

    public ApiKeyInterceptor(AuthService authService, ObjectMapper objectMapper) {
        this.authService = authService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
            @NonNull Object handler) throws IOException {
        log.debug("http:in {} {}", request.getMethod(), request.getRequestURI());

        String apiKey = request.getHeader(API_KEY_HEADER);
        if (apiKey == null || apiKey.isEmpty()) {
            reject(response, new ApiErrorResponse("API key required",
                    "Include x-api-key header with your request"));
            return false;
        }
        if (!authService.isValid(apiKey)) {
            log.warn("http:reject path={} key={}", request.getRequestURI(), CredentialMask.mask(apiKey));
            reject(response, new ApiErrorResponse("Invalid API key",
                    "The provided API key is not valid or has been revoked"));
            return false;
        }
        return true;
    }

    private void reject(HttpServletResponse response, ApiErrorResponse body) throws IOException {
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
