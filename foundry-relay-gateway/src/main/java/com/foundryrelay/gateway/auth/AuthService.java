package com.foundryrelay.gateway.auth;

import com.foundryrelay.common.logging.CredentialMask;
import lombok.extern.slf4j.Slf4j;

/**
 * Authentication gate. A credential is accepted when it is an active managed
 * API key or, failing that, a well-formed world identifier.
 */
@Slf4j
public class AuthService implements CredentialValidator {

    private final ApiKeyManager apiKeyManager;

    public AuthService(ApiKeyManager apiKeyManager) {
        this.apiKeyManager = apiKeyManager;
    }

    @Override
    public boolean isValid(String credential) {
        return authorize(credential).ok();
    }

    /**
     * Check a credential and report which scheme accepted it.
     */
    public AuthResult authorize(String credential) {
        if (credential == null || credential.isEmpty()) {
            return AuthResult.failure("credential_missing");
        }
        if (apiKeyManager.validate(credential)) {
            return AuthResult.success("api-key");
        }
        if (WorldIdValidator.isValid(credential)) {
            return AuthResult.success("world-id");
        }
        log.debug("auth:reject credential={}", CredentialMask.mask(credential));
        return AuthResult.failure("credential_invalid");
    }

    /**
     * Result of an authorization attempt.
     */
    public record AuthResult(
            boolean ok,
            /** "api-key" | "world-id" | null */
            String method,
            /** Reason code on failure. */
            String reason) {
        public static AuthResult success(String method) {
            return new AuthResult(true, method, null);
        }

        public static AuthResult failure(String reason) {
            return new AuthResult(false, null, reason);
        }
    }
}
