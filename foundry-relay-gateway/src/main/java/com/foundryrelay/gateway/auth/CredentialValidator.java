package com.foundryrelay.gateway.auth;

/**
 * Decides whether an opaque credential may use the relay. Consulted both when
 * a peer socket is admitted and when an HTTP caller presents an API key.
 */
@FunctionalInterface
public interface CredentialValidator {

    boolean isValid(String credential);
}
