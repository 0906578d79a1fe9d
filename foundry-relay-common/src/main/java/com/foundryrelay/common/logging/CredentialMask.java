package com.foundryrelay.common.logging;

/**
 * Masks credentials before they reach log output or API listings.
 */
public final class CredentialMask {

    private CredentialMask() {
    }

    private static final int KEEP_LONG = 12;
    private static final int KEEP_SHORT = 4;
    private static final String ELLIPSIS = "...";

    /**
     * Keep the first 12 characters of a credential, or the first 4 when the
     * credential is 12 characters or shorter, followed by {@code ...}.
     */
    public static String mask(String credential) {
        if (credential == null || credential.isEmpty()) {
            return "<none>";
        }
        if (credential.length() <= KEEP_LONG) {
            return credential.substring(0, Math.min(KEEP_SHORT, credential.length())) + ELLIPSIS;
        }
        return credential.substring(0, KEEP_LONG) + ELLIPSIS;
    }
}
