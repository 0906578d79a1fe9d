package com.foundryrelay.gateway.auth;

import java.util.regex.Pattern;

/**
 * Format-only check for game world identifiers, which are accepted as
 * credentials for worlds that have no managed key.
 */
public final class WorldIdValidator {

    private WorldIdValidator() {
    }

    public static final int MIN_LENGTH = 8;

    private static final Pattern WORLD_ID = Pattern.compile("^[a-zA-Z0-9_-]{" + MIN_LENGTH + ",}$");

    public static boolean isValid(String worldId) {
        if (worldId == null || worldId.length() < MIN_LENGTH) {
            return false;
        }
        return WORLD_ID.matcher(worldId).matches();
    }
}
