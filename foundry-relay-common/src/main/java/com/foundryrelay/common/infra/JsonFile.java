package com.foundryrelay.common.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * JSON file load/save with owner-only file permissions.
 */
@Slf4j
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    /**
     * Read and bind a JSON file.
     *
     * @return the parsed value, or null if the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static <T> T read(Path path, TypeReference<T> type) throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        return MAPPER.readValue(Files.readString(path), type);
    }

    /**
     * Write data as JSON. The content goes to a sibling temp file first and is
     * then moved over the target, so readers never see a half-written file.
     */
    public static void write(Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, MAPPER.writeValueAsString(data) + "\n");
        restrictPermissions(tmp);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static void restrictPermissions(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", path);
        }
    }
}
