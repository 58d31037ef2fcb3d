package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Disposable on-disk copy of each tenant's credentials under {@code <session-dir>/session_<tenant>/creds.json}.
 * The credential store stays authoritative; this cache is purged at startup and shutdown.
 * I/O failures surface as {@link UncheckedIOException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalCredentialCache {

    private static final String CREDS_FILE = "creds.json";

    private final FleetProperties fleetProperties;
    private final ObjectMapper objectMapper;

    public Path directoryFor(TenantId tenant) {
        return root().resolve("session_" + tenant.value());
    }

    public void write(TenantId tenant, JsonNode credentials) {
        Path dir = directoryFor(tenant);
        try {
            Files.createDirectories(dir);
            objectMapper.writeValue(dir.resolve(CREDS_FILE).toFile(), credentials);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write local credentials for tenant " + tenant, e);
        }
    }

    public void purge(TenantId tenant) {
        deleteRecursively(directoryFor(tenant));
    }

    public void purgeAll() {
        deleteRecursively(root());
        log.info("Purged local credential cache at {}", root());
    }

    private Path root() {
        return Paths.get(fleetProperties.getSessionDir());
    }

    private void deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + path, e);
        }
    }
}
