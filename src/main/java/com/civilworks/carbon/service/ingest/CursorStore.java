package com.civilworks.carbon.service.ingest;

import com.civilworks.carbon.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Single-token store for the pagination resume point.
 *
 * <p>The token is opaque (in practice the catalog's "next" URL). A missing or blank file means
 * there is nothing to resume. Deleting the file is how an operator forces a fresh run.
 */
@Component
public class CursorStore {
    private static final Logger log = LoggerFactory.getLogger(CursorStore.class);

    private final Path path;

    public CursorStore(AppProperties appProperties) {
        String dir = appProperties.getDataDir();
        if (dir == null || dir.isBlank()) dir = "data";
        this.path = Path.of(dir).resolve(appProperties.getFiles().getCursor());
    }

    public Optional<String> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            String token = Files.readString(path, StandardCharsets.UTF_8).trim();
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cursor " + path, e);
        }
    }

    public void save(String token) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(path, token, StandardCharsets.UTF_8);
            log.debug("Cursor advanced: {}", token);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist cursor " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }
}
