package com.pdftranslator.backend.services.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.exceptions.ResourceNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * Stores files under {@code translator.storage.base-dir}/{jobId}/{name}. The reference is the
 * path relative to the base directory.
 */
@Component
@Slf4j
public class FileSystemArtifactStorage implements ArtifactStorage {

    private final Path baseDir;

    public FileSystemArtifactStorage(TranslatorProperties properties) {
        this.baseDir = Path.of(properties.getStorage().getBaseDir()).toAbsolutePath().normalize();
    }

    @Override
    public String put(UUID jobId, String name, byte[] bytes) {
        Path dir = baseDir.resolve(jobId.toString());
        Path target = dir.resolve(name);
        try {
            Files.createDirectories(dir);
            // Write then move so readers never see a half-written file.
            Path tmp = Files.createTempFile(dir, name, ".tmp");
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store " + name + " for job " + jobId, e);
        }
        log.debug("[Storage] Stored jobId={} name={} bytes={}", jobId, name, bytes.length);
        return jobId + "/" + name;
    }

    @Override
    public byte[] get(String ref) {
        Path path = resolve(ref);
        if (!Files.isRegularFile(path)) {
            throw new ResourceNotFoundException("Stored file not found: " + ref);
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + ref, e);
        }
    }

    @Override
    public boolean delete(String ref) {
        if (ref == null || ref.isBlank()) return false;
        Path path = resolve(ref);
        try {
            boolean deleted = Files.deleteIfExists(path);
            Path parent = path.getParent();
            if (parent != null && !parent.equals(baseDir) && Files.isDirectory(parent)) {
                try (var entries = Files.list(parent)) {
                    if (entries.findAny().isEmpty()) {
                        Files.deleteIfExists(parent);
                    }
                }
            }
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + ref, e);
        }
    }

    private Path resolve(String ref) {
        Path path = baseDir.resolve(ref).normalize();
        if (!path.startsWith(baseDir)) {
            throw new IllegalArgumentException("Reference outside storage: " + ref);
        }
        return path;
    }
}
