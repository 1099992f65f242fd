package com.pdftranslator.backend.services.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.exceptions.ResourceNotFoundException;

class FileSystemArtifactStorageTest {

    @TempDir
    Path baseDir;

    private FileSystemArtifactStorage storage;

    @BeforeEach
    void setUp() {
        TranslatorProperties properties = new TranslatorProperties();
        properties.getStorage().setBaseDir(baseDir.toString());
        storage = new FileSystemArtifactStorage(properties);
    }

    @Test
    void put_thenGet_returnsBytesUnderJobDirectory() {
        UUID jobId = UUID.randomUUID();

        String ref = storage.put(jobId, "input.pdf", new byte[]{1, 2, 3});

        assertThat(ref).isEqualTo(jobId + "/input.pdf");
        assertThat(storage.get(ref)).containsExactly(1, 2, 3);
        assertThat(Files.isRegularFile(baseDir.resolve(jobId.toString()).resolve("input.pdf"))).isTrue();
    }

    @Test
    void delete_lastFile_removesJobDirectory() {
        UUID jobId = UUID.randomUUID();
        String input = storage.put(jobId, "input.pdf", new byte[]{1});
        String artifact = storage.put(jobId, "translated.pdf", new byte[]{2});

        assertThat(storage.delete(input)).isTrue();
        assertThat(Files.isDirectory(baseDir.resolve(jobId.toString()))).isTrue();

        assertThat(storage.delete(artifact)).isTrue();
        assertThat(Files.exists(baseDir.resolve(jobId.toString()))).isFalse();
        assertThat(storage.delete(artifact)).isFalse();
        assertThat(storage.delete(null)).isFalse();
    }

    @Test
    void get_missingOrEscapingRef_isRejected() {
        assertThatThrownBy(() -> storage.get(UUID.randomUUID() + "/input.pdf"))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> storage.get("../outside.pdf"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
