package com.pdftranslator.backend.services.storage;

import java.util.UUID;

/**
 * Byte storage keyed by job. References are opaque to callers.
 */
public interface ArtifactStorage {

    String put(UUID jobId, String name, byte[] bytes);

    /**
     * @throws com.pdftranslator.backend.exceptions.ResourceNotFoundException when nothing is stored under {@code ref}
     */
    byte[] get(String ref);

    boolean delete(String ref);
}
