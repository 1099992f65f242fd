package com.pdftranslator.backend.services.jobs;

public record StoredArtifact(String filename, byte[] bytes) {
}
