package com.pdftranslator.backend.exceptions;

import java.util.UUID;

public class JobAlreadyRunningException extends ConflictException {

    public JobAlreadyRunningException(UUID jobId) {
        super("Job is already running: " + jobId);
    }
}
