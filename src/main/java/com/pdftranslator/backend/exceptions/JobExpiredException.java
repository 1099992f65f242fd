package com.pdftranslator.backend.exceptions;

import java.util.UUID;

public class JobExpiredException extends RuntimeException {

    public JobExpiredException(UUID jobId) {
        super("Job artifact has expired: " + jobId);
    }
}
