package com.pdftranslator.backend.exceptions;

import java.util.UUID;

public class JobCancelledException extends RuntimeException {

    public JobCancelledException(UUID jobId) {
        super("Job cancelled: " + jobId);
    }
}
