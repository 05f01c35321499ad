package com.tickq.internal;

import com.tickq.JobExceptionHandler;
import com.tickq.JobKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

public class LoggingJobExceptionHandler implements JobExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingJobExceptionHandler.class);

    @Override
    public void handleException(Throwable error, UUID jobId, JobKind kind) {
        log.error("{} job {} failed permanently", kind, jobId, error);
    }

    @Override
    public void handleCancelledException(Throwable error, UUID jobId, JobKind kind) {
        log.info("{} job {} was cancelled: {}", kind, jobId, error.getMessage());
    }
}
