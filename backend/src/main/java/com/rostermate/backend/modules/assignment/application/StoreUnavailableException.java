package com.rostermate.backend.modules.assignment.application;

import com.rostermate.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * Transient storage failure (lock or statement timeout, lost connection). The whole operation may be retried.
 */
public class StoreUnavailableException extends RetryableProblemException {

    private static final int RETRY_AFTER_SECONDS = 1;

    public StoreUnavailableException(String detail, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", detail, RETRY_AFTER_SECONDS, cause);
    }
}
