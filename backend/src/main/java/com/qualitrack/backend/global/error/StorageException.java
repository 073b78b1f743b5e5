package com.qualitrack.backend.global.error;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Storage collaborator failure. Retryable when the underlying fault is transient or a lost race.
 */
public class StorageException extends AccessProblemException {

    public static final String STORAGE_FAILURE = "storage.failure";

    private final boolean retryable;

    public StorageException(String detail, DataAccessException cause) {
        super(STORAGE_FAILURE, detail, cause);
        this.retryable = cause instanceof TransientDataAccessException
                || cause instanceof ConcurrencyFailureException
                || cause instanceof DataIntegrityViolationException;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
