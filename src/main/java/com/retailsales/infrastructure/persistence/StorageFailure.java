package com.retailsales.infrastructure.persistence;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;

import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Kind of a failed storage operation, derived from the exception type.
 */
public enum StorageFailure {
    TIMEOUT,
    CONNECTIVITY,
    FATAL;

    public static StorageFailure classify(Throwable error) {
        for (Throwable t = unwrap(error); t != null; t = t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof QueryTimeoutException
                    || t instanceof jakarta.persistence.QueryTimeoutException
                    || t instanceof SQLTimeoutException) {
                return TIMEOUT;
            }
            if (t instanceof DataAccessResourceFailureException
                    || t instanceof TransientDataAccessResourceException
                    || t instanceof SQLTransientConnectionException
                    || t instanceof SQLNonTransientConnectionException) {
                return CONNECTIVITY;
            }
        }
        return FATAL;
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
