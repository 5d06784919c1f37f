package com.retailsales.infrastructure.persistence;

import lombok.Getter;

/**
 * Storage operation failure with its classified kind.
 */
@Getter
public class StorageAccessException extends RuntimeException {

    private final StorageFailure failure;
    private final String operation;

    public StorageAccessException(StorageFailure failure, String operation, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.operation = operation;
    }

    public static StorageAccessException of(String operation, Throwable cause) {
        Throwable root = StorageFailure.unwrap(cause);
        StorageFailure failure = StorageFailure.classify(root);
        return new StorageAccessException(failure, operation,
                "Storage operation '" + operation + "' failed (" + failure + "): " + root.getMessage(), root);
    }

    public boolean isTimeout() {
        return failure == StorageFailure.TIMEOUT;
    }
}
