package com.retailsales.domain.ingest;

/**
 * The CSV input as a whole could not be read. Nothing from it was written.
 */
public class CsvImportException extends RuntimeException {

    public CsvImportException(String message) {
        super(message);
    }

    public CsvImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
