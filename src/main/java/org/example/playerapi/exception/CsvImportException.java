package org.example.playerapi.exception;

/**
 * Aborts a CSV import. Rows inserted before the failure stay committed.
 */
public class CsvImportException extends RuntimeException {

    public CsvImportException(String message) {
        super(message);
    }
}
