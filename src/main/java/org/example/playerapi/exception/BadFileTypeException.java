package org.example.playerapi.exception;

/**
 * The uploaded file is not a CSV document.
 */
public class BadFileTypeException extends RuntimeException {

    public BadFileTypeException() {
        super("Only CSV files are allowed");
    }
}
