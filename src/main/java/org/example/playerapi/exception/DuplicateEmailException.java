package org.example.playerapi.exception;

/**
 * Raised by signup when the email is taken.
 */
public class DuplicateEmailException extends RuntimeException {

    public DuplicateEmailException() {
        super("Email already registered");
    }
}
