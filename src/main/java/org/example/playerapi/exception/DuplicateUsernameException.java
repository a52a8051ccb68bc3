package org.example.playerapi.exception;

/**
 * Raised by signup when the username is taken.
 */
public class DuplicateUsernameException extends RuntimeException {

    public DuplicateUsernameException() {
        super("Username already registered");
    }
}
