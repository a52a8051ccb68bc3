package org.example.playerapi.exception;

/**
 * Unknown username or wrong password at login.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Incorrect username or password");
    }
}
