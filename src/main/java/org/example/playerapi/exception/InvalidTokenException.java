package org.example.playerapi.exception;

/**
 * A bearer token that failed verification: bad signature, malformed, or expired.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
