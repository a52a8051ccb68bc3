package org.example.playerapi.exception;

/**
 * A presented token could not be resolved to an active user.
 * The message is for logs only; clients always see the same generic detail.
 */
public class UnauthorizedException extends RuntimeException {

    public static final String DETAIL = "Could not validate credentials";

    public UnauthorizedException(String reason) {
        super(reason);
    }

    public UnauthorizedException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
