package com.mimecast.xoauth2;

/**
 * Base exception for XOAUTH2 credential resolution failures.
 *
 * <p>A lookup that simply finds nothing is never reported through this hierarchy.
 * <br>Only configuration, token exchange and protocol authentication failures are.
 */
public class AuthSourceException extends Exception {

    /**
     * Constructs a new AuthSourceException.
     *
     * @param message Error message.
     */
    public AuthSourceException(String message) {
        super(message);
    }

    /**
     * Constructs a new AuthSourceException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public AuthSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
