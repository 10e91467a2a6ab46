package com.mimecast.xoauth2.source;

import com.mimecast.xoauth2.AuthSourceException;

/**
 * Thrown when a credential source is misconfigured.
 *
 * <p>Covers malformed or undecryptable credentials files, wrong file extensions,
 * <br>records missing a required field and secret store failures.
 */
public class CredentialsConfigException extends AuthSourceException {

    /**
     * Constructs a new CredentialsConfigException.
     *
     * @param message Error message.
     */
    public CredentialsConfigException(String message) {
        super(message);
    }

    /**
     * Constructs a new CredentialsConfigException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public CredentialsConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
