package com.mimecast.xoauth2.token;

import com.mimecast.xoauth2.AuthSourceException;

/**
 * Thrown when the refresh token exchange fails.
 *
 * <p>Either the transport failed or the endpoint answered with something that is not
 * <br>JSON or carries no {@code access_token}.
 */
public class TokenExchangeException extends AuthSourceException {

    /**
     * Token endpoint URL.
     */
    private final String tokenUrl;

    /**
     * Constructs a new TokenExchangeException.
     *
     * @param tokenUrl Token endpoint URL.
     * @param message  Error message.
     */
    public TokenExchangeException(String tokenUrl, String message) {
        super(message + " [" + tokenUrl + "]");
        this.tokenUrl = tokenUrl;
    }

    /**
     * Constructs a new TokenExchangeException with cause.
     *
     * @param tokenUrl Token endpoint URL.
     * @param message  Error message.
     * @param cause    Underlying cause.
     */
    public TokenExchangeException(String tokenUrl, String message, Throwable cause) {
        super(message + " [" + tokenUrl + "]", cause);
        this.tokenUrl = tokenUrl;
    }

    /**
     * Gets the token endpoint URL.
     *
     * @return URL string.
     */
    public String getTokenUrl() {
        return tokenUrl;
    }
}
