package com.mimecast.xoauth2.source;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Static OAuth2 client parameters for one identity.
 *
 * <p>All four of token URL, client id, client secret and refresh token must be non-empty
 * <br>for the record to be usable. The user override is optional.
 *
 * <p>{@link #toString()} never renders the client secret or the refresh token.
 *
 * @param tokenUrl     Token endpoint URL.
 * @param clientId     OAuth2 client id.
 * @param clientSecret OAuth2 client secret.
 * @param refreshToken Long lived refresh token.
 * @param userOverride User to authenticate as when the query names none, may be null.
 */
public record OAuth2ClientParams(
        String tokenUrl,
        String clientId,
        String clientSecret,
        String refreshToken,
        String userOverride
) {
    public static final String TOKEN_URL = "token_url";
    public static final String CLIENT_ID = "client_id";
    public static final String CLIENT_SECRET = "client_secret";
    public static final String REFRESH_TOKEN = "refresh_token";
    public static final String USER = "user";

    /**
     * Names of required fields that are null or empty.
     *
     * @return List of field names, empty when complete.
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (StringUtils.isEmpty(tokenUrl)) missing.add(TOKEN_URL);
        if (StringUtils.isEmpty(clientId)) missing.add(CLIENT_ID);
        if (StringUtils.isEmpty(clientSecret)) missing.add(CLIENT_SECRET);
        if (StringUtils.isEmpty(refreshToken)) missing.add(REFRESH_TOKEN);
        return missing;
    }

    /**
     * Checks all required fields are present.
     *
     * @return Boolean.
     */
    public boolean isComplete() {
        return missingFields().isEmpty();
    }

    @Override
    public String toString() {
        return "OAuth2ClientParams{tokenUrl=" + tokenUrl +
                ", clientId=" + clientId +
                ", clientSecret=" + (StringUtils.isEmpty(clientSecret) ? "" : "***") +
                ", refreshToken=" + (StringUtils.isEmpty(refreshToken) ? "" : "***") +
                ", userOverride=" + userOverride + "}";
    }
}
