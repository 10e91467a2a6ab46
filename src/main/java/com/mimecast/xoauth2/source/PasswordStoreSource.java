package com.mimecast.xoauth2.source;

import com.mimecast.xoauth2.store.SecretEntry;
import com.mimecast.xoauth2.store.SecretStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Credential source backed by a secret store.
 *
 * <p>Reads four fixed fields off the matching entry:
 * <ul>
 *     <li>{@value #TOKEN_URL_FIELD}</li>
 *     <li>{@value #CLIENT_ID_FIELD}</li>
 *     <li>{@value #CLIENT_SECRET_FIELD}</li>
 *     <li>{@value #REFRESH_TOKEN_FIELD}</li>
 * </ul>
 * <p>All four are required. Each missing one is logged and the entry does not match.
 */
public class PasswordStoreSource implements CredentialSource {
    private static final Logger log = LogManager.getLogger(PasswordStoreSource.class);

    public static final String TOKEN_URL_FIELD = "xoauth2_token_url";
    public static final String CLIENT_ID_FIELD = "xoauth2_client_id";
    public static final String CLIENT_SECRET_FIELD = "xoauth2_client_secret";
    public static final String REFRESH_TOKEN_FIELD = "xoauth2_refresh_token";

    private final SecretStore store;

    /**
     * Constructs a new PasswordStoreSource instance.
     *
     * @param store SecretStore instance.
     */
    public PasswordStoreSource(SecretStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public Optional<OAuth2ClientParams> fetch(String host, String user, String port) throws CredentialsConfigException {
        Optional<SecretEntry> found;
        try {
            found = store.find(host, user, port);
        } catch (IOException e) {
            throw new CredentialsConfigException("Secret store lookup failed for " + host + ":" + port + ": " + e.getMessage(), e);
        }

        if (found.isEmpty()) {
            return Optional.empty();
        }

        SecretEntry entry = found.get();
        String tokenUrl = field(entry, TOKEN_URL_FIELD);
        String clientId = field(entry, CLIENT_ID_FIELD);
        String clientSecret = field(entry, CLIENT_SECRET_FIELD);
        String refreshToken = field(entry, REFRESH_TOKEN_FIELD);

        if (tokenUrl == null || clientId == null || clientSecret == null || refreshToken == null) {
            return Optional.empty();
        }

        return Optional.of(new OAuth2ClientParams(tokenUrl, clientId, clientSecret, refreshToken, null));
    }

    private String field(SecretEntry entry, String name) {
        Optional<String> value = entry.getField(name);
        if (value.isEmpty()) {
            log.warn("Secret store entry {} is missing field: {}", entry.getName(), name);
            return null;
        }
        return value.get();
    }
}
