package com.mimecast.xoauth2.source;

import java.util.Optional;

/**
 * Credential source holding a single literal identity.
 *
 * <p>Every query matches. The literal user, if any, applies when the query names no user.
 */
public class StaticSource implements CredentialSource {

    private final OAuth2ClientParams params;

    /**
     * Constructs a new StaticSource instance.
     *
     * @param params OAuth2ClientParams instance.
     * @throws CredentialsConfigException A required field is missing.
     */
    public StaticSource(OAuth2ClientParams params) throws CredentialsConfigException {
        if (params == null) {
            throw new CredentialsConfigException("Static credentials not configured");
        }
        if (!params.isComplete()) {
            throw new CredentialsConfigException("Static credentials missing required field: " +
                    String.join(", ", params.missingFields()));
        }
        this.params = params;
    }

    @Override
    public Optional<OAuth2ClientParams> fetch(String host, String user, String port) {
        return Optional.of(params);
    }
}
