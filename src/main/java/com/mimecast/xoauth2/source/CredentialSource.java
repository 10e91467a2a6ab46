package com.mimecast.xoauth2.source;

import java.util.Optional;

/**
 * Backend answering "what are the static OAuth2 parameters for this identity?".
 *
 * <p>Implementations are chosen once at configuration time.
 * <br>An empty result means no match and lets the caller try another candidate or backend.
 *
 * @see StaticSource
 * @see FunctionSource
 * @see FileSource
 * @see PasswordStoreSource
 */
public interface CredentialSource {

    /**
     * Fetches client parameters for an identity.
     *
     * @param host Host name.
     * @param user User name, may be null or empty.
     * @param port Port or service name.
     * @return Optional of OAuth2ClientParams.
     * @throws CredentialsConfigException Source is misconfigured.
     */
    Optional<OAuth2ClientParams> fetch(String host, String user, String port) throws CredentialsConfigException;

    /**
     * Gets a view of this source valid for a single resolution.
     * <p>Sources with expensive backing reads load them once here.
     *
     * @return CredentialSource instance.
     * @throws CredentialsConfigException Source is misconfigured.
     */
    default CredentialSource snapshot() throws CredentialsConfigException {
        return this;
    }
}
