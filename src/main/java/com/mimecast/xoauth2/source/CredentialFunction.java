package com.mimecast.xoauth2.source;

/**
 * User supplied resolver for {@link FunctionSource}.
 *
 * <p>May match identities any way it likes. Returning null means no match.
 */
@FunctionalInterface
public interface CredentialFunction {

    /**
     * Resolves client parameters.
     *
     * @param host Host name.
     * @param user User name, may be null or empty.
     * @param port Port or service name.
     * @return OAuth2ClientParams instance or null.
     * @throws CredentialsConfigException Resolver is misconfigured.
     */
    OAuth2ClientParams apply(String host, String user, String port) throws CredentialsConfigException;
}
