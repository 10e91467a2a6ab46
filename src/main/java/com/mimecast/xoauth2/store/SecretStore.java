package com.mimecast.xoauth2.store;

import java.io.IOException;
import java.util.Optional;

/**
 * Secret store looked up by identity.
 *
 * <p>Stores that key entries by port override {@link #find(String, String, String)}.
 * <br>Stores that do not only implement {@link #find(String, String)}.
 *
 * @see VaultSecretStore
 * @see PassSecretStore
 */
public interface SecretStore {

    /**
     * Finds an entry by host and user.
     *
     * @param host Host name.
     * @param user User name, may be null or empty.
     * @return Optional of SecretEntry.
     * @throws IOException Store unreachable or failed.
     */
    Optional<SecretEntry> find(String host, String user) throws IOException;

    /**
     * Finds an entry by host, user and port.
     *
     * @param host Host name.
     * @param user User name, may be null or empty.
     * @param port Port or service name.
     * @return Optional of SecretEntry.
     * @throws IOException Store unreachable or failed.
     */
    default Optional<SecretEntry> find(String host, String user, String port) throws IOException {
        return find(host, user);
    }
}
