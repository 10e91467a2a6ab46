package com.mimecast.xoauth2.store;

import com.mimecast.xoauth2.vault.VaultClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * HashiCorp Vault backed secret store.
 *
 * <p>Each identity maps to one Vault path built from a template, for example
 * <br><code>secret/data/xoauth2/{host}/{user}</code>. Every key at the path becomes an entry field.
 */
public class VaultSecretStore implements SecretStore {
    private static final Logger log = LogManager.getLogger(VaultSecretStore.class);

    private final VaultClient client;
    private final EntryTemplate pathTemplate;

    /**
     * Constructs a new VaultSecretStore instance.
     *
     * @param client       VaultClient instance.
     * @param pathTemplate Vault path template.
     */
    public VaultSecretStore(VaultClient client, String pathTemplate) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.pathTemplate = new EntryTemplate(Objects.requireNonNull(pathTemplate, "pathTemplate must not be null"));
    }

    @Override
    public Optional<SecretEntry> find(String host, String user) throws IOException {
        return read(pathTemplate.expand(host, user, null));
    }

    @Override
    public Optional<SecretEntry> find(String host, String user, String port) throws IOException {
        if (!pathTemplate.usesPort()) {
            return find(host, user);
        }
        return read(pathTemplate.expand(host, user, port));
    }

    private Optional<SecretEntry> read(String path) throws IOException {
        log.debug("Looking up Vault path: {}", path);
        try {
            Optional<Map<String, String>> secrets = client.readSecrets(path);
            return secrets.map(fields -> new SecretEntry(path, fields));
        } catch (VaultClient.VaultException e) {
            throw new IOException("Vault lookup failed for " + path + ": " + e.getMessage(), e);
        }
    }
}
