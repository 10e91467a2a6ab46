package com.mimecast.xoauth2.config;

import java.util.Map;

/**
 * Vault source configuration.
 *
 * <p>Shares the <code>source</code> map when its type is <b>vault</b>:
 * <pre>
 * source: {
 *   type: "vault",
 *   address: "https://vault.example.com:8200",
 *   token: "/run/secrets/vault-token",
 *   pathTemplate: "secret/data/xoauth2/{host}/{user}"
 * }
 * </pre>
 */
public class VaultConfig extends ConfigFoundation {

    /**
     * Constructs a new VaultConfig instance.
     *
     * @param map Configuration map.
     */
    public VaultConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets Vault server address.
     *
     * @return Vault server URL.
     */
    public String getAddress() {
        return getStringProperty("address", "https://127.0.0.1:8200");
    }

    /**
     * Gets Vault authentication token.
     *
     * @return Vault token or path to token file.
     */
    public String getToken() {
        return getStringProperty("token", "");
    }

    /**
     * Gets Vault namespace (for Vault Enterprise).
     *
     * @return Vault namespace, or null if not configured.
     */
    public String getNamespace() {
        return getStringProperty("namespace", null);
    }

    /**
     * Gets secret path template.
     *
     * @return Template with {host}, {user} and {port} placeholders.
     */
    public String getPathTemplate() {
        return getStringProperty("pathTemplate", "secret/data/xoauth2/{host}/{user}");
    }

    /**
     * Checks if TLS verification should be skipped.
     *
     * @return true to skip TLS verification, false otherwise.
     */
    public boolean isSkipTlsVerification() {
        return getBooleanProperty("skipTlsVerification", false);
    }

    /**
     * Gets connection timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public long getConnectTimeout() {
        return getLongProperty("connectTimeout", 30L);
    }

    /**
     * Gets read timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public long getReadTimeout() {
        return getLongProperty("readTimeout", 30L);
    }
}
