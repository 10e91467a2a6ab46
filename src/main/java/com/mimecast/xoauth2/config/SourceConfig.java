package com.mimecast.xoauth2.config;

import com.mimecast.xoauth2.source.OAuth2ClientParams;

import java.util.Locale;
import java.util.Map;

/**
 * Credential source configuration.
 *
 * <p>The <code>type</code> key selects the source:
 * <ul>
 *     <li><b>static</b>: <code>tokenUrl</code>, <code>clientId</code>, <code>clientSecret</code>,
 *     <code>refreshToken</code> and optional <code>user</code>.</li>
 *     <li><b>file</b>: <code>path</code> to a .gpg file and optional <code>gpgBinary</code>.</li>
 *     <li><b>pass</b>: optional <code>binary</code> and <code>entryTemplate</code>.</li>
 *     <li><b>vault</b>: server settings and <code>pathTemplate</code>, see {@link VaultConfig}.</li>
 *     <li><b>function</b>: <code>class</code> implementing CredentialFunction.</li>
 * </ul>
 */
public class SourceConfig extends ConfigFoundation {

    /**
     * Constructs a new SourceConfig instance.
     *
     * @param map Configuration map.
     */
    public SourceConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets source type.
     *
     * @return Type string, lower case.
     */
    public String getType() {
        return getStringProperty("type", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Gets static client parameters.
     *
     * @return OAuth2ClientParams instance.
     */
    public OAuth2ClientParams getStaticParams() {
        return new OAuth2ClientParams(
                getStringProperty("tokenUrl"),
                getStringProperty("clientId"),
                getStringProperty("clientSecret"),
                getStringProperty("refreshToken"),
                getStringProperty("user"));
    }

    /**
     * Gets credentials file path.
     *
     * @return Path string or null.
     */
    public String getPath() {
        return getStringProperty("path");
    }

    /**
     * Gets gpg binary.
     *
     * @return Binary path.
     */
    public String getGpgBinary() {
        return getStringProperty("gpgBinary", "gpg");
    }

    /**
     * Gets pass binary.
     *
     * @return Binary path.
     */
    public String getPassBinary() {
        return getStringProperty("binary", "pass");
    }

    /**
     * Gets pass entry template.
     *
     * @return Template with {host}, {user} and {port} placeholders.
     */
    public String getEntryTemplate() {
        return getStringProperty("entryTemplate", "{host}/{user}");
    }

    /**
     * Gets Vault settings.
     *
     * @return VaultConfig instance over the same map.
     */
    public VaultConfig getVault() {
        return new VaultConfig(map);
    }

    /**
     * Gets credential function class name.
     *
     * @return Class name or null.
     */
    public String getFunctionClass() {
        return getStringProperty("class");
    }
}
