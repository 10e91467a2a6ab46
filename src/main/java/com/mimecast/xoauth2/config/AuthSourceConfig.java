package com.mimecast.xoauth2.config;

import java.io.IOException;
import java.util.Map;

/**
 * Auth source configuration container.
 *
 * <p>This class provides type safe access to the credential source and token transport settings.
 * <br>It is loaded once and passed explicitly to the resolver.
 *
 * @see SourceConfig
 * @see TransportConfig
 */
public class AuthSourceConfig extends ConfigFoundation {

    /**
     * Constructs a new AuthSourceConfig instance.
     */
    public AuthSourceConfig() {
        super();
    }

    /**
     * Constructs a new AuthSourceConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public AuthSourceConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new AuthSourceConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public AuthSourceConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets credential source configuration.
     *
     * @return SourceConfig instance.
     */
    public SourceConfig getSource() {
        return new SourceConfig(getMapProperty("source"));
    }

    /**
     * Gets token transport configuration.
     *
     * @return TransportConfig instance.
     */
    public TransportConfig getTransport() {
        return new TransportConfig(getMapProperty("transport"));
    }
}
