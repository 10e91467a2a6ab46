package com.mimecast.xoauth2.config;

import java.util.Map;

/**
 * Token transport configuration.
 */
public class TransportConfig extends ConfigFoundation {

    /**
     * Constructs a new TransportConfig instance.
     *
     * @param map Configuration map.
     */
    public TransportConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Checks if the curl binary should be used instead of the built-in client.
     *
     * @return Boolean.
     */
    public boolean isUseCurl() {
        return getBooleanProperty("useCurl", false);
    }

    /**
     * Gets curl binary.
     *
     * @return Binary path.
     */
    public String getCurlBinary() {
        return getStringProperty("curlBinary", "curl");
    }
}
