package com.mimecast.xoauth2.vault;

import com.mimecast.xoauth2.config.VaultConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Factory for creating VaultClient instances from VaultConfig.
 *
 * <p>Example usage:
 * <pre>
 * AuthSourceConfig config = new AuthSourceConfig("cfg/auth-source.json5");
 * VaultClient vaultClient = VaultClientFactory.createFromConfig(config.getSource().getVault());
 * </pre>
 */
public class VaultClientFactory {
    private static final Logger log = LogManager.getLogger(VaultClientFactory.class);

    /**
     * Largest timeout in seconds OkHttp accepts once converted to milliseconds.
     */
    static final long MAX_TIMEOUT = Integer.MAX_VALUE / 1000;

    /**
     * Private constructor to prevent instantiation.
     */
    private VaultClientFactory() {
        // Utility class.
    }

    /**
     * Creates a VaultClient from VaultConfig.
     *
     * @param vaultConfig VaultConfig instance.
     * @return VaultClient instance.
     * @throws IOException Token file exists but cannot be read or a timeout is out of range.
     */
    public static VaultClient createFromConfig(VaultConfig vaultConfig) throws IOException {
        VaultClient.Builder builder = new VaultClient.Builder()
                .withAddress(vaultConfig.getAddress())
                .withToken(resolveToken(vaultConfig.getToken()))
                .withConnectTimeout(timeout("connectTimeout", vaultConfig.getConnectTimeout()))
                .withReadTimeout(timeout("readTimeout", vaultConfig.getReadTimeout()))
                .withSkipTlsVerification(vaultConfig.isSkipTlsVerification());

        if (vaultConfig.getNamespace() != null && !vaultConfig.getNamespace().isEmpty()) {
            builder.withNamespace(vaultConfig.getNamespace());
        }

        log.info("Vault credential store at address: {}", vaultConfig.getAddress());

        return builder.build();
    }

    /**
     * Checks a timeout fits the HTTP client.
     *
     * @param name    Setting name.
     * @param seconds Timeout in seconds, 0 for none.
     * @return Timeout in seconds.
     * @throws IOException Timeout is negative or too large.
     */
    static int timeout(String name, long seconds) throws IOException {
        if (seconds < 0 || seconds > MAX_TIMEOUT) {
            throw new IOException(name + " out of range (0-" + MAX_TIMEOUT + " seconds): " + seconds);
        }
        return (int) seconds;
    }

    /**
     * Resolves a token value that may be a file path or direct value.
     *
     * @param value Value or file path.
     * @return Resolved token value.
     * @throws IOException Token file exists but cannot be read.
     */
    static String resolveToken(String value) throws IOException {
        if (value == null || value.isEmpty()) {
            return value;
        }

        Path path;
        try {
            path = Paths.get(value);
        } catch (InvalidPathException e) {
            return value;
        }

        if (Files.isRegularFile(path)) {
            log.debug("Reading Vault token from file: {}", path);
            return Files.readString(path, StandardCharsets.UTF_8).trim();
        }

        return value;
    }
}
