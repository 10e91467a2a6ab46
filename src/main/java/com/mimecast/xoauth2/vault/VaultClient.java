package com.mimecast.xoauth2.vault;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * HashiCorp Vault KV reader.
 *
 * <p>Reads every key stored at a path. Both KV v1 ({@code data.key}) and
 * <br>KV v2 ({@code data.data.key}) response layouts are understood.
 *
 * <p>Example usage:
 * <pre>
 * VaultClient client = new VaultClient.Builder()
 *     .withAddress("https://vault.example.com:8200")
 *     .withToken("s.abc123xyz")
 *     .build();
 *
 * Optional&lt;Map&lt;String, String&gt;&gt; secrets = client.readSecrets("secret/data/xoauth2/imap.gmail.com/tony");
 * </pre>
 */
public class VaultClient {
    private static final Logger log = LogManager.getLogger(VaultClient.class);
    private static final int DEFAULT_TIMEOUT = 30;

    private final String vaultAddress;
    private final String vaultToken;
    private final String namespace;
    private final OkHttpClient httpClient;

    /**
     * Constructs a new VaultClient instance.
     *
     * @param builder Builder instance with configuration.
     */
    private VaultClient(Builder builder) {
        this.vaultAddress = builder.vaultAddress;
        this.vaultToken = builder.vaultToken;
        this.namespace = builder.namespace;

        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(builder.connectTimeout, TimeUnit.SECONDS)
                .readTimeout(builder.readTimeout, TimeUnit.SECONDS);

        if (builder.skipTlsVerification) {
            configureTrustAllCerts(clientBuilder);
        }

        this.httpClient = clientBuilder.build();
    }

    /**
     * Configure the HTTP client to trust all certificates.
     * WARNING: This should only be used in development environments.
     *
     * @param builder OkHttpClient.Builder to configure.
     */
    private void configureTrustAllCerts(OkHttpClient.Builder builder) {
        X509TrustManager trustAll = new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
                // Trust all clients.
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
                // Trust all servers.
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[]{};
            }
        };

        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{trustAll}, new SecureRandom());
            builder.sslSocketFactory(sslContext.getSocketFactory(), trustAll);
            builder.hostnameVerifier((hostname, session) -> true);

            log.warn("TLS verification disabled for Vault client - use only in development!");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to configure trust all certificates", e);
        }
    }

    /**
     * Reads all keys stored at a path.
     *
     * @param path Path to the secret (e.g., "secret/data/xoauth2/host/user" for KV v2).
     * @return Optional of key-value map, empty when the path does not exist.
     * @throws VaultException if the request fails.
     */
    public Optional<Map<String, String>> readSecrets(String path) throws VaultException {
        Objects.requireNonNull(path, "path must not be null");

        Request.Builder requestBuilder = new Request.Builder()
                .url(vaultAddress + "/v1/" + path)
                .header("X-Vault-Token", vaultToken)
                .get();

        if (namespace != null && !namespace.isEmpty()) {
            requestBuilder.header("X-Vault-Namespace", namespace);
        }

        log.debug("Fetching secrets from Vault: {}", path);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (response.code() == 404) {
                log.debug("No Vault secret at path: {}", path);
                return Optional.empty();
            }

            if (!response.isSuccessful()) {
                throw new VaultException("Vault request failed with status: " + response.code() +
                        ", message: " + response.message());
            }

            ResponseBody body = response.body();
            JsonObject data = extractData(body != null ? body.string() : "{}");
            if (data == null) {
                return Optional.empty();
            }

            Map<String, String> secrets = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : data.entrySet()) {
                if (entry.getValue().isJsonPrimitive()) {
                    secrets.put(entry.getKey(), entry.getValue().getAsString());
                }
            }

            log.debug("Retrieved {} keys from path: {}", secrets.size(), path);
            return Optional.of(secrets);
        } catch (IOException e) {
            throw new VaultException("Failed to fetch secrets from Vault: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the secret data object from a KV v1 or v2 response.
     *
     * @param responseBody Response JSON.
     * @return JsonObject or null if absent.
     * @throws VaultException Response is not JSON.
     */
    private JsonObject extractData(String responseBody) throws VaultException {
        JsonObject json;
        try {
            json = JsonParser.parseString(responseBody).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new VaultException("Unexpected Vault response: " + e.getMessage(), e);
        }

        if (!json.has("data") || !json.get("data").isJsonObject()) {
            return null;
        }

        JsonObject data = json.getAsJsonObject("data");

        // KV v2 nests the secret under data.data.
        if (data.has("data") && data.get("data").isJsonObject()) {
            return data.getAsJsonObject("data");
        }

        return data;
    }

    /**
     * Builder for VaultClient.
     */
    public static class Builder {
        private String vaultAddress;
        private String vaultToken;
        private String namespace;
        private boolean skipTlsVerification = false;
        private int connectTimeout = DEFAULT_TIMEOUT;
        private int readTimeout = DEFAULT_TIMEOUT;

        /**
         * Sets the Vault server address.
         *
         * @param address Vault server URL (e.g., "https://vault.example.com:8200").
         * @return Builder instance.
         */
        public Builder withAddress(String address) {
            this.vaultAddress = address;
            return this;
        }

        /**
         * Sets the Vault authentication token.
         *
         * @param token Vault token.
         * @return Builder instance.
         */
        public Builder withToken(String token) {
            this.vaultToken = token;
            return this;
        }

        /**
         * Sets the Vault namespace (for Vault Enterprise).
         *
         * @param namespace Vault namespace.
         * @return Builder instance.
         */
        public Builder withNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        /**
         * Skip TLS certificate verification (for development only).
         *
         * @param skip true to skip verification.
         * @return Builder instance.
         */
        public Builder withSkipTlsVerification(boolean skip) {
            this.skipTlsVerification = skip;
            return this;
        }

        /**
         * Sets connection timeout.
         *
         * @param timeout Timeout in seconds.
         * @return Builder instance.
         */
        public Builder withConnectTimeout(int timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Sets read timeout.
         *
         * @param timeout Timeout in seconds.
         * @return Builder instance.
         */
        public Builder withReadTimeout(int timeout) {
            this.readTimeout = timeout;
            return this;
        }

        /**
         * Builds the VaultClient instance.
         *
         * @return VaultClient instance.
         */
        public VaultClient build() {
            Objects.requireNonNull(vaultAddress, "vaultAddress must not be null");
            Objects.requireNonNull(vaultToken, "vaultToken must not be null");
            return new VaultClient(this);
        }
    }

    /**
     * Exception thrown when Vault operations fail.
     */
    public static class VaultException extends Exception {
        /**
         * Constructs a new VaultException.
         *
         * @param message Error message.
         */
        public VaultException(String message) {
            super(message);
        }

        /**
         * Constructs a new VaultException with cause.
         *
         * @param message Error message.
         * @param cause   Underlying cause.
         */
        public VaultException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
