package com.mimecast.xoauth2.token;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.mimecast.xoauth2.config.TransportConfig;
import com.mimecast.xoauth2.http.CurlTokenTransport;
import com.mimecast.xoauth2.http.HttpRequest;
import com.mimecast.xoauth2.http.OkHttpTokenTransport;
import com.mimecast.xoauth2.http.TokenTransport;
import com.mimecast.xoauth2.source.OAuth2ClientParams;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * OAuth2 token endpoint client.
 *
 * <p>Performs the <code>refresh_token</code> grant: one form POST, no retry.
 * <p>Access tokens are short lived and logged at debug level.
 * <br>Client secrets and refresh tokens are never logged.
 *
 * @see <a href="https://tools.ietf.org/html/rfc6749#section-6">RFC 6749 - Refreshing an Access Token</a>
 */
public class TokenEndpointClient {
    private static final Logger log = LogManager.getLogger(TokenEndpointClient.class);

    private final TokenTransport transport;

    /**
     * Constructs a new TokenEndpointClient instance.
     *
     * @param transport TokenTransport instance.
     */
    public TokenEndpointClient(TokenTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    /**
     * Gets transport.
     *
     * @return TokenTransport instance.
     */
    TokenTransport getTransport() {
        return transport;
    }

    /**
     * Creates a client with the transport selected by configuration.
     *
     * @param config TransportConfig instance.
     * @return TokenEndpointClient instance.
     */
    public static TokenEndpointClient fromConfig(TransportConfig config) {
        if (config.isUseCurl()) {
            log.debug("Using curl token transport: {}", config.getCurlBinary());
            return new TokenEndpointClient(new CurlTokenTransport(config.getCurlBinary()));
        }
        return new TokenEndpointClient(new OkHttpTokenTransport());
    }

    /**
     * Exchanges a refresh token for an access token.
     *
     * @param params OAuth2ClientParams instance.
     * @return Access token.
     * @throws TokenExchangeException Transport failure or unusable response.
     */
    public String refresh(OAuth2ClientParams params) throws TokenExchangeException {
        return refresh(params.tokenUrl(), params.clientId(), params.clientSecret(), params.refreshToken());
    }

    /**
     * Exchanges a refresh token for an access token.
     *
     * @param tokenUrl     Token endpoint URL.
     * @param clientId     Client id.
     * @param clientSecret Client secret.
     * @param refreshToken Refresh token.
     * @return Access token.
     * @throws TokenExchangeException Transport failure or unusable response.
     */
    public String refresh(String tokenUrl, String clientId, String clientSecret, String refreshToken) throws TokenExchangeException {
        HttpRequest request = new HttpRequest(tokenUrl)
                .addParam("client_id", clientId)
                .addParam("client_secret", clientSecret)
                .addParam("refresh_token", refreshToken)
                .addParam("grant_type", "refresh_token");

        byte[] body;
        try {
            body = transport.post(request);
        } catch (IOException e) {
            throw new TokenExchangeException(tokenUrl, "Token request failed: " + e.getMessage(), e);
        }

        String accessToken = parseAccessToken(tokenUrl, new String(body, StandardCharsets.UTF_8));
        log.debug("Access token from {}: {}", tokenUrl, accessToken);
        return accessToken;
    }

    /**
     * Extracts access_token from a token endpoint response.
     *
     * @param tokenUrl Token endpoint URL.
     * @param body     Response body.
     * @return Access token.
     * @throws TokenExchangeException Body is not a JSON object or lacks access_token.
     */
    static String parseAccessToken(String tokenUrl, String body) throws TokenExchangeException {
        JsonObject json;
        try {
            JsonElement element = JsonParser.parseString(body);
            if (!element.isJsonObject()) {
                throw new TokenExchangeException(tokenUrl, "Token response is not a JSON object");
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new TokenExchangeException(tokenUrl, "Token response is not JSON: " +
                    StringUtils.abbreviate(body, 200), e);
        }

        JsonElement token = json.get("access_token");
        if (token == null || !token.isJsonPrimitive() || token.getAsString().isEmpty()) {
            StringBuilder message = new StringBuilder("Token response has no access_token");
            if (json.has("error")) {
                message.append(": ").append(stringOf(json.get("error")));
                if (json.has("error_description")) {
                    message.append(" (").append(stringOf(json.get("error_description"))).append(")");
                }
            }
            throw new TokenExchangeException(tokenUrl, message.toString());
        }

        return token.getAsString();
    }

    private static String stringOf(JsonElement element) {
        return element.isJsonPrimitive() ? element.getAsString() : element.toString();
    }
}
