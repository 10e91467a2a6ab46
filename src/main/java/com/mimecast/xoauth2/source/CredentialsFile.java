package com.mimecast.xoauth2.source;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed plaintext of a credentials file.
 *
 * <p>The plaintext is a single JSON5 value, either:
 * <ul>
 *     <li>an object holding one record, returned for every lookup;</li>
 *     <li>an array of <code>{host, user, port, credentials}</code> entries, looked up by exact triple.</li>
 * </ul>
 *
 * <p>Record example:
 * <pre>
 * {
 *   token_url: "https://oauth2.googleapis.com/token",
 *   client_id: "1234.apps.googleusercontent.com",
 *   client_secret: "...",
 *   refresh_token: "...",
 *   user: "tony@example.com" // optional
 * }
 * </pre>
 *
 * <p>Mapping example:
 * <pre>
 * [
 *   { host: "imap.gmail.com", user: "tony@example.com", port: "993", credentials: { ... } }
 * ]
 * </pre>
 */
public class CredentialsFile {
    private static final Logger log = LogManager.getLogger(CredentialsFile.class);

    /**
     * Single record, null for mappings.
     */
    private final OAuth2ClientParams record;

    /**
     * Mapping entries, empty for single records.
     */
    private final Map<IdentityKey, OAuth2ClientParams> entries;

    private CredentialsFile(OAuth2ClientParams record, Map<IdentityKey, OAuth2ClientParams> entries) {
        this.record = record;
        this.entries = entries;
    }

    /**
     * Parses decrypted file content.
     *
     * @param content Plaintext bytes.
     * @param source  File name used in error messages.
     * @return CredentialsFile instance.
     * @throws CredentialsConfigException Content is not a valid record or mapping.
     */
    public static CredentialsFile parse(byte[] content, String source) throws CredentialsConfigException {
        JsonElement root;
        try {
            root = JsonParser.parseString(new String(content, StandardCharsets.UTF_8));
        } catch (JsonParseException e) {
            throw new CredentialsConfigException("Malformed credentials file " + source + ": " + e.getMessage(), e);
        }

        if (root.isJsonObject()) {
            return new CredentialsFile(toParams(root.getAsJsonObject(), source), Collections.emptyMap());
        }

        if (root.isJsonArray()) {
            return new CredentialsFile(null, toEntries(root.getAsJsonArray(), source));
        }

        throw new CredentialsConfigException("Credentials file " + source + " must hold an object or an array");
    }

    /**
     * Checks if this file holds a mapping.
     *
     * @return Boolean.
     */
    public boolean isMapping() {
        return record == null;
    }

    /**
     * Looks up client parameters.
     * <p>A single record matches any identity. A mapping matches the exact triple only.
     *
     * @param host Host name.
     * @param user User name.
     * @param port Port.
     * @return Optional of OAuth2ClientParams.
     */
    public Optional<OAuth2ClientParams> lookup(String host, String user, String port) {
        if (record != null) {
            return Optional.of(record);
        }
        return Optional.ofNullable(entries.get(new IdentityKey(host, user, port)));
    }

    private static Map<IdentityKey, OAuth2ClientParams> toEntries(JsonArray array, String source) throws CredentialsConfigException {
        Map<IdentityKey, OAuth2ClientParams> entries = new LinkedHashMap<>();
        for (int i = 0; i < array.size(); i++) {
            String where = source + " entry " + i;
            if (!array.get(i).isJsonObject()) {
                throw new CredentialsConfigException("Credentials file " + where + " is not an object");
            }

            JsonObject entry = array.get(i).getAsJsonObject();
            IdentityKey key = new IdentityKey(
                    requireString(entry, "host", where),
                    requireString(entry, "user", where),
                    requireString(entry, "port", where));

            if (!entry.has("credentials") || !entry.get("credentials").isJsonObject()) {
                throw new CredentialsConfigException("Credentials file " + where + " missing required field: credentials");
            }

            if (entries.putIfAbsent(key, toParams(entry.getAsJsonObject("credentials"), where)) != null) {
                log.warn("Duplicate credentials for {} in {}, keeping first", key, source);
            }
        }
        return entries;
    }

    private static OAuth2ClientParams toParams(JsonObject object, String where) throws CredentialsConfigException {
        return new OAuth2ClientParams(
                requireString(object, OAuth2ClientParams.TOKEN_URL, where),
                requireString(object, OAuth2ClientParams.CLIENT_ID, where),
                requireString(object, OAuth2ClientParams.CLIENT_SECRET, where),
                requireString(object, OAuth2ClientParams.REFRESH_TOKEN, where),
                optionalString(object, OAuth2ClientParams.USER, where));
    }

    private static String requireString(JsonObject object, String field, String where) throws CredentialsConfigException {
        String value = optionalString(object, field, where);
        if (value == null || value.isEmpty()) {
            throw new CredentialsConfigException("Credentials file " + where + " missing required field: " + field);
        }
        return value;
    }

    private static String optionalString(JsonObject object, String field, String where) throws CredentialsConfigException {
        JsonElement value = object.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive()) {
            throw new CredentialsConfigException("Credentials file " + where + " field " + field + " must be a string");
        }
        return value.getAsString();
    }

    /**
     * Exact (host, user, port) lookup key.
     *
     * @param host Host name.
     * @param user User name.
     * @param port Port.
     */
    record IdentityKey(String host, String user, String port) {
    }
}
