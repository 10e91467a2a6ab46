package com.mimecast.xoauth2.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Form POST request container.
 *
 * <p>This class is a lightweight mutable container holding the pieces a
 * {@link TokenTransport} needs to issue a form-encoded POST:
 * <ul>
 *   <li>The URL is immutable after construction.</li>
 *   <li>Headers and form parameters keep insertion order.</li>
 *   <li>The body is always <code>application/x-www-form-urlencoded</code>.</li>
 *   <li>The class is mutable and NOT thread-safe. Create a new instance per request.</li>
 * </ul>
 *
 * <p>Note: {@link #toString()} masks credential parameters and the {@code Authorization}
 * header so requests can be logged.
 */
public class HttpRequest {

    /**
     * Form content type.
     */
    public static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    /**
     * Parameters never rendered by {@link #toString()}.
     */
    private static final Set<String> SECRET_PARAMS = Set.of("client_secret", "refresh_token", "password");

    /**
     * Request URL (immutable after construction).
     */
    private final String url;

    /**
     * Headers container.
     */
    private final Map<String, String> headers = new LinkedHashMap<>();

    /**
     * Form parameters container.
     */
    private final Map<String, String> params = new LinkedHashMap<>();

    /**
     * Constructs a new HttpRequest instance with given URL.
     *
     * @param url Request URL.
     */
    public HttpRequest(String url) {
        this.url = url;
        headers.put("Content-Type", FORM_CONTENT_TYPE);
    }

    /**
     * Gets request URL.
     *
     * @return String.
     */
    public String getUrl() {
        return url;
    }

    /**
     * Gets request headers.
     *
     * @return Unmodifiable map of String, String.
     */
    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * Adds request header.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public HttpRequest addHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    /**
     * Gets form parameters.
     *
     * @return Unmodifiable map of String, String.
     */
    public Map<String, String> getParams() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * Adds form parameter.
     *
     * @param name  Param name.
     * @param value Param value.
     * @return Self.
     */
    public HttpRequest addParam(String name, String value) {
        params.put(name, value);
        return this;
    }

    /**
     * Gets the form-encoded body in parameter insertion order.
     *
     * @return Body string.
     */
    public String getFormBody() {
        return params.entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    /**
     * Returns a log safe string representation.
     *
     * @return String.
     */
    @Override
    public String toString() {
        Map<String, String> safeHeaders = headers.entrySet()
                .stream().filter(entry -> !entry.getKey().equalsIgnoreCase("Authorization"))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));

        Map<String, String> safeParams = params.entrySet()
                .stream().collect(Collectors.toMap(Map.Entry::getKey,
                        entry -> SECRET_PARAMS.contains(entry.getKey()) ? "***" : entry.getValue(),
                        (a, b) -> a, LinkedHashMap::new));

        return "{url=" + url + ", headers=" + safeHeaders + ", params=" + safeParams + "}";
    }
}
