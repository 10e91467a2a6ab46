package com.mimecast.xoauth2.http;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in OkHttp transport.
 *
 * <p>Uses OkHttp default timeouts. Non-2xx statuses are logged and the body is still returned
 * <br>since token endpoints describe failures in the JSON body.
 */
public class OkHttpTokenTransport implements TokenTransport {
    private static final Logger log = LogManager.getLogger(OkHttpTokenTransport.class);
    private static final MediaType FORM = MediaType.get(HttpRequest.FORM_CONTENT_TYPE);

    private final OkHttpClient httpClient;

    /**
     * Constructs a new OkHttpTokenTransport instance with a default client.
     */
    public OkHttpTokenTransport() {
        this(new OkHttpClient());
    }

    /**
     * Constructs a new OkHttpTokenTransport instance.
     *
     * @param httpClient OkHttpClient instance.
     */
    public OkHttpTokenTransport(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public byte[] post(HttpRequest request) throws IOException {
        HttpUrl url = request.getUrl() != null ? HttpUrl.parse(request.getUrl()) : null;
        if (url == null) {
            throw new IOException("Invalid token URL: " + request.getUrl());
        }

        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(request.getFormBody().getBytes(StandardCharsets.UTF_8), FORM));

        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        log.debug("POST {}", request);

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            if (!response.isSuccessful()) {
                log.warn("Token endpoint {} answered with status: {}", request.getUrl(), response.code());
            }

            ResponseBody body = response.body();
            return body != null ? body.bytes() : new byte[0];
        }
    }
}
