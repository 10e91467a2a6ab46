package com.mimecast.xoauth2.http;

import java.io.IOException;

/**
 * Synchronous transport for form POST requests.
 *
 * @see OkHttpTokenTransport
 * @see CurlTokenTransport
 */
public interface TokenTransport {

    /**
     * Issues exactly one POST and returns the response body.
     *
     * @param request HttpRequest instance.
     * @return Response body bytes.
     * @throws IOException Transport failure.
     */
    byte[] post(HttpRequest request) throws IOException;
}
