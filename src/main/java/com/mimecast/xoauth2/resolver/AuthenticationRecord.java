package com.mimecast.xoauth2.resolver;

/**
 * Resolved authentication record.
 *
 * <p>Created per lookup and never cached. The secret is the live access token.
 *
 * @param host   Host the credentials matched.
 * @param port   Port the credentials matched.
 * @param user   Effective user.
 * @param secret Access token.
 */
public record AuthenticationRecord(String host, String port, String user, String secret) {

    @Override
    public String toString() {
        return "AuthenticationRecord{host=" + host + ", port=" + port + ", user=" + user + "}";
    }
}
