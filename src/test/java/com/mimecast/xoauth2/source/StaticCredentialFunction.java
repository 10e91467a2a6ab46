package com.mimecast.xoauth2.source;

/**
 * Credential function loaded by class name in tests.
 */
public class StaticCredentialFunction implements CredentialFunction {

    @Override
    public OAuth2ClientParams apply(String host, String user, String port) {
        return "imap.example.com".equals(host)
                ? new OAuth2ClientParams("https://t", "fn-client", "s", "r", "fn@example.com")
                : null;
    }
}
