package com.mimecast.xoauth2.source;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CredentialsFileTest {

    private static CredentialsFile parse(String content) throws CredentialsConfigException {
        return CredentialsFile.parse(content.getBytes(StandardCharsets.UTF_8), "test.gpg");
    }

    private static final String CREDENTIALS =
            "{ token_url: 'https://t', client_id: 'c', client_secret: 's', refresh_token: 'r' }";

    @Test
    void singleRecord() throws CredentialsConfigException {
        CredentialsFile file = parse(CREDENTIALS);

        assertFalse(file.isMapping());
        assertEquals("c", file.lookup("a", "b", "c").orElseThrow().clientId());
    }

    @Test
    void mappingPortNumbersCompareAsStrings() throws CredentialsConfigException {
        CredentialsFile file = parse("[{ host: 'h', user: 'u', port: 993, credentials: " + CREDENTIALS + " }]");

        assertTrue(file.isMapping());
        assertTrue(file.lookup("h", "u", "993").isPresent());
        assertTrue(file.lookup("h", "u", "imaps").isEmpty());
    }

    @Test
    void duplicateKeysKeepFirst() throws CredentialsConfigException {
        CredentialsFile file = parse("["
                + "{ host: 'h', user: 'u', port: '1', credentials: " + CREDENTIALS + " },"
                + "{ host: 'h', user: 'u', port: '1', credentials: "
                + "{ token_url: 'https://other', client_id: 'c2', client_secret: 's', refresh_token: 'r' } }"
                + "]");

        assertEquals("c", file.lookup("h", "u", "1").orElseThrow().clientId());
    }

    @Test
    void entryMissingCredentials() {
        CredentialsConfigException e = assertThrows(CredentialsConfigException.class,
                () -> parse("[{ host: 'h', user: 'u', port: '1' }]"));

        assertEquals("Credentials file test.gpg entry 0 missing required field: credentials", e.getMessage());
    }

    @Test
    void entryMissingHost() {
        assertThrows(CredentialsConfigException.class,
                () -> parse("[{ user: 'u', port: '1', credentials: " + CREDENTIALS + " }]"));
    }

    @Test
    void entryNotObject() {
        assertThrows(CredentialsConfigException.class, () -> parse("[ 'imap.gmail.com' ]"));
    }

    @Test
    void nonStringField() {
        CredentialsConfigException e = assertThrows(CredentialsConfigException.class,
                () -> parse("{ token_url: ['https://t'], client_id: 'c', client_secret: 's', refresh_token: 'r' }"));

        assertTrue(e.getMessage().endsWith("field token_url must be a string"));
    }

    @Test
    void scalarRoot() {
        assertThrows(CredentialsConfigException.class, () -> parse("\"just a string\""));
    }
}
