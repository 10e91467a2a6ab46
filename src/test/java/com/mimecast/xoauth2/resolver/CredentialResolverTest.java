package com.mimecast.xoauth2.resolver;

import com.mimecast.xoauth2.config.AuthSourceConfig;
import com.mimecast.xoauth2.http.OkHttpTokenTransport;
import com.mimecast.xoauth2.source.CredentialSource;
import com.mimecast.xoauth2.source.CredentialsConfigException;
import com.mimecast.xoauth2.source.OAuth2ClientParams;
import com.mimecast.xoauth2.source.StaticSource;
import com.mimecast.xoauth2.token.TokenEndpointClient;
import com.mimecast.xoauth2.token.TokenExchangeException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CredentialResolverTest {

    private static final OAuth2ClientParams PARAMS =
            new OAuth2ClientParams("https://oauth2.example.com/token", "client-1", "secret-1", "refresh-1", null);

    private final List<String> probes = new ArrayList<>();
    private final List<String> refreshes = new ArrayList<>();

    /**
     * Source matching the given host:port pairs and recording every probe.
     */
    private CredentialSource source(OAuth2ClientParams params, String... matches) {
        Set<String> keys = Set.of(matches);
        return (host, user, port) -> {
            probes.add(host + ":" + port);
            return keys.contains(host + ":" + port) ? Optional.of(params) : Optional.empty();
        };
    }

    private TokenEndpointClient tokens(String accessToken) {
        return new TokenEndpointClient(request -> {
            refreshes.add(request.getUrl());
            return ("{\"access_token\":\"" + accessToken + "\"}").getBytes(StandardCharsets.UTF_8);
        });
    }

    @Test
    void resolveSingleCandidate() throws CredentialsConfigException, TokenExchangeException {
        CredentialResolver resolver = new CredentialResolver(source(PARAMS, "imap.gmail.com:993"), tokens("ya29.stub"));

        AuthenticationRecord record = resolver.resolve("imap.gmail.com", "tony@example.com", "993").orElseThrow();

        assertEquals(new AuthenticationRecord("imap.gmail.com", "993", "tony@example.com", "ya29.stub"), record);
        assertEquals(List.of("https://oauth2.example.com/token"), refreshes);
    }

    @Test
    void probesRowMajor() throws CredentialsConfigException, TokenExchangeException {
        CredentialResolver resolver = new CredentialResolver(source(PARAMS), tokens("ya29.stub"));

        Optional<AuthenticationRecord> record = resolver.resolve(List.of("a", "b"), "tony", List.of("1", "2", "3"));

        assertTrue(record.isEmpty());
        assertEquals(List.of("a:1", "a:2", "a:3", "b:1", "b:2", "b:3"), probes);
        assertTrue(refreshes.isEmpty());
    }

    @Test
    void stopsAtFirstMatch() throws CredentialsConfigException, TokenExchangeException {
        CredentialResolver resolver = new CredentialResolver(source(PARAMS, "b:1", "b:2"), tokens("ya29.stub"));

        AuthenticationRecord record = resolver.resolve(List.of("a", "b"), "tony", List.of("1", "2")).orElseThrow();

        assertEquals("b", record.host());
        assertEquals("1", record.port());
        assertEquals(List.of("a:1", "a:2", "b:1"), probes);
        assertEquals(1, refreshes.size());
    }

    @Test
    void tokenFailureStopsProbing() {
        TokenEndpointClient failing = new TokenEndpointClient(request -> {
            throw new IOException("Connection reset");
        });
        CredentialResolver resolver = new CredentialResolver(source(PARAMS, "a:1", "a:2"), failing);

        assertThrows(TokenExchangeException.class, () -> resolver.resolve(List.of("a"), "tony", List.of("1", "2")));
        assertEquals(List.of("a:1"), probes);
    }

    @Test
    void invalidTokenUrlIsTokenFailure() throws CredentialsConfigException {
        CredentialResolver resolver = new CredentialResolver(
                new StaticSource(new OAuth2ClientParams("oauth2.googleapis.com/token", "c", "s", "r", "tony")),
                new TokenEndpointClient(new OkHttpTokenTransport()));

        TokenExchangeException e = assertThrows(TokenExchangeException.class,
                () -> resolver.resolve(List.of("a"), null, List.of("993")));

        assertEquals("oauth2.googleapis.com/token", e.getTokenUrl());
        assertTrue(e.getMessage().contains("Invalid token URL"));
    }

    @Test
    void sourceFailurePropagates() {
        CredentialResolver resolver = new CredentialResolver((host, user, port) -> {
            throw new CredentialsConfigException("Credentials file must be encrypted (.gpg): /tmp/a");
        }, tokens("ya29.stub"));

        assertThrows(CredentialsConfigException.class, () -> resolver.resolve("a", "tony", "1"));
    }

    @Test
    void userOverrideWhenQueryHasNone() throws CredentialsConfigException, TokenExchangeException {
        OAuth2ClientParams params = new OAuth2ClientParams("https://t", "c", "s", "r", "override@example.com");
        CredentialResolver resolver = new CredentialResolver(source(params, "a:1"), tokens("ya29.stub"));

        assertEquals("override@example.com", resolver.resolve("a", null, "1").orElseThrow().user());
        assertEquals("override@example.com", resolver.resolve("a", "", "1").orElseThrow().user());
        assertEquals("tony@example.com", resolver.resolve("a", "tony@example.com", "1").orElseThrow().user());
    }

    @Test
    void matchWithoutUserIsSkipped() throws CredentialsConfigException, TokenExchangeException {
        OAuth2ClientParams named = new OAuth2ClientParams("https://t", "c", "s", "r", "named@example.com");
        CredentialResolver resolver = new CredentialResolver((host, user, port) -> {
            probes.add(host + ":" + port);
            return Optional.of("2".equals(port) ? named : PARAMS);
        }, tokens("ya29.stub"));

        AuthenticationRecord record = resolver.resolve(List.of("a"), null, List.of("1", "2")).orElseThrow();

        assertEquals("2", record.port());
        assertEquals("named@example.com", record.user());
        assertEquals(1, refreshes.size());
    }

    @Test
    void resolveIsRepeatable() throws CredentialsConfigException, TokenExchangeException {
        CredentialResolver resolver = new CredentialResolver(source(PARAMS, "a:1"), tokens("ya29.stub"));

        AuthenticationRecord first = resolver.resolve("a", "tony", "1").orElseThrow();
        AuthenticationRecord second = resolver.resolve("a", "tony", "1").orElseThrow();

        assertEquals(first.host(), second.host());
        assertEquals(first.port(), second.port());
        assertEquals(first.user(), second.user());
        assertEquals(2, refreshes.size());
    }

    @Test
    void snapshotTakenOncePerResolve() throws CredentialsConfigException, TokenExchangeException {
        int[] snapshots = {0};
        CredentialSource source = new CredentialSource() {
            @Override
            public Optional<OAuth2ClientParams> fetch(String host, String user, String port) {
                return Optional.empty();
            }

            @Override
            public CredentialSource snapshot() {
                snapshots[0]++;
                return this;
            }
        };

        new CredentialResolver(source, tokens("x")).resolve(List.of("a", "b"), "tony", List.of("1", "2"));

        assertEquals(1, snapshots[0]);
    }

    @Test
    void toStringOmitsSecret() {
        AuthenticationRecord record = new AuthenticationRecord("a", "1", "tony", "ya29.secret");

        assertFalse(record.toString().contains("ya29.secret"));
    }

    @Test
    void fromConfig() throws CredentialsConfigException {
        Map<String, Object> source = new HashMap<>();
        source.put("type", "static");
        source.put("tokenUrl", "https://t");
        source.put("clientId", "c");
        source.put("clientSecret", "s");
        source.put("refreshToken", "r");

        assertNotNull(new CredentialResolver(new AuthSourceConfig(Map.of("source", source))));
    }
}
