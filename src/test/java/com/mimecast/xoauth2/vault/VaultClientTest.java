package com.mimecast.xoauth2.vault;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VaultClient.
 * <p>These tests share one mock server so they run serially.
 */
@ExtendWith(VaultClientMockExtension.class)
@Execution(ExecutionMode.SAME_THREAD)
class VaultClientTest {

    private static VaultClient client(String token) {
        return new VaultClient.Builder()
                .withAddress(VaultClientMockExtension.getAddress())
                .withToken(token)
                .build();
    }

    @Test
    void readSecretsKvV2() throws VaultClient.VaultException {
        Optional<Map<String, String>> secrets = client(VaultClientMockExtension.TOKEN)
                .readSecrets("secret/data/xoauth2/imap.gmail.com/tony@example.com");

        assertTrue(secrets.isPresent());
        assertEquals(4, secrets.get().size());
        assertEquals("gmail-client", secrets.get().get("xoauth2_client_id"));
        assertFalse(secrets.get().containsKey("scopes"));
    }

    @Test
    void readSecretsKvV1() throws VaultClient.VaultException {
        Optional<Map<String, String>> secrets = client(VaultClientMockExtension.TOKEN)
                .readSecrets("kv/xoauth2/outlook.office365.com");

        assertTrue(secrets.isPresent());
        assertEquals("ms-client", secrets.get().get("xoauth2_client_id"));
    }

    @Test
    void readSecretsNotFound() throws VaultClient.VaultException {
        assertTrue(client(VaultClientMockExtension.TOKEN).readSecrets("secret/data/xoauth2/nowhere").isEmpty());
    }

    @Test
    void readSecretsForbidden() {
        VaultClient.VaultException e = assertThrows(VaultClient.VaultException.class,
                () -> client("wrong").readSecrets("secret/data/xoauth2/imap.gmail.com/tony@example.com"));

        assertTrue(e.getMessage().contains("403"));
    }

    @Test
    void readSecretsServerError() {
        assertThrows(VaultClient.VaultException.class,
                () -> client(VaultClientMockExtension.TOKEN).readSecrets("secret/data/broken"));
    }

    @Test
    void builderRequiresAddressAndToken() {
        assertThrows(NullPointerException.class, () -> new VaultClient.Builder().withToken("t").build());
        assertThrows(NullPointerException.class, () -> new VaultClient.Builder().withAddress("http://localhost").build());
    }
}
