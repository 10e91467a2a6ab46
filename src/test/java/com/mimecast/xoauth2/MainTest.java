package com.mimecast.xoauth2;

import com.mimecast.xoauth2.sasl.SaslXoauth2Encoder;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private Main run(String... args) {
        return new Main(args, new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void usageWithoutArguments() {
        Main main = run();

        assertEquals(Main.EXIT_ERROR, main.getStatus());
        assertTrue(output.toString(StandardCharsets.UTF_8).contains(Main.USAGE));
    }

    private Path staticConfig(MockWebServer server) throws IOException {
        Path config = dir.resolve("auth-source.json5");
        Files.writeString(config, "{ source: { type: 'static', tokenUrl: '" + server.url("/token") + "', "
                + "clientId: 'c', clientSecret: 's', refreshToken: 'r', user: 'tony@example.com' } }");
        return config;
    }

    @Test
    void printsAccessToken() throws IOException {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{\"access_token\":\"ya29.cli\"}"));
            server.start();

            Main main = run("--config", staticConfig(server).toString(), "--host", "imap.example.com", "--port", "993");

            assertEquals(Main.EXIT_OK, main.getStatus());
            assertEquals("ya29.cli", output.toString(StandardCharsets.UTF_8).trim());
        }
    }

    @Test
    void printsSaslResponse() throws IOException {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{\"access_token\":\"ya29.cli\"}"));
            server.start();

            Main main = run("--config", staticConfig(server).toString(), "--host", "imap.example.com", "--port", "993", "--sasl");

            assertEquals(Main.EXIT_OK, main.getStatus());
            assertEquals(SaslXoauth2Encoder.encodeToString("tony@example.com", "ya29.cli"),
                    output.toString(StandardCharsets.UTF_8).trim());
        }
    }

    @Test
    void tokenEndpointError() throws IOException {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"invalid_grant\"}"));
            server.start();

            Main main = run("--config", staticConfig(server).toString(), "--host", "imap.example.com", "--port", "993");

            assertEquals(Main.EXIT_ERROR, main.getStatus());
            assertTrue(output.toString(StandardCharsets.UTF_8).contains("invalid_grant"));
        }
    }

    @Test
    void noMatch() throws IOException {
        Path config = dir.resolve("auth-source.json5");
        Files.writeString(config, "{ source: { type: 'function', class: 'com.mimecast.xoauth2.source.StaticCredentialFunction' } }");

        Main main = run("--config", config.toString(), "--host", "smtp.example.com", "--port", "587");

        assertEquals(Main.EXIT_NO_MATCH, main.getStatus());
    }

    @Test
    void configurationError() throws IOException {
        Path config = dir.resolve("auth-source.json5");
        Files.writeString(config, "{ source: { type: 'file', path: '" + dir.resolve("plain.json5") + "' } }");

        Main main = run("-c", config.toString(), "-h", "imap.example.com", "-p", "993");

        assertEquals(Main.EXIT_ERROR, main.getStatus());
        assertTrue(output.toString(StandardCharsets.UTF_8).contains("must be encrypted"));
    }

    @Test
    void missingConfigFile() {
        Main main = run("-c", dir.resolve("none.json5").toString(), "-h", "imap.example.com", "-p", "993");

        assertEquals(Main.EXIT_ERROR, main.getStatus());
    }
}
