package com.mimecast.xoauth2.store;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * password-store (<code>pass</code>) backed secret store.
 *
 * <p>Entries are decrypted with <code>pass show</code>. The first line holds the password
 * <br>and every following <code>name: value</code> line becomes a field:
 * <pre>
 * app-password
 * xoauth2_token_url: https://oauth2.googleapis.com/token
 * xoauth2_client_id: 1234.apps.googleusercontent.com
 * xoauth2_client_secret: ...
 * xoauth2_refresh_token: ...
 * </pre>
 */
public class PassSecretStore implements SecretStore {
    private static final Logger log = LogManager.getLogger(PassSecretStore.class);

    private static final String NOT_FOUND = "is not in the password store";

    private final String binary;
    private final EntryTemplate entryTemplate;

    /**
     * Constructs a new PassSecretStore instance.
     *
     * @param binary        Path to pass binary.
     * @param entryTemplate Entry name template.
     */
    public PassSecretStore(String binary, String entryTemplate) {
        this.binary = StringUtils.defaultIfBlank(binary, "pass");
        this.entryTemplate = new EntryTemplate(StringUtils.defaultIfBlank(entryTemplate, "{host}/{user}"));
    }

    @Override
    public Optional<SecretEntry> find(String host, String user) throws IOException {
        return show(entryTemplate.expand(host, user, null));
    }

    @Override
    public Optional<SecretEntry> find(String host, String user, String port) throws IOException {
        if (!entryTemplate.usesPort()) {
            return find(host, user);
        }
        return show(entryTemplate.expand(host, user, port));
    }

    private Optional<SecretEntry> show(String entry) throws IOException {
        List<String> command = Arrays.asList(binary, "show", entry);
        log.debug("Running command: {}", command);

        Triple<Integer, String, String> result;
        try {
            result = runPass(command);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted reading pass entry " + entry, e);
        }

        if (result.getLeft() != 0) {
            if (result.getRight().contains(NOT_FOUND)) {
                log.debug("No pass entry: {}", entry);
                return Optional.empty();
            }
            throw new IOException("pass exited with " + result.getLeft() + " for " + entry + ": " +
                    StringUtils.abbreviate(StringUtils.trim(result.getRight()), 500));
        }

        return Optional.of(new SecretEntry(entry, parseFields(result.getMiddle())));
    }

    /**
     * Parses entry fields, skipping the password line.
     *
     * @param content Decrypted entry.
     * @return Map of field name to value.
     */
    static Map<String, String> parseFields(String content) {
        Map<String, String> fields = new LinkedHashMap<>();
        String[] lines = content.split("\\r?\\n");
        for (int i = 1; i < lines.length; i++) {
            int colon = lines[i].indexOf(':');
            if (colon > 0) {
                fields.putIfAbsent(lines[i].substring(0, colon).trim(), lines[i].substring(colon + 1).trim());
            }
        }
        return fields;
    }

    /**
     * Runs pass.
     *
     * @param command Command line.
     * @return Triple of exit code, stdout and stderr.
     * @throws IOException          On I/O errors.
     * @throws InterruptedException On process interruption.
     */
    protected Triple<Integer, String, String> runPass(List<String> command) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        Process process = pb.start();
        process.getOutputStream().close();

        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        String error = new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8);

        int exitCode = process.waitFor();

        return Triple.of(exitCode, output, error);
    }
}
