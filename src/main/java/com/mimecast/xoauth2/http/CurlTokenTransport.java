package com.mimecast.xoauth2.http;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * curl transport.
 * <p>Runs the curl binary synchronously and captures stdout as the response body.
 * <p>The form body is written to stdin so client secrets and refresh tokens never show
 * <br>on the process command line.
 */
public class CurlTokenTransport implements TokenTransport {
    private static final Logger log = LogManager.getLogger(CurlTokenTransport.class);

    private final String binary;

    /**
     * Constructs a new CurlTokenTransport instance using curl from PATH.
     */
    public CurlTokenTransport() {
        this("curl");
    }

    /**
     * Constructs a new CurlTokenTransport instance.
     *
     * @param binary Path to curl binary.
     */
    public CurlTokenTransport(String binary) {
        this.binary = StringUtils.defaultIfBlank(binary, "curl");
    }

    @Override
    public byte[] post(HttpRequest request) throws IOException {
        List<String> command = buildCommand(request);
        log.debug("Running command: {} for {}", command, request);

        Triple<Integer, byte[], String> result;
        try {
            result = runCurl(command, request.getFormBody().getBytes(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted calling " + request.getUrl(), e);
        }

        if (result.getLeft() != 0) {
            throw new IOException("curl exited with " + result.getLeft() + ": " +
                    StringUtils.abbreviate(StringUtils.trim(result.getRight()), 500));
        }

        return result.getMiddle();
    }

    /**
     * Builds the curl command line.
     *
     * @param request HttpRequest instance.
     * @return Command list.
     */
    List<String> buildCommand(HttpRequest request) {
        List<String> command = new ArrayList<>(List.of(binary, "--silent", "--show-error", "--request", "POST"));
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            command.add("--header");
            command.add(header.getKey() + ": " + header.getValue());
        }
        command.add("--data-binary");
        command.add("@-");
        command.add(request.getUrl());
        return command;
    }

    /**
     * Runs curl.
     *
     * @param command Command line.
     * @param stdin   Bytes written to curl stdin.
     * @return Triple of exit code, stdout bytes and stderr string.
     * @throws IOException          On I/O errors.
     * @throws InterruptedException On process interruption.
     */
    protected Triple<Integer, byte[], String> runCurl(List<String> command, byte[] stdin) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        Process process = pb.start();

        try (OutputStream input = process.getOutputStream()) {
            input.write(stdin);
        }

        byte[] output = process.getInputStream().readAllBytes();
        String error = new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8);

        int exitCode = process.waitFor();

        return Triple.of(exitCode, output, error);
    }
}
