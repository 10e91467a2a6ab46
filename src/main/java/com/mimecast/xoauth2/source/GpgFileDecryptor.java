package com.mimecast.xoauth2.source;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * GnuPG file decryptor.
 * <p>Runs the gpg binary in batch mode and captures the plaintext from stdout.
 * <p>Key selection and passphrase prompting are left to the user's gpg-agent.
 */
public class GpgFileDecryptor implements FileDecryptor {
    private static final Logger log = LogManager.getLogger(GpgFileDecryptor.class);

    private final String binary;

    /**
     * Constructs a new GpgFileDecryptor instance using gpg from PATH.
     */
    public GpgFileDecryptor() {
        this("gpg");
    }

    /**
     * Constructs a new GpgFileDecryptor instance.
     *
     * @param binary Path to gpg binary.
     */
    public GpgFileDecryptor(String binary) {
        this.binary = StringUtils.defaultIfBlank(binary, "gpg");
    }

    @Override
    public byte[] decrypt(Path path) throws IOException {
        List<String> command = Arrays.asList(binary, "--batch", "--quiet", "--decrypt", path.toString());
        log.debug("Running command: {}", command);

        Triple<Integer, byte[], String> result;
        try {
            result = runGpg(command);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted decrypting " + path, e);
        }

        if (result.getLeft() != 0) {
            throw new IOException("gpg exited with " + result.getLeft() + " decrypting " + path + ": " +
                    StringUtils.abbreviate(StringUtils.trim(result.getRight()), 500));
        }

        return result.getMiddle();
    }

    /**
     * Runs gpg.
     *
     * @param command Command line.
     * @return Triple of exit code, stdout bytes and stderr string.
     * @throws IOException          On I/O errors.
     * @throws InterruptedException On process interruption.
     */
    protected Triple<Integer, byte[], String> runGpg(List<String> command) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        Process process = pb.start();
        process.getOutputStream().close();

        byte[] output = process.getInputStream().readAllBytes();
        String error = new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8);

        int exitCode = process.waitFor();

        return Triple.of(exitCode, output, error);
    }
}
