package com.mimecast.xoauth2.source;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decrypts an at-rest credentials file to its plaintext bytes.
 *
 * @see GpgFileDecryptor
 */
@FunctionalInterface
public interface FileDecryptor {

    /**
     * Decrypts a file.
     *
     * @param path File path.
     * @return Plaintext bytes.
     * @throws IOException Unable to read or decrypt.
     */
    byte[] decrypt(Path path) throws IOException;
}
