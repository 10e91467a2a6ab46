package com.mimecast.xoauth2.source;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Credential source backed by an encrypted credentials file.
 *
 * <p>The file name must end in {@value #ENCRYPTED_EXTENSION}. Plain files are refused
 * <br>before anything is read so long lived secrets are never kept unencrypted.
 * <p>The file is decrypted and parsed on every {@link #fetch} and once per {@link #snapshot()}.
 *
 * @see CredentialsFile
 */
public class FileSource implements CredentialSource {
    private static final Logger log = LogManager.getLogger(FileSource.class);

    /**
     * Required encrypted file extension.
     */
    public static final String ENCRYPTED_EXTENSION = ".gpg";

    private final Path path;
    private final FileDecryptor decryptor;

    /**
     * Constructs a new FileSource instance.
     *
     * @param path      Credentials file path.
     * @param decryptor FileDecryptor instance.
     */
    public FileSource(Path path, FileDecryptor decryptor) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.decryptor = Objects.requireNonNull(decryptor, "decryptor must not be null");
    }

    /**
     * Gets credentials file path.
     *
     * @return Path instance.
     */
    public Path getPath() {
        return path;
    }

    @Override
    public Optional<OAuth2ClientParams> fetch(String host, String user, String port) throws CredentialsConfigException {
        return load().lookup(host, user, port);
    }

    @Override
    public CredentialSource snapshot() throws CredentialsConfigException {
        CredentialsFile file = load();
        return file::lookup;
    }

    /**
     * Decrypts and parses the credentials file.
     *
     * @return CredentialsFile instance.
     * @throws CredentialsConfigException Wrong extension, decryption or parse failure.
     */
    CredentialsFile load() throws CredentialsConfigException {
        Path fileName = path.getFileName();
        if (fileName == null || !fileName.toString().endsWith(ENCRYPTED_EXTENSION)) {
            throw new CredentialsConfigException("Credentials file must be encrypted (" + ENCRYPTED_EXTENSION + "): " + path);
        }

        byte[] plaintext;
        try {
            plaintext = decryptor.decrypt(path);
        } catch (IOException e) {
            throw new CredentialsConfigException("Unable to decrypt credentials file " + path + ": " + e.getMessage(), e);
        }

        CredentialsFile file = CredentialsFile.parse(plaintext, path.toString());
        log.debug("Loaded credentials file {} ({})", path, file.isMapping() ? "mapping" : "single record");
        return file;
    }
}
