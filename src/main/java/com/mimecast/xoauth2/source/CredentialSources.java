package com.mimecast.xoauth2.source;

import com.mimecast.xoauth2.config.SourceConfig;
import com.mimecast.xoauth2.config.VaultConfig;
import com.mimecast.xoauth2.store.PassSecretStore;
import com.mimecast.xoauth2.store.VaultSecretStore;
import com.mimecast.xoauth2.vault.VaultClient;
import com.mimecast.xoauth2.vault.VaultClientFactory;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Builds the configured credential source.
 *
 * <p>The variant is chosen once here and never re-dispatched per lookup.
 */
public class CredentialSources {
    private static final Logger log = LogManager.getLogger(CredentialSources.class);

    /**
     * Private constructor to prevent instantiation.
     */
    private CredentialSources() {
        // Utility class.
    }

    /**
     * Creates a CredentialSource from configuration.
     *
     * @param config SourceConfig instance.
     * @return CredentialSource instance.
     * @throws CredentialsConfigException Unknown type or incomplete settings.
     */
    public static CredentialSource fromConfig(SourceConfig config) throws CredentialsConfigException {
        String type = config.getType();
        log.debug("Configuring credential source: {}", type);

        switch (type) {
            case "static":
                return new StaticSource(config.getStaticParams());

            case "file":
                if (StringUtils.isBlank(config.getPath())) {
                    throw new CredentialsConfigException("File credential source missing required field: path");
                }
                return new FileSource(Paths.get(config.getPath()), new GpgFileDecryptor(config.getGpgBinary()));

            case "pass":
                return new PasswordStoreSource(new PassSecretStore(config.getPassBinary(), config.getEntryTemplate()));

            case "vault":
                return new PasswordStoreSource(vaultStore(config.getVault()));

            case "function":
                return new FunctionSource(loadFunction(config.getFunctionClass()));

            default:
                throw new CredentialsConfigException("Unknown credential source type: " + type);
        }
    }

    private static VaultSecretStore vaultStore(VaultConfig config) throws CredentialsConfigException {
        if (StringUtils.isBlank(config.getToken())) {
            throw new CredentialsConfigException("Vault credential source missing required field: token");
        }

        try {
            VaultClient client = VaultClientFactory.createFromConfig(config);
            return new VaultSecretStore(client, config.getPathTemplate());
        } catch (IOException e) {
            throw new CredentialsConfigException("Invalid Vault credential source: " + e.getMessage(), e);
        }
    }

    /**
     * Instantiates a CredentialFunction by class name.
     *
     * @param className Fully qualified class name with a public no-arg constructor.
     * @return CredentialFunction instance.
     * @throws CredentialsConfigException Class missing, wrong type or not instantiable.
     */
    static CredentialFunction loadFunction(String className) throws CredentialsConfigException {
        if (StringUtils.isBlank(className)) {
            throw new CredentialsConfigException("Function credential source missing required field: class");
        }

        try {
            return Class.forName(className)
                    .asSubclass(CredentialFunction.class)
                    .getDeclaredConstructor()
                    .newInstance();
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new CredentialsConfigException("Unable to load credential function " + className + ": " + e, e);
        }
    }
}
