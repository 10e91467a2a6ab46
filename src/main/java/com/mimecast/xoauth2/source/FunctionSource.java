package com.mimecast.xoauth2.source;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Credential source delegating to a {@link CredentialFunction}.
 *
 * <p>Null or incomplete results are treated as no match.
 */
public class FunctionSource implements CredentialSource {
    private static final Logger log = LogManager.getLogger(FunctionSource.class);

    private final CredentialFunction function;

    /**
     * Constructs a new FunctionSource instance.
     *
     * @param function CredentialFunction instance.
     */
    public FunctionSource(CredentialFunction function) {
        this.function = Objects.requireNonNull(function, "function must not be null");
    }

    @Override
    public Optional<OAuth2ClientParams> fetch(String host, String user, String port) throws CredentialsConfigException {
        OAuth2ClientParams params = function.apply(host, user, port);
        if (params == null) {
            return Optional.empty();
        }

        if (!params.isComplete()) {
            log.debug("Resolver result for {}:{} lacks {}, treating as no match", host, port, params.missingFields());
            return Optional.empty();
        }

        return Optional.of(params);
    }
}
