package com.mimecast.xoauth2.resolver;

import com.mimecast.xoauth2.config.AuthSourceConfig;
import com.mimecast.xoauth2.source.CredentialSource;
import com.mimecast.xoauth2.source.CredentialSources;
import com.mimecast.xoauth2.source.CredentialsConfigException;
import com.mimecast.xoauth2.source.OAuth2ClientParams;
import com.mimecast.xoauth2.token.TokenEndpointClient;
import com.mimecast.xoauth2.token.TokenExchangeException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves XOAUTH2 authentication records.
 *
 * <p>Probes hosts by ports in row-major order and stops at the first pair the credential
 * <br>source matches with a usable user. That pair's refresh token is then exchanged.
 *
 * <p>Outcomes:
 * <ul>
 *     <li>No pair matches: empty, so the caller can try another backend.</li>
 *     <li>A pair matches and the exchange fails: {@link TokenExchangeException}. Later pairs are not probed.</li>
 *     <li>The source is misconfigured: {@link CredentialsConfigException}.</li>
 * </ul>
 *
 * <p>Holds no mutable state. Concurrent resolutions are independent.
 */
public class CredentialResolver {
    private static final Logger log = LogManager.getLogger(CredentialResolver.class);

    private final CredentialSource source;
    private final TokenEndpointClient tokenClient;

    /**
     * Constructs a new CredentialResolver instance.
     *
     * @param source      CredentialSource instance.
     * @param tokenClient TokenEndpointClient instance.
     */
    public CredentialResolver(CredentialSource source, TokenEndpointClient tokenClient) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.tokenClient = Objects.requireNonNull(tokenClient, "tokenClient must not be null");
    }

    /**
     * Constructs a new CredentialResolver instance from configuration.
     *
     * @param config AuthSourceConfig instance.
     * @throws CredentialsConfigException Source configuration is invalid.
     */
    public CredentialResolver(AuthSourceConfig config) throws CredentialsConfigException {
        this(CredentialSources.fromConfig(config.getSource()), TokenEndpointClient.fromConfig(config.getTransport()));
    }

    /**
     * Resolves a single identity.
     *
     * @param host Host name.
     * @param user User name, may be null or empty.
     * @param port Port or service name.
     * @return Optional of AuthenticationRecord.
     * @throws CredentialsConfigException Source is misconfigured.
     * @throws TokenExchangeException     Credentials matched but the exchange failed.
     */
    public Optional<AuthenticationRecord> resolve(String host, String user, String port)
            throws CredentialsConfigException, TokenExchangeException {
        return resolve(Collections.singletonList(host), user, Collections.singletonList(port));
    }

    /**
     * Resolves the first matching identity.
     *
     * @param hosts Candidate hosts in probing order.
     * @param user  User name, may be null or empty.
     * @param ports Candidate ports in probing order.
     * @return Optional of AuthenticationRecord.
     * @throws CredentialsConfigException Source is misconfigured.
     * @throws TokenExchangeException     Credentials matched but the exchange failed.
     */
    public Optional<AuthenticationRecord> resolve(List<String> hosts, String user, List<String> ports)
            throws CredentialsConfigException, TokenExchangeException {
        CredentialSource lookup = source.snapshot();

        for (String host : hosts) {
            for (String port : ports) {
                log.debug("Probing credentials for host: {} user: {} port: {}", host, user, port);

                Optional<OAuth2ClientParams> params = lookup.fetch(host, user, port);
                if (params.isEmpty()) {
                    continue;
                }

                String effectiveUser = StringUtils.isNotEmpty(user) ? user : params.get().userOverride();
                if (StringUtils.isEmpty(effectiveUser)) {
                    log.debug("Credentials for {}:{} name no user, skipping", host, port);
                    continue;
                }

                String accessToken = tokenClient.refresh(params.get());
                AuthenticationRecord record = new AuthenticationRecord(host, port, effectiveUser, accessToken);
                log.debug("Resolved {}", record);
                return Optional.of(record);
            }
        }

        log.debug("No credentials for hosts: {} user: {} ports: {}", hosts, user, ports);
        return Optional.empty();
    }
}
