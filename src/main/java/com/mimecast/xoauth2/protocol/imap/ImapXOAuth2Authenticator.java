package com.mimecast.xoauth2.protocol.imap;

import com.mimecast.xoauth2.resolver.AuthenticationRecord;
import com.mimecast.xoauth2.sasl.SaslXoauth2Encoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * IMAP XOAUTH2 authenticator.
 *
 * <p>Sends <code>AUTHENTICATE XOAUTH2 {initial-response}</code> in one line when XOAUTH2 was
 * <br>negotiated and the server advertises both <code>AUTH=XOAUTH2</code> and <code>SASL-IR</code>.
 * <br>Anything else falls back to the session's regular login.
 *
 * @see <a href="https://tools.ietf.org/html/rfc4959">RFC 4959 - IMAP SASL-IR</a>
 */
public class ImapXOAuth2Authenticator {
    private static final Logger log = LogManager.getLogger(ImapXOAuth2Authenticator.class);

    public static final String CAPABILITY_AUTH = "AUTH=" + SaslXoauth2Encoder.MECHANISM;
    public static final String CAPABILITY_SASL_IR = "SASL-IR";

    /**
     * Authenticates a session.
     *
     * @param session   ImapSession instance.
     * @param mechanism Negotiated authenticator name.
     * @param record    AuthenticationRecord instance.
     * @return true if authenticated.
     * @throws IOException Unable to communicate.
     */
    public boolean authenticate(ImapSession session, String mechanism, AuthenticationRecord record) throws IOException {
        if (!isApplicable(session, mechanism)) {
            log.debug("XOAUTH2 not applicable for {}, using regular login", record.host());
            return session.login(record.user(), record.secret());
        }

        String command = "AUTHENTICATE " + SaslXoauth2Encoder.MECHANISM + " " +
                SaslXoauth2Encoder.encodeToString(record.user(), record.secret());

        String status = session.sendCommand(command);
        boolean ok = status != null && status.regionMatches(true, 0, "OK", 0, 2);

        if (ok) {
            log.debug("IMAP XOAUTH2 authenticated {} on {}", record.user(), record.host());
        } else {
            log.debug("IMAP XOAUTH2 rejected for {} on {}: {}", record.user(), record.host(), status);
        }
        return ok;
    }

    /**
     * Checks if the XOAUTH2 path applies.
     *
     * @param session   ImapSession instance.
     * @param mechanism Negotiated authenticator name.
     * @return Boolean.
     */
    boolean isApplicable(ImapSession session, String mechanism) {
        return SaslXoauth2Encoder.MECHANISM.equalsIgnoreCase(mechanism) &&
                session.hasCapability(CAPABILITY_AUTH) &&
                session.hasCapability(CAPABILITY_SASL_IR);
    }
}
