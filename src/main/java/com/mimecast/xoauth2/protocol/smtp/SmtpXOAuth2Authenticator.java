package com.mimecast.xoauth2.protocol.smtp;

import com.mimecast.xoauth2.protocol.ProtocolAuthException;
import com.mimecast.xoauth2.resolver.AuthenticationRecord;
import com.mimecast.xoauth2.sasl.SaslXoauth2Encoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * SMTP XOAUTH2 authenticator.
 *
 * <p>Sends <code>AUTH XOAUTH2 {initial-response}</code> and requires a 235 reply.
 * <br>Rejections reach the caller as raised by the session.
 *
 * @see <a href="https://tools.ietf.org/html/rfc4954">RFC 4954 - SMTP AUTH</a>
 */
public class SmtpXOAuth2Authenticator {
    private static final Logger log = LogManager.getLogger(SmtpXOAuth2Authenticator.class);

    /**
     * Authentication successful reply code.
     */
    public static final int AUTH_SUCCESS = 235;

    /**
     * Authenticates a session.
     *
     * @param session SmtpSession instance.
     * @param record  AuthenticationRecord instance.
     * @return Server reply.
     * @throws ProtocolAuthException Server rejected the credentials.
     * @throws IOException           Unable to communicate.
     */
    public String authenticate(SmtpSession session, AuthenticationRecord record) throws ProtocolAuthException, IOException {
        String command = "AUTH " + SaslXoauth2Encoder.MECHANISM + " " +
                SaslXoauth2Encoder.encodeToString(record.user(), record.secret());

        String reply = session.sendCommandOrFail(command, AUTH_SUCCESS);
        log.debug("SMTP XOAUTH2 authenticated {} on {}", record.user(), record.host());
        return reply;
    }
}
