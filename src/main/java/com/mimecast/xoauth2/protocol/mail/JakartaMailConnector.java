package com.mimecast.xoauth2.protocol.mail;

import com.mimecast.xoauth2.resolver.AuthenticationRecord;
import com.mimecast.xoauth2.sasl.SaslXoauth2Encoder;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.Transport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Jakarta Mail connector for resolved XOAUTH2 records.
 *
 * <p>Builds session properties that leave XOAUTH2 as the only enabled mechanism and
 * <br>passes the access token as the password, which Jakarta Mail wraps in the SASL response.
 *
 * <p>Usage example:
 * <pre>
 * AuthenticationRecord record = resolver.resolve("imap.gmail.com", "tony@example.com", "993").orElseThrow();
 * try (Store store = JakartaMailConnector.connectStore(record)) {
 *     Folder inbox = store.getFolder("INBOX");
 * }
 * </pre>
 * <p>
 * Notes:
 * - Port 993 selects imaps and port 465 selects smtps.
 * - Port 587 enables STARTTLS for SMTP.
 */
public class JakartaMailConnector {
    private static final Logger log = LogManager.getLogger(JakartaMailConnector.class);

    /**
     * Well-known service names accepted in place of port numbers.
     */
    private static final Map<String, Integer> SERVICES = Map.of(
            "imap", 143,
            "imaps", 993,
            "smtp", 25,
            "submission", 587,
            "smtps", 465);

    /**
     * Private constructor to prevent instantiation.
     */
    private JakartaMailConnector() {
        // Utility class.
    }

    /**
     * Builds Jakarta Mail session properties for IMAP/IMAPS.
     *
     * @param record AuthenticationRecord instance.
     * @return Properties instance.
     */
    public static Properties imapProperties(AuthenticationRecord record) {
        int port = portNumber(record.port());
        String protocol = port == 993 ? "imaps" : "imap";
        String prefix = "mail." + protocol + ".";

        Properties props = new Properties();
        props.put("mail.store.protocol", protocol);
        props.put(prefix + "host", record.host());
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "auth.mechanisms", SaslXoauth2Encoder.MECHANISM);
        props.put(prefix + "auth.login.disable", "true");
        props.put(prefix + "auth.plain.disable", "true");
        if (port != 993) {
            props.put(prefix + "starttls.enable", "true");
        }
        return props;
    }

    /**
     * Builds Jakarta Mail session properties for SMTP/SMTPS.
     *
     * @param record AuthenticationRecord instance.
     * @return Properties instance.
     */
    public static Properties smtpProperties(AuthenticationRecord record) {
        int port = portNumber(record.port());
        String protocol = port == 465 ? "smtps" : "smtp";
        String prefix = "mail." + protocol + ".";

        Properties props = new Properties();
        props.put("mail.transport.protocol", protocol);
        props.put(prefix + "host", record.host());
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "auth", "true");
        props.put(prefix + "auth.mechanisms", SaslXoauth2Encoder.MECHANISM);
        if (port == 587) {
            props.put(prefix + "starttls.enable", "true");
            props.put(prefix + "starttls.required", "true");
        }
        return props;
    }

    /**
     * Connects an IMAP store.
     *
     * @param record AuthenticationRecord instance.
     * @return Connected Store, closed by the caller.
     * @throws MessagingException Unable to connect or authenticate.
     */
    public static Store connectStore(AuthenticationRecord record) throws MessagingException {
        Properties props = imapProperties(record);
        Store store = Session.getInstance(props).getStore(props.getProperty("mail.store.protocol"));
        store.connect(record.host(), portNumber(record.port()), record.user(), record.secret());
        log.debug("IMAP store connected for {} on {}", record.user(), record.host());
        return store;
    }

    /**
     * Connects an SMTP transport.
     *
     * @param record AuthenticationRecord instance.
     * @return Connected Transport, closed by the caller.
     * @throws MessagingException Unable to connect or authenticate.
     */
    public static Transport connectTransport(AuthenticationRecord record) throws MessagingException {
        Properties props = smtpProperties(record);
        Transport transport = Session.getInstance(props).getTransport(props.getProperty("mail.transport.protocol"));
        transport.connect(record.host(), portNumber(record.port()), record.user(), record.secret());
        log.debug("SMTP transport connected for {} on {}", record.user(), record.host());
        return transport;
    }

    /**
     * Converts a port or service name to a port number.
     *
     * @param port Port number or service name.
     * @return Port number.
     * @throws IllegalArgumentException Unknown service name.
     */
    static int portNumber(String port) {
        Integer service = SERVICES.get(port.toLowerCase(Locale.ROOT));
        if (service != null) {
            return service;
        }

        try {
            return Integer.parseInt(port);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown port or service: " + port, e);
        }
    }
}
