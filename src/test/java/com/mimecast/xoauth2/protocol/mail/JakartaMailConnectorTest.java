package com.mimecast.xoauth2.protocol.mail;

import com.mimecast.xoauth2.resolver.AuthenticationRecord;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class JakartaMailConnectorTest {

    private static AuthenticationRecord record(String host, String port) {
        return new AuthenticationRecord(host, port, "tony@example.com", "ya29.token");
    }

    @Test
    void imapsProperties() {
        Properties props = JakartaMailConnector.imapProperties(record("imap.gmail.com", "993"));

        assertEquals("imaps", props.getProperty("mail.store.protocol"));
        assertEquals("imap.gmail.com", props.getProperty("mail.imaps.host"));
        assertEquals("993", props.getProperty("mail.imaps.port"));
        assertEquals("XOAUTH2", props.getProperty("mail.imaps.auth.mechanisms"));
        assertEquals("true", props.getProperty("mail.imaps.auth.plain.disable"));
        assertNull(props.getProperty("mail.imaps.starttls.enable"));
    }

    @Test
    void imapServiceNameProperties() {
        Properties props = JakartaMailConnector.imapProperties(record("imap.example.com", "imap"));

        assertEquals("imap", props.getProperty("mail.store.protocol"));
        assertEquals("143", props.getProperty("mail.imap.port"));
        assertEquals("true", props.getProperty("mail.imap.starttls.enable"));
    }

    @Test
    void submissionProperties() {
        Properties props = JakartaMailConnector.smtpProperties(record("smtp.gmail.com", "587"));

        assertEquals("smtp", props.getProperty("mail.transport.protocol"));
        assertEquals("true", props.getProperty("mail.smtp.auth"));
        assertEquals("XOAUTH2", props.getProperty("mail.smtp.auth.mechanisms"));
        assertEquals("true", props.getProperty("mail.smtp.starttls.required"));
    }

    @Test
    void smtpsProperties() {
        Properties props = JakartaMailConnector.smtpProperties(record("smtp.gmail.com", "smtps"));

        assertEquals("smtps", props.getProperty("mail.transport.protocol"));
        assertEquals("465", props.getProperty("mail.smtps.port"));
        assertNull(props.getProperty("mail.smtps.starttls.enable"));
    }

    @Test
    void serviceNameIgnoresDefaultLocale() {
        Locale locale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(993, JakartaMailConnector.portNumber("IMAPS"));
            assertEquals(587, JakartaMailConnector.portNumber("SUBMISSION"));
        } finally {
            Locale.setDefault(locale);
        }
    }

    @Test
    void unknownService() {
        assertThrows(IllegalArgumentException.class, () -> JakartaMailConnector.portNumber("gopher"));
    }
}
