package com.mimecast.xoauth2.protocol.imap;

import java.io.IOException;

/**
 * IMAP session collaborator.
 *
 * <p>Implemented by the host IMAP client. Command tagging and framing stay on that side.
 */
public interface ImapSession {

    /**
     * Checks if the server advertised a capability.
     *
     * @param capability Capability name, e.g. <code>SASL-IR</code>.
     * @return Boolean.
     */
    boolean hasCapability(String capability);

    /**
     * Sends an untagged command line and waits for its tagged completion.
     *
     * @param command Command without tag.
     * @return Completion status without tag, e.g. <code>OK AUTHENTICATE completed</code>.
     * @throws IOException Unable to communicate.
     */
    String sendCommand(String command) throws IOException;

    /**
     * Performs the session's regular login.
     *
     * @param user     User name.
     * @param password Password or token.
     * @return true if logged in.
     * @throws IOException Unable to communicate.
     */
    boolean login(String user, String password) throws IOException;
}
