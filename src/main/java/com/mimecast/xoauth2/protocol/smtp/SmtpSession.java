package com.mimecast.xoauth2.protocol.smtp;

import com.mimecast.xoauth2.protocol.ProtocolAuthException;

import java.io.IOException;

/**
 * SMTP session collaborator.
 */
public interface SmtpSession {

    /**
     * Sends a command and checks the reply code.
     *
     * @param command           Command line.
     * @param expectedReplyCode Expected reply code.
     * @return Server reply.
     * @throws ProtocolAuthException Reply code differs from expected.
     * @throws IOException           Unable to communicate.
     */
    String sendCommandOrFail(String command, int expectedReplyCode) throws ProtocolAuthException, IOException;
}
