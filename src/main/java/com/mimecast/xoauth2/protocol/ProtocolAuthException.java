package com.mimecast.xoauth2.protocol;

import com.mimecast.xoauth2.AuthSourceException;

/**
 * Thrown when a protocol server rejects an XOAUTH2 exchange.
 */
public class ProtocolAuthException extends AuthSourceException {

    /**
     * Reply code, or -1 if the protocol has none.
     */
    private final int replyCode;

    /**
     * Raw server reply.
     */
    private final String reply;

    /**
     * Constructs a new ProtocolAuthException.
     *
     * @param replyCode Reply code.
     * @param reply     Server reply.
     */
    public ProtocolAuthException(int replyCode, String reply) {
        super("Authentication rejected: " + reply);
        this.replyCode = replyCode;
        this.reply = reply;
    }

    /**
     * Constructs a new ProtocolAuthException without a reply code.
     *
     * @param reply Server reply.
     */
    public ProtocolAuthException(String reply) {
        this(-1, reply);
    }

    /**
     * Gets reply code.
     *
     * @return Integer.
     */
    public int getReplyCode() {
        return replyCode;
    }

    /**
     * Gets server reply.
     *
     * @return String.
     */
    public String getReply() {
        return reply;
    }
}
