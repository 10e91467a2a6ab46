package com.mimecast.xoauth2.sasl;

import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;

/**
 * XOAUTH2 SASL initial response encoder.
 *
 * <p>Unencoded form: <code>user={user}^Aauth=Bearer {token}^A^A</code> where ^A is 0x01.
 * <br>The result is base64 encoded on a single line.
 *
 * @see <a href="https://developers.google.com/gmail/imap/xoauth2-protocol">XOAUTH2 Mechanism</a>
 */
public class SaslXoauth2Encoder {

    /**
     * Mechanism name.
     */
    public static final String MECHANISM = "XOAUTH2";

    /**
     * SASL field separator.
     */
    private static final char CTRL_A = '\001';

    /**
     * Private constructor to prevent instantiation.
     */
    private SaslXoauth2Encoder() {
        // Utility class.
    }

    /**
     * Builds the unencoded initial response.
     *
     * @param user        User name.
     * @param accessToken Bearer access token.
     * @return Raw bytes.
     */
    public static byte[] initialResponse(String user, String accessToken) {
        return ("user=" + user + CTRL_A + "auth=Bearer " + accessToken + CTRL_A + CTRL_A)
                .getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Builds the base64 encoded initial response.
     *
     * @param user        User name.
     * @param accessToken Bearer access token.
     * @return Base64 ASCII bytes, unwrapped.
     */
    public static byte[] encode(String user, String accessToken) {
        return Base64.encodeBase64(initialResponse(user, accessToken), false);
    }

    /**
     * Builds the base64 encoded initial response as a string.
     *
     * @param user        User name.
     * @param accessToken Bearer access token.
     * @return Base64 string, unwrapped.
     */
    public static String encodeToString(String user, String accessToken) {
        return new String(encode(user, accessToken), StandardCharsets.US_ASCII);
    }
}
