/**
 * XOAUTH2 SASL initial response encoding.
 *
 * @see <a href="https://developers.google.com/gmail/imap/xoauth2-protocol">XOAUTH2 protocol</a>
 */
package com.mimecast.xoauth2.sasl;
