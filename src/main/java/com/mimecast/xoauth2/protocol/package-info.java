/**
 * Protocol adapters authenticating IMAP and SMTP sessions with a resolved record.
 *
 * <p>The hand-rolled session adapters drive an existing connection through small session interfaces.
 * <br>The Jakarta Mail connector configures a mail session to use XOAUTH2 only.
 */
package com.mimecast.xoauth2.protocol;
