/**
 * Credential sources.
 *
 * <p>A source answers which static OAuth2 client parameters apply to an identity.
 * <br>The variant is picked once from configuration by {@link com.mimecast.xoauth2.source.CredentialSources}.
 *
 * <p>The following sources are supported:
 * <ul>
 *     <li>static - one literal record matching everything</li>
 *     <li>function - a user supplied {@link com.mimecast.xoauth2.source.CredentialFunction}</li>
 *     <li>file - a GnuPG encrypted JSON5 record or mapping</li>
 *     <li>pass / vault - a secret store entry holding <code>xoauth2_*</code> fields</li>
 * </ul>
 */
package com.mimecast.xoauth2.source;
