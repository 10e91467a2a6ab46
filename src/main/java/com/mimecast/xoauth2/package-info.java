/**
 * XOAUTH2 credential resolution for IMAP and SMTP clients.
 *
 * <p>Looks up static OAuth2 client parameters for a (host, user, port) identity, exchanges the
 * <br>refresh token for an access token at the provider's token endpoint and hands back an
 * <br>authentication record whose secret is that access token.
 *
 * <p>Credentials come from a literal, a user function, a GnuPG encrypted file, HashiCorp Vault or pass.
 * <br>Tokens are fetched with OkHttp or, when configured, a curl subprocess.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar xoauth2.jar
 *      XOAUTH2 access token resolver
 *
 *      usage:   [-c &lt;arg&gt;] [--debug] [-h &lt;arg&gt;] [-p &lt;arg&gt;] [--sasl] [-u &lt;arg&gt;]
 *      -c,--config &lt;arg&gt;   Path to auth-source.json5
 *         --debug          Enable debug logging
 *      -h,--host &lt;arg&gt;     Host to resolve, repeat to probe several in order
 *      -p,--port &lt;arg&gt;     Port or service, repeat to probe several in order
 *         --sasl           Print the XOAUTH2 SASL initial response instead of the token
 *      -u,--user &lt;arg&gt;     User name, defaults to the credentials user
 * </pre>
 *
 * <h2>Configuration:</h2>
 * <pre>
 * {
 *   source: {
 *     type: "file",
 *     path: "/home/tony/.authinfo.json5.gpg"
 *   },
 *   transport: {
 *     useCurl: false
 *   }
 * }
 * </pre>
 */
package com.mimecast.xoauth2;
