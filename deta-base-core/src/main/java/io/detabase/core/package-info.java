/**
 * Protocol-centric core for the Deta Base client.
 *
 * <p>Contains no HTTP bindings. It covers:
 * <ul>
 *   <li>Protocol constants and the error taxonomy</li>
 *   <li>Expiration normalization into the {@code __expires} attribute</li>
 *   <li>Update, item and query payload encoding, fetch page decoding</li>
 * </ul>
 */
package io.detabase.core;
