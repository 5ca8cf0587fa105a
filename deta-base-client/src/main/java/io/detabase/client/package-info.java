/**
 * Deta Base client: the {@link io.detabase.client.BaseClient} API, its builder and configuration,
 * and the transport seam with a JDK HttpClient implementation.
 */
package io.detabase.client;
