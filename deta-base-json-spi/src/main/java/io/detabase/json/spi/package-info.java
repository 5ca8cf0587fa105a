/**
 * JSON codec abstraction for the Deta Base client. See the Jackson module for the default implementation.
 */
package io.detabase.json.spi;
