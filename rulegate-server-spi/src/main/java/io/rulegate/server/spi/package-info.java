/**
 * Server-side SPI for RuleGate.
 *
 * <p>The SPI is blocking and minimal, intended to be implemented by host applications
 * (rule storage, authentication) and adapted by framework integrations (servlet, Spring).
 */
package io.rulegate.server.spi;
