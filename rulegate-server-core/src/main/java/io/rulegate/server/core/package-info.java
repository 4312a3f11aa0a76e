/**
 * Framework-neutral server core for RuleGate.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.rulegate.server.core.RealtimeEngine} (rules, subscriptions, fan-out, transport)</li>
 *   <li>{@link io.rulegate.server.core.RealtimeHandler} (connect, subscribe and unsubscribe over HTTP)</li>
 *   <li>{@link io.rulegate.server.core.InMemoryRulesProvider} (reference rule table)</li>
 * </ul>
 *
 * <p>Framework integrations adapt {@link io.rulegate.server.core.ServerRequest} and
 * {@link io.rulegate.server.core.ServerResponse} to their HTTP runtimes.
 */
package io.rulegate.server.core;
