/**
 * Protocol-centric core for RuleGate.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Wire protocol constants (SSE event names, message fields, query keys)</li>
 *   <li>Small enums shared by servers and adapters ({@link io.rulegate.core.RecordAction},
 *       {@link io.rulegate.core.RuleType})</li>
 *   <li>The {@link io.rulegate.core.RuleGateException} hierarchy</li>
 * </ul>
 *
 * <p>Server bindings live in other modules.
 */
package io.rulegate.core;
