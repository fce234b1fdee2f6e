/**
 * Error taxonomy.
 *
 * <p>{@link com.ryuqq.agentstream.core.error.ValidationException} covers malformed input and is
 * never retried. Every other runtime failure extends
 * {@link com.ryuqq.agentstream.core.error.AgentStreamException} and carries a stable error code
 * that is surfaced to clients inside {@code error} events.</p>
 *
 * <h2>Propagation</h2>
 * <ul>
 *   <li>Resource factory errors are fatal only to the requested handle operation</li>
 *   <li>Stage errors are contained within their run</li>
 *   <li>Transport errors never leave the event notifier</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AgentStream Team
 */
package com.ryuqq.agentstream.core.error;
