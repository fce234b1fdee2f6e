/**
 * Service provider interfaces implemented by adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.agentstream.core.spi.StateStore}: run snapshot persistence</li>
 *   <li>{@link com.ryuqq.agentstream.core.spi.EventTransport}: per-thread event delivery</li>
 *   <li>{@link com.ryuqq.agentstream.core.spi.ResourceConnector}: per-user resource clients</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AgentStream Team
 */
package com.ryuqq.agentstream.core.spi;
