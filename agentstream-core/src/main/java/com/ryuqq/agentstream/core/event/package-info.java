/**
 * Typed lifecycle events streamed to a user's connection.
 *
 * <p>Events are ephemeral. Ordering is guaranteed per thread only, through
 * {@link com.ryuqq.agentstream.core.event.AgentEvent#sequenceNumber()}.</p>
 *
 * @since 1.0.0
 * @author AgentStream Team
 */
package com.ryuqq.agentstream.core.event;
