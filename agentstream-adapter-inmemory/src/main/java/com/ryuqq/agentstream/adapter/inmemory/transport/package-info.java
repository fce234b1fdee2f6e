/**
 * In-memory event transport with per-thread channels.
 *
 * @since 1.0.0
 * @author AgentStream Team
 */
package com.ryuqq.agentstream.adapter.inmemory.transport;
