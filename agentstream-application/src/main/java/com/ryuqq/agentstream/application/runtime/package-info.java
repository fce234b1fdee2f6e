/**
 * Explicit lifecycle for components that own background work.
 *
 * @since 1.0.0
 * @author AgentStream Team
 */
package com.ryuqq.agentstream.application.runtime;
