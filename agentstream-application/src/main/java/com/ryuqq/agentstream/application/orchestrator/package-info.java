/**
 * Orchestrator use case.
 *
 * @since 1.0.0
 * @author AgentStream Team
 */
package com.ryuqq.agentstream.application.orchestrator;
