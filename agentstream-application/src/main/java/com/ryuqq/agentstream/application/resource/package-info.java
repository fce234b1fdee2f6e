/**
 * Per-user isolated resource handles.
 *
 * <p>A handle is usable only by the (user, request) pair that created it.</p>
 *
 * @since 1.0.0
 * @author AgentStream Team
 */
package com.ryuqq.agentstream.application.resource;
