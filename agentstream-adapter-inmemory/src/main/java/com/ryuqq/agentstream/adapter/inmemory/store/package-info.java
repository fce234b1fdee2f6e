/**
 * In-memory state store backed by JSON snapshots.
 *
 * <p>Snapshots are serialized with Jackson so that a loaded state is always a fresh
 * instance equal to the saved one.</p>
 *
 * @since 1.0.0
 * @author AgentStream Team
 */
package com.ryuqq.agentstream.adapter.inmemory.store;
