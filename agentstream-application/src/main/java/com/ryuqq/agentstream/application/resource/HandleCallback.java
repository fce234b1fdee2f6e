package com.ryuqq.agentstream.application.resource;

/**
 * {@link ResourceFactory#withHandle} 범위에서 실행되는 작업.
 *
 * @param <T> 결과 타입
 * @author AgentStream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HandleCallback<T> {

    T apply(ResourceHandle handle) throws Exception;
}
