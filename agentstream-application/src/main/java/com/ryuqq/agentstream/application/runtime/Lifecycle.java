package com.ryuqq.agentstream.application.runtime;

/**
 * 백그라운드 작업(유휴 핸들 회수 등)을 가진 컴포넌트의 명시적 생명주기.
 *
 * <p>생성만으로는 아무것도 시작되지 않습니다. {@link #start()}를 호출해야 백그라운드 작업이
 * 스케줄되고, {@link #stop()}은 진행 중인 작업이 끝날 때까지 제한 시간 동안 기다립니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * UserResourceFactory factory = new UserResourceFactory(connector, new ResourceFactoryConfig());
 * factory.start();
 * try {
 *     // ...
 * } finally {
 *     factory.stop();
 * }
 * </pre>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface Lifecycle {

    /**
     * 백그라운드 작업 시작. 이미 실행 중이면 아무 일도 하지 않습니다.
     */
    void start();

    /**
     * 백그라운드 작업 중지. 이미 중지되어 있으면 아무 일도 하지 않습니다.
     */
    void stop();

    boolean isRunning();
}
