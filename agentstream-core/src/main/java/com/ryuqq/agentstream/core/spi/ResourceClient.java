package com.ryuqq.agentstream.core.spi;

/**
 * 사용자별로 격리된 하위 리소스 클라이언트 (캐시, DB 세션 등).
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface ResourceClient extends AutoCloseable {

    /**
     * 연결 상태 확인. 최초 사용 시 한 번 호출됩니다.
     *
     * @return 정상이면 true
     */
    boolean healthCheck();

    /**
     * 명령 실행.
     *
     * @param command 소유자 태그가 붙은 명령
     * @return 실행 결과 (nullable)
     * @throws Exception 실행 실패
     */
    Object execute(ResourceCommand command) throws Exception;

    /**
     * 연결 해제. 예외를 던지지 않아야 합니다.
     */
    @Override
    void close();
}
