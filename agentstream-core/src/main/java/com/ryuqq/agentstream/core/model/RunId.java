package com.ryuqq.agentstream.core.model;

import java.util.UUID;

/**
 * 하나의 Orchestrator 실행(run) 식별자.
 *
 * <p>동시에 같은 RunId로 두 개의 run이 활성화될 수 없습니다.
 * 스냅샷 저장/재개의 키로도 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 점(.), 콜론(:), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class RunId {

    private final String value;

    private RunId(String value) {
        this.value = Identifiers.validate("RunId", value);
    }

    /**
     * RunId 생성.
     *
     * @param value 식별자 값
     * @return RunId 인스턴스
     * @throws com.ryuqq.agentstream.core.error.ValidationException 유효하지 않은 값인 경우
     */
    public static RunId of(String value) {
        return new RunId(value);
    }

    /**
     * 무작위 RunId 생성.
     *
     * @return 새 RunId
     */
    public static RunId generate() {
        return new RunId("run-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId that = (RunId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RunId{" + value + '}';
    }
}
