package com.ryuqq.agentstream.core.model;

/**
 * 리소스 핸들 범위를 결정하는 요청 식별자.
 *
 * <p>Orchestrator는 run 하나당 {@code requestId = runId}로 핸들을 발급받습니다.</p>
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
public final class RequestId {

    private final String value;

    private RequestId(String value) {
        this.value = Identifiers.validate("RequestId", value);
    }

    /**
     * RequestId 생성.
     *
     * @param value 식별자 값
     * @return RequestId 인스턴스
     * @throws com.ryuqq.agentstream.core.error.ValidationException 유효하지 않은 값인 경우
     */
    public static RequestId of(String value) {
        return new RequestId(value);
    }

    /**
     * RunId와 같은 값을 가진 RequestId 생성.
     *
     * @param runId run 식별자
     * @return RequestId 인스턴스
     */
    public static RequestId from(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return new RequestId(runId.getValue());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestId that = (RequestId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RequestId{" + value + '}';
    }
}
