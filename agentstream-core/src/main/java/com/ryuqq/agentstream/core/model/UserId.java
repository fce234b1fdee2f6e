package com.ryuqq.agentstream.core.model;

/**
 * 요청을 소유한 사용자 식별자.
 *
 * <p>모든 격리 경계(리소스 핸들, 스냅샷, 이벤트 채널)의 기준이 됩니다.</p>
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
public final class UserId {

    private final String value;

    private UserId(String value) {
        this.value = Identifiers.validate("UserId", value);
    }

    /**
     * UserId 생성.
     *
     * @param value 식별자 값
     * @return UserId 인스턴스
     * @throws com.ryuqq.agentstream.core.error.ValidationException 유효하지 않은 값인 경우
     */
    public static UserId of(String value) {
        return new UserId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserId that = (UserId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "UserId{" + value + '}';
    }
}
