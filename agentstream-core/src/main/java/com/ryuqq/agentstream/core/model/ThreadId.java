package com.ryuqq.agentstream.core.model;

/**
 * 대화 스레드 식별자.
 *
 * <p>이벤트 스트림은 스레드 단위로 순서가 보장됩니다.</p>
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
public final class ThreadId {

    private final String value;

    private ThreadId(String value) {
        this.value = Identifiers.validate("ThreadId", value);
    }

    /**
     * ThreadId 생성.
     *
     * @param value 식별자 값
     * @return ThreadId 인스턴스
     * @throws com.ryuqq.agentstream.core.error.ValidationException 유효하지 않은 값인 경우
     */
    public static ThreadId of(String value) {
        return new ThreadId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ThreadId that = (ThreadId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ThreadId{" + value + '}';
    }
}
