package com.ryuqq.agentstream.core.error;

/**
 * 사용자별(또는 전체) 리소스 핸들 한도 초과.
 *
 * <p>사용자에게 노출되는 오류입니다. 호출자가 cleanup을 수행하거나
 * 유휴 핸들이 TTL로 회수된 뒤에는 재시도할 수 있습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public class QuotaExceededException extends AgentStreamException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "QUOTA_EXCEEDED";

    private final String userId;
    private final int limit;

    /**
     * 생성자.
     *
     * @param userId 한도에 도달한 사용자 ID
     * @param limit 적용된 한도
     * @param message 오류 메시지
     */
    public QuotaExceededException(String userId, int limit, String message) {
        super(ERROR_CODE, message, null);
        this.userId = userId;
        this.limit = limit;
    }

    public String getUserId() {
        return userId;
    }

    public int getLimit() {
        return limit;
    }
}
