package com.ryuqq.agentstream.core.spi;

import com.ryuqq.agentstream.core.model.UserId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 리소스 핸들을 통해 하위 클라이언트로 전달되는 명령.
 *
 * <p>모든 명령은 핸들 소유자의 userId로 태깅됩니다. 클라이언트는 이 값으로
 * 사용자별 데이터 범위를 제한할 수 있습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param operation 연산 이름
 * @param userId 소유 사용자
 * @param parameters 연산 파라미터
 */
public record ResourceCommand(String operation, UserId userId, Map<String, Object> parameters) {

    public ResourceCommand {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
