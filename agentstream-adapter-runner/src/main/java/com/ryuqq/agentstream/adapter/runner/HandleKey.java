package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.core.model.RequestId;
import com.ryuqq.agentstream.core.model.UserId;

/**
 * 리소스 핸들 레지스트리 키.
 *
 * @param userId 사용자
 * @param requestId 요청
 */
record HandleKey(UserId userId, RequestId requestId) {

    HandleKey {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
    }
}
