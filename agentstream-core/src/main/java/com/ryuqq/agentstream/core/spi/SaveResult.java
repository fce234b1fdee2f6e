package com.ryuqq.agentstream.core.spi;

/**
 * StateStore 저장 결과.
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param success 저장 성공 여부
 * @param snapshotId 생성된 스냅샷 ID (실패 시 null)
 * @param failureReason 실패 사유 (성공 시 null)
 */
public record SaveResult(boolean success, String snapshotId, String failureReason) {

    public SaveResult {
        if (success && (snapshotId == null || snapshotId.isBlank())) {
            throw new IllegalArgumentException("snapshotId is required for a successful save");
        }
    }

    public static SaveResult saved(String snapshotId) {
        return new SaveResult(true, snapshotId, null);
    }

    public static SaveResult rejected(String failureReason) {
        return new SaveResult(false, null, failureReason);
    }
}
