package com.ryuqq.agentstream.core.stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 기본 파이프라인을 구성하는 7개 Stage의 이름과 순서.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public enum StandardStage {

    TRIAGE("triage"),
    DATA("data"),
    OPTIMIZATION("optimization"),
    ACTIONS("actions"),
    REPORTING("reporting"),
    SYNTHETIC_DATA("synthetic_data"),
    CORPUS_ADMIN("corpus_admin");

    private final String stageName;

    StandardStage(String stageName) {
        this.stageName = stageName;
    }

    public String stageName() {
        return stageName;
    }

    /**
     * 실행 순서대로 정렬된 Stage 이름 목록.
     *
     * @return 7개 Stage 이름
     */
    public static List<String> orderedNames() {
        List<String> names = new ArrayList<>();
        for (StandardStage stage : values()) {
            names.add(stage.stageName);
        }
        return Collections.unmodifiableList(names);
    }

    public static Optional<StandardStage> fromStageName(String stageName) {
        for (StandardStage stage : values()) {
            if (stage.stageName.equals(stageName)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
