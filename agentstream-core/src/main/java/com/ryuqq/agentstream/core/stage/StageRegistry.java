package com.ryuqq.agentstream.core.stage;

import com.ryuqq.agentstream.core.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 등록 순서가 고정된 불변 Stage 목록.
 *
 * <p>생성 시점에 한 번만 구성되며 이후 변경할 수 없습니다.
 * 이름이 중복된 Stage는 거부됩니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class StageRegistry {

    private final Map<String, Stage> stages;

    private StageRegistry(List<Stage> stageList) {
        if (stageList == null) {
            throw new IllegalArgumentException("stages cannot be null");
        }
        Map<String, Stage> ordered = new LinkedHashMap<>();
        for (Stage stage : stageList) {
            if (stage == null) {
                throw new IllegalArgumentException("stage cannot be null");
            }
            String name = stage.name();
            if (name == null || name.isBlank()) {
                throw new ValidationException("stage name cannot be null or blank");
            }
            if (ordered.putIfAbsent(name, stage) != null) {
                throw new ValidationException("Duplicate stage name: " + name);
            }
        }
        this.stages = Collections.unmodifiableMap(ordered);
    }

    /**
     * 레지스트리 생성.
     *
     * @param stages 실행 순서대로 나열된 Stage
     * @return StageRegistry
     * @throws ValidationException Stage 이름이 중복되거나 비어 있는 경우
     */
    public static StageRegistry of(List<? extends Stage> stages) {
        return new StageRegistry(stages == null ? null : new ArrayList<>(stages));
    }

    public static StageRegistry of(Stage... stages) {
        return of(List.of(stages));
    }

    /**
     * 실행 순서대로 Stage 목록 조회.
     *
     * @return 불변 목록
     */
    public List<Stage> stages() {
        return List.copyOf(stages.values());
    }

    public List<String> names() {
        return List.copyOf(stages.keySet());
    }

    public Optional<Stage> find(String name) {
        return Optional.ofNullable(stages.get(name));
    }

    public int size() {
        return stages.size();
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }
}
