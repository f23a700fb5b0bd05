package com.ryuqq.atomicstore.core.model;

import java.util.Map;

/**
 * Batch 실행 집계 결과 (불변 record).
 *
 * <p>각 job은 자신이 관찰한 기존 키 존재 여부로 독립적으로 분류됩니다:</p>
 * <ul>
 *   <li><strong>created:</strong> insert/insertUnique가 없던 키를 기록한 경우</li>
 *   <li><strong>updated:</strong> insert가 기존 키를 덮어쓴 경우</li>
 *   <li><strong>deleted:</strong> remove가 실제로 키를 삭제한 경우 (값은 삭제된 값)</li>
 * </ul>
 *
 * <p>기존 키에 대한 insertUnique는 어느 집합에도 포함되지 않습니다.
 * 같은 batch 안에서 같은 키를 건드리는 job들은 실행 순서가 보장되지 않으므로,
 * 한 키가 created와 updated에 동시에 나타날 수 있습니다.</p>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 * @param created 새로 생성된 키 → 값
 * @param updated 덮어쓴 키 → 새 값
 * @param deleted 삭제된 키 → 삭제된 값
 * @param <V> 값 타입
 */
public record BatchResult<V>(Map<String, V> created, Map<String, V> updated, Map<String, V> deleted) {

    /**
     * Compact constructor (방어적 복사).
     *
     * @throws IllegalArgumentException map이 null인 경우
     */
    public BatchResult {
        if (created == null) {
            throw new IllegalArgumentException("created cannot be null");
        }
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        if (deleted == null) {
            throw new IllegalArgumentException("deleted cannot be null");
        }
        created = Map.copyOf(created);
        updated = Map.copyOf(updated);
        deleted = Map.copyOf(deleted);
    }

    /**
     * 실효 변경이 없는 결과.
     */
    public static <V> BatchResult<V> empty() {
        return new BatchResult<>(Map.of(), Map.of(), Map.of());
    }

    /**
     * 실효 변경이 하나도 없는지 확인.
     *
     * @return 세 집합이 모두 비어 있으면 true
     */
    public boolean isEmpty() {
        return created.isEmpty() && updated.isEmpty() && deleted.isEmpty();
    }
}
