package com.ryuqq.atomicstore.core.model;

/**
 * Insert 연산 결과 (불변 record).
 *
 * <p>두 가지 의미를 가집니다:</p>
 * <ul>
 *   <li><strong>insert:</strong> value는 방금 기록된 값, existed는 기존 키 존재 여부</li>
 *   <li><strong>insertUnique:</strong> 키가 이미 있었다면 value는 기존 값(변경 없음), existed = true</li>
 * </ul>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 * @param value 연산 후 키에 연결된 값 (null 불가)
 * @param existed 연산 전 키 존재 여부
 * @param <V> 값 타입
 */
public record InsertResult<V>(V value, boolean existed) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public InsertResult {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * 새로 생성된 키의 결과.
     */
    public static <V> InsertResult<V> created(V value) {
        return new InsertResult<>(value, false);
    }

    /**
     * 이미 존재하던 키의 결과.
     */
    public static <V> InsertResult<V> existing(V value) {
        return new InsertResult<>(value, true);
    }
}
