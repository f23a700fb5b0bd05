package com.ryuqq.atomicstore.core.counter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 동시 접근에 안전한 음이 아닌 카운터.
 *
 * <p>Store의 live element count를 유지하는 데 사용됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@link #get()}은 항상 0 이상</li>
 *   <li>lock 없이 사용할 때 감소가 대응하는 증가보다 먼저 반영될 수 있음:
 *       내부 값은 일시적으로 음수가 되고, 그동안 {@link #get()}은 0을 반환</li>
 * </ul>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 */
public final class AtomicCounter {

    private final AtomicLong value;

    /**
     * 0에서 시작하는 카운터 생성.
     */
    public AtomicCounter() {
        this.value = new AtomicLong();
    }

    /**
     * 1 증가.
     *
     * @return 증가 후 값 (0 미만이면 0)
     */
    public long inc() {
        return Math.max(0, value.incrementAndGet());
    }

    /**
     * 1 감소.
     *
     * @return 감소 후 값 (0 미만이면 0)
     */
    public long dec() {
        return Math.max(0, value.decrementAndGet());
    }

    /**
     * 현재 값 조회.
     *
     * @return 현재 값 (0 미만이면 0)
     */
    public long get() {
        return Math.max(0, value.get());
    }

    @Override
    public String toString() {
        return "AtomicCounter{" + get() + '}';
    }
}
