package com.ryuqq.atomicstore.adapter.inmemory.store;

import com.ryuqq.atomicstore.core.exception.AtomicStoreException;
import com.ryuqq.atomicstore.core.spi.Batch;
import com.ryuqq.atomicstore.core.spi.BatchListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * InMemoryBatch 실패 경로 테스트.
 *
 * <ul>
 *   <li>job 실패 시 모든 job 완료 후 AtomicStoreException, batch listener 미호출</li>
 *   <li>execute 호출 스레드 interrupt 시 시작 전 job 취소</li>
 * </ul>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InMemoryBatchFailureTest {

    @Mock
    private BatchListener<Integer> batchInsertListener;

    @Mock
    private BatchListener<Integer> batchUpdateListener;

    @Mock
    private BatchListener<Integer> batchRemoveListener;

    @Test
    void job_실패_시_나머지_job_완료_후_예외_및_batch_listener_미호출() {
        // given
        InMemoryAtomicStore<Integer> store = spy(InMemoryAtomicStore.<Integer>create(true));
        doAnswer(invocation -> {
            if ("poison".equals(invocation.getArgument(0))) {
                throw new IllegalStateException("disk full");
            }
            return invocation.callRealMethod();
        }).when(store).insert(anyString(), any(), anyBoolean(), anyBoolean());
        store.onBatchInsert(batchInsertListener);
        store.onBatchUpdate(batchUpdateListener);
        store.onBatchRemove(batchRemoveListener);

        Batch<Integer> batch = store.batch();
        batch.insert("good", 1);
        batch.insert("poison", 2);
        batch.remove("absent");

        // when & then
        assertThatThrownBy(batch::execute)
            .isInstanceOf(AtomicStoreException.class)
            .hasMessageContaining("1 of 3")
            .hasRootCauseInstanceOf(IllegalStateException.class)
            .hasRootCauseMessage("disk full");

        verifyNoInteractions(batchInsertListener, batchUpdateListener, batchRemoveListener);
        assertThat(store.get("good")).contains(1);
        assertThat(store.get("poison")).isEmpty();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void execute_interrupt_시_시작_전_job은_store를_변경하지_않음() throws Exception {
        // given: 단건 insert의 listener가 store lock을 잡고 있어 batch worker가 막힘
        InMemoryAtomicStore<Integer> store = new InMemoryAtomicStore<>(new StoreConfig().withBatchConcurrency(1));
        store.onBatchInsert(batchInsertListener);

        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        store.onInsert((key, value) -> {
            if ("blocker".equals(key)) {
                holding.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        Thread holder = new Thread(() -> store.insert("blocker", 0));
        holder.start();
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        Batch<Integer> batch = store.batch();
        int jobs = 100;
        for (int i = 0; i < jobs; i++) {
            batch.insert("job-" + i, i);
        }

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean interruptRestored = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            try {
                batch.execute();
            } catch (Throwable e) {
                thrown.set(e);
                interruptRestored.set(Thread.currentThread().isInterrupted());
            }
        });
        caller.start();
        Thread.sleep(100);

        // when
        caller.interrupt();
        caller.join(5_000);
        release.countDown();
        holder.join(5_000);
        Thread.sleep(200);

        // then: 실행 중이던 job 최대 1개만 적용
        assertThat(thrown.get()).isInstanceOf(AtomicStoreException.class);
        assertThat(interruptRestored).isTrue();
        assertThat(store.size()).isBetween(1L, 2L);
        verifyNoInteractions(batchInsertListener);
    }
}
