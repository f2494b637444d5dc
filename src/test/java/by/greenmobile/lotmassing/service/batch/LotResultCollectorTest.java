package by.greenmobile.lotmassing.service.batch;

import by.greenmobile.lotmassing.entity.LotResult;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class LotResultCollectorTest {

    @Test
    void secondCommitForSamePositionIsIgnored() {
        LotResultCollector collector = new LotResultCollector();

        assertThat(collector.commit(0, LotResult.failed("A", "first"))).isTrue();
        assertThat(collector.commit(0, LotResult.failed("A", "second"))).isFalse();

        assertThat(collector.size()).isEqualTo(1);
        assertThat(collector.get(0).orElseThrow().getMessage()).isEqualTo("first");
    }

    @Test
    void sameLotIdAtDifferentPositionsIsKept() {
        LotResultCollector collector = new LotResultCollector();

        assertThat(collector.commit(1, LotResult.failed("DUP", "second"))).isTrue();
        assertThat(collector.commit(0, LotResult.failed("DUP", "first"))).isTrue();

        assertThat(collector.snapshot()).extracting(LotResult::getMessage).containsExactly("first", "second");
    }

    @Test
    void concurrentCommitsAreAtMostOncePerPosition() throws InterruptedException {
        LotResultCollector collector = new LotResultCollector();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();

        for (int i = 0; i < 200; i++) {
            int position = i % 50;
            pool.submit(() -> {
                start.await();
                if (collector.commit(position, LotResult.failed("L-" + position, "x"))) accepted.incrementAndGet();
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(accepted.get()).isEqualTo(50);
        assertThat(collector.snapshot()).hasSize(50);
    }
}
