package by.greenmobile.lotmassing.service.batch;

import by.greenmobile.lotmassing.dto.BatchRequest;
import by.greenmobile.lotmassing.dto.LotRequest;
import by.greenmobile.lotmassing.entity.BatchReport;
import by.greenmobile.lotmassing.entity.LotResult;
import by.greenmobile.lotmassing.entity.LotStatus;
import by.greenmobile.lotmassing.service.MassingFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Пакетный расчёт участков на пуле потоков.
 *
 * - участки независимы, ошибка одного не останавливает остальные;
 * - результат каждого участка фиксируется в LotResultCollector один раз по его позиции во входном списке;
 * - отмена: ещё не начатые участки пропускаются, начатые бросают перебор между вариантами.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchEvaluationService {

    public static final String MDC_BATCH = "batch";

    private final MassingFacade facade;

    @Value("${massing.batch.threads:4}")
    private int threads = 4;

    /** Как часто (в участках) писать прогресс в лог. */
    @Value("${massing.batch.progressEvery:25}")
    private int progressEvery = 25;

    /** Синхронный расчёт пакета. */
    public BatchReport run(BatchRequest request) throws InterruptedException {
        return submit(request).await();
    }

    public BatchHandle submit(BatchRequest request) {
        String batchId = UUID.randomUUID().toString().substring(0, 8);
        List<LotRequest> lots = request.getLots() != null ? request.getLots() : List.of();
        Map<String, Object> project = request.getProjectParameters();

        AtomicBoolean cancelled = new AtomicBoolean(false);
        LotResultCollector collector = new LotResultCollector();
        AtomicInteger done = new AtomicInteger();

        int poolSize = Math.max(1, Math.min(threads, Math.max(1, lots.size())));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        log.info("BATCH {}: {} lots on {} threads", batchId, lots.size(), poolSize);

        warnDuplicateIds(batchId, lots);

        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < lots.size(); i++) {
            int position = i;
            LotRequest lot = lots.get(i);
            tasks.add(CompletableFuture.runAsync(() -> {
                MDC.put(MDC_BATCH, batchId);
                try {
                    evaluateOne(position, lot, project, cancelled, collector);
                } finally {
                    int n = done.incrementAndGet();
                    if (progressEvery > 0 && (n % progressEvery == 0 || n == lots.size())) {
                        log.info("BATCH {}: {}/{} lots processed", batchId, n, lots.size());
                    }
                    MDC.remove(MDC_BATCH);
                }
            }, pool));
        }

        CompletableFuture<BatchReport> report = CompletableFuture
                .allOf(tasks.toArray(new CompletableFuture[0]))
                .thenApply(v -> buildReport(batchId, lots, collector, cancelled.get()))
                .whenComplete((r, e) -> pool.shutdown());

        return new BatchHandle(batchId, cancelled, report);
    }

    private void evaluateOne(int position, LotRequest lot, Map<String, Object> project,
                             AtomicBoolean cancelled, LotResultCollector collector) {
        if (cancelled.get()) {
            return;
        }
        String lotId = lot.getLotId() != null ? lot.getLotId() : "<unnamed>";
        try {
            collector.commit(position, facade.evaluate(lot, project, cancelled::get));
        } catch (CancellationException e) {
            log.info("BATCH: lot {} abandoned on cancel", lotId);
        } catch (RuntimeException e) {
            log.error("BATCH: lot {} failed: {}", lotId, e.getMessage(), e);
            collector.commit(position, LotResult.failed(lotId, e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private BatchReport buildReport(String batchId, List<LotRequest> lots,
                                    LotResultCollector collector, boolean cancelled) {
        List<LotResult> results = new ArrayList<>();
        int ok = 0, infeasible = 0, failed = 0, skipped = 0;

        for (int i = 0; i < lots.size(); i++) {
            String lotId = lots.get(i).getLotId() != null ? lots.get(i).getLotId() : "<unnamed>";
            LotResult r = collector.get(i).orElseGet(() -> LotResult.cancelled(lotId));
            results.add(r);
            if (r.getStatus() == LotStatus.OK) ok++;
            else if (r.getStatus() == LotStatus.INFEASIBLE) infeasible++;
            else if (r.getStatus() == LotStatus.FAILED) failed++;
            else skipped++;
        }

        log.info("BATCH {}: done ok={}, infeasible={}, failed={}, cancelled={}",
                batchId, ok, infeasible, failed, skipped);
        return BatchReport.builder()
                .batchId(batchId)
                .results(List.copyOf(results))
                .okCount(ok)
                .infeasibleCount(infeasible)
                .failedCount(failed)
                .cancelledCount(skipped)
                .cancelled(cancelled)
                .build();
    }

    private void warnDuplicateIds(String batchId, List<LotRequest> lots) {
        Set<String> seen = new HashSet<>();
        for (LotRequest lot : lots) {
            if (lot.getLotId() != null && !seen.add(lot.getLotId())) {
                log.warn("BATCH {}: lot id {} appears more than once, results follow input order", batchId, lot.getLotId());
            }
        }
    }

    void setThreads(int threads) {
        this.threads = threads;
    }
}
