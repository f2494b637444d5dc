package by.greenmobile.lotmassing.service.batch;

import by.greenmobile.lotmassing.entity.BatchReport;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Запущенный пакет: ожидание отчёта и отмена.
 *
 * Отмена действует на уровне участка: начатый перебор форм прерывается между вариантами,
 * уже зафиксированные результаты не меняются.
 */
public class BatchHandle {

    private final String batchId;
    private final AtomicBoolean cancelled;
    private final CompletableFuture<BatchReport> report;

    BatchHandle(String batchId, AtomicBoolean cancelled, CompletableFuture<BatchReport> report) {
        this.batchId = batchId;
        this.cancelled = cancelled;
        this.report = report;
    }

    public String getBatchId() {
        return batchId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return report.isDone();
    }

    public BatchReport await() throws InterruptedException {
        try {
            return report.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("batch " + batchId + " failed", e.getCause());
        }
    }

    CompletableFuture<BatchReport> future() {
        return report;
    }
}
