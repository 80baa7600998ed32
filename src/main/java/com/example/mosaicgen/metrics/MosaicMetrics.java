package com.example.mosaicgen.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики генерации мозаик.
 */
@Component
public class MosaicMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer totalDuration;
    private final Counter completedTotal;
    private final Counter failedTotal;
    private final Counter rejectedTotal;
    private final AtomicInteger activeJobs;
    private final AtomicInteger lastTileCount;

    public MosaicMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.totalDuration = Timer.builder("mosaic.duration.total")
            .description("Total duration of mosaic generation")
            .register(meterRegistry);

        this.completedTotal = Counter.builder("mosaic.completed.total")
            .description("Total number of completed mosaic generations")
            .register(meterRegistry);

        this.failedTotal = Counter.builder("mosaic.failed.total")
            .description("Total number of failed mosaic generations")
            .register(meterRegistry);

        this.rejectedTotal = Counter.builder("mosaic.rejected.total")
            .description("Submissions rejected because the project already has an active generation")
            .register(meterRegistry);

        this.activeJobs = new AtomicInteger(0);
        Gauge.builder("mosaic.jobs.active", activeJobs, AtomicInteger::get)
            .description("Number of running mosaic generations")
            .register(meterRegistry);

        this.lastTileCount = new AtomicInteger(0);
        Gauge.builder("mosaic.tiles.count", lastTileCount, AtomicInteger::get)
            .description("Number of decodable tiles in the last generation")
            .register(meterRegistry);
    }

    /**
     * Создаёт Timer.Sample для измерения времени шага.
     */
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Записывает время выполнения всей генерации.
     */
    public void recordTotalDuration(Timer.Sample sample) {
        sample.stop(totalDuration);
    }

    /**
     * Записывает время выполнения отдельного шага конвейера.
     */
    public void recordStepDuration(Timer.Sample sample, String stepName) {
        Timer stepTimer = Timer.builder("mosaic.step.duration")
            .tag("step", stepName)
            .description("Duration of mosaic pipeline step")
            .register(meterRegistry);
        sample.stop(stepTimer);
    }

    /**
     * Увеличивает счётчик активных генераций.
     */
    public void incrementActiveJobs() {
        activeJobs.incrementAndGet();
    }

    /**
     * Уменьшает счётчик активных генераций.
     */
    public void decrementActiveJobs() {
        activeJobs.decrementAndGet();
    }

    /**
     * Обновляет количество декодированных плиток.
     */
    public void setTileCount(int count) {
        lastTileCount.set(count);
    }

    /**
     * Отмечает успешное завершение генерации.
     */
    public void recordCompleted() {
        completedTotal.increment();
    }

    /**
     * Отмечает неудачное завершение генерации.
     */
    public void recordFailed() {
        failedTotal.increment();
    }

    /**
     * Отмечает отклонённый запуск: для проекта уже идёт генерация.
     */
    public void recordRejected() {
        rejectedTotal.increment();
    }
}
