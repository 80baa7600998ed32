package com.example.mosaicgen.service;

import com.example.mosaicgen.config.MosaicConfig;
import com.example.mosaicgen.dto.MosaicGenerationRequest;
import com.example.mosaicgen.exception.MosaicErrorCode;
import com.example.mosaicgen.exception.MosaicException;
import com.example.mosaicgen.metrics.MosaicMetrics;
import com.example.mosaicgen.model.JobStatus;
import com.example.mosaicgen.model.MosaicJob;
import com.example.mosaicgen.model.MosaicResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Основной сервис управления генерацией мозаик.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MosaicGenerationService {

    private final TaskExecutor taskExecutor;
    private final MosaicJobStore jobStore;
    private final MosaicWorkflow mosaicWorkflow;
    private final GenerationGuard generationGuard;
    private final MosaicConfig mosaicConfig;
    private final MosaicMetrics mosaicMetrics;

    /**
     * Запускает асинхронную генерацию мозаики для проекта.
     *
     * @param userId    владелец задачи
     * @param projectId проект, в пределах которого допускается одна генерация
     * @param request   изображения и настройки
     * @return сохранённая задача в статусе PROCESSING
     * @throws MosaicException ALREADY_IN_PROGRESS, если для проекта уже идёт генерация
     */
    public MosaicJob submit(long userId, long projectId, MosaicGenerationRequest request) {
        MosaicJob template = buildJob(userId, projectId, request);

        if (!generationGuard.tryAcquire(projectId)) {
            mosaicMetrics.recordRejected();
            log.warn("Rejected mosaic generation for project {}: already in progress", projectId);
            throw MosaicException.alreadyInProgress(projectId);
        }

        MosaicJob job;
        try {
            job = jobStore.create(template);
        } catch (RuntimeException e) {
            generationGuard.release(projectId);
            throw e;
        }

        log.info("Mosaic job {} started for user {} project {}: {} tiles, tile size {}",
                job.getId(), userId, projectId, job.getTileImages().size(), job.getTileSize());
        launch(job.copy());
        return job;
    }

    /**
     * Возвращает задачу пользователя.
     *
     * @throws MosaicException JOB_NOT_FOUND, если задачи нет или она чужая
     */
    public MosaicJob getStatus(long userId, String jobId) {
        return jobStore.findByUser(userId, jobId)
                .orElseThrow(() -> MosaicException.jobNotFound(jobId));
    }

    /**
     * Задачи проекта, новые первыми.
     */
    public List<MosaicJob> listByProject(long userId, long projectId) {
        return jobStore.findByProject(userId, projectId);
    }

    private void launch(MosaicJob job) {
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> runGeneration(job), taskExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Mosaic job {} could not be scheduled", job.getId(), e);
            try {
                markFailed(job, null, "Generation could not be scheduled: " + e.getMessage());
            } finally {
                generationGuard.release(job.getProjectId());
            }
            return;
        }

        future.whenComplete((ignored, error) -> finish(job, error));
    }

    void runGeneration(MosaicJob job) {
        try {
            MosaicResult result = mosaicWorkflow.generate(
                    job,
                    (progress, step) -> updateProgress(job, progress, step)
            );

            job.setSdPath(result.getSdPath());
            job.setHdPath(result.getHdPath());
            job.setStatus(JobStatus.COMPLETED);
            job.setProgress(100);
            job.setCurrentStep("Completed");
            jobStore.save(job);
            log.info("Mosaic job {} completed: {} tiles, sd={}, hd={}",
                    job.getId(), result.getTileCount(), result.getSdPath(), result.getHdPath());

        } catch (MosaicException e) {
            log.error("Mosaic job {} failed: {}", job.getId(), e.getMessage(), e);
            markFailed(job, e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Mosaic job {} failed: {}", job.getId(), e.getMessage(), e);
            markFailed(job, null, "Failed to generate mosaic: " + e.getMessage());
        }
    }

    /**
     * Выполняется после конвейера при любом исходе, включая Error.
     */
    private void finish(MosaicJob job, Throwable error) {
        try {
            if (error != null && job.getStatus() == JobStatus.PROCESSING) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                log.error("Mosaic job {} aborted unexpectedly", job.getId(), cause);
                markFailed(job, null, "Unexpected failure: " + cause);
            }
        } finally {
            generationGuard.release(job.getProjectId());
            log.debug("Project {} released by job {}", job.getProjectId(), job.getId());
        }
    }

    private void updateProgress(MosaicJob job, int progress, String step) {
        if (progress < job.getProgress()) {
            log.warn("Job {}: ignoring progress {} below current {}", job.getId(), progress, job.getProgress());
            return;
        }
        job.setProgress(progress);
        job.setCurrentStep(step);
        jobStore.save(job);
        log.debug("Job {}: {}% - {}", job.getId(), progress, step);
    }

    private void markFailed(MosaicJob job, MosaicErrorCode errorCode, String message) {
        job.setStatus(JobStatus.FAILED);
        job.setErrorCode(errorCode);
        job.setErrorMessage(message);
        job.setCurrentStep("Failed");
        jobStore.save(job);
    }

    private MosaicJob buildJob(long userId, long projectId, MosaicGenerationRequest request) {
        if (request.getTileImages() == null || request.getTileImages().isEmpty()) {
            throw new IllegalArgumentException("At least one tile image is required");
        }

        MosaicConfig.DefaultsConfig defaults = mosaicConfig.getDefaults();
        int tileSize = request.getTileSize() != null ? request.getTileSize() : defaults.getTileSize();
        if (tileSize < 2) {
            throw new IllegalArgumentException("Tile size must be at least 2 pixels: " + tileSize);
        }

        return MosaicJob.builder()
                .userId(userId)
                .projectId(projectId)
                .mainImage(request.getMainImage())
                .tileImages(request.getTileImages())
                .tileSize(tileSize)
                .tileDensity(request.getTileDensity() != null ? request.getTileDensity() : defaults.getTileDensity())
                .colorAdjustment(request.getColorAdjustment() != null
                        ? request.getColorAdjustment()
                        : defaults.getColorAdjustment())
                .style(request.getStyle() != null ? request.getStyle() : defaults.getStyle())
                .build();
    }
}
