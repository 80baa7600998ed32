package com.example.mosaicgen.service;

import com.example.mosaicgen.model.JobStatus;
import com.example.mosaicgen.model.MosaicJob;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Хранилище задач генерации. Наружу отдаются только копии записей.
 */
@Service
public class MosaicJobStore {
    private final Map<String, MosaicJob> jobs = new ConcurrentHashMap<>();

    /**
     * Создаёт задачу в статусе PROCESSING с прогрессом 0.
     *
     * @param template входные данные и настройки задачи
     * @return сохранённая копия
     */
    public MosaicJob create(MosaicJob template) {
        LocalDateTime now = LocalDateTime.now();
        MosaicJob job = template.toBuilder()
                .id(UUID.randomUUID().toString())
                .tileImages(List.copyOf(template.getTileImages()))
                .status(JobStatus.PROCESSING)
                .progress(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobs.put(job.getId(), job);
        return job.copy();
    }

    /**
     * Сохраняет новое состояние задачи, полностью заменяя предыдущее.
     */
    public MosaicJob save(MosaicJob job) {
        MosaicJob stored = job.copy();
        stored.setUpdatedAt(LocalDateTime.now());
        jobs.put(stored.getId(), stored);
        return stored.copy();
    }

    public Optional<MosaicJob> get(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId)).map(MosaicJob::copy);
    }

    public Optional<MosaicJob> findByUser(long userId, String jobId) {
        return get(jobId).filter(job -> job.getUserId() == userId);
    }

    /**
     * Задачи проекта пользователя, новые первыми.
     */
    public List<MosaicJob> findByProject(long userId, long projectId) {
        return jobs.values().stream()
                .filter(job -> job.getUserId() == userId && job.getProjectId() == projectId)
                .sorted(Comparator.comparing(MosaicJob::getCreatedAt).reversed())
                .map(MosaicJob::copy)
                .collect(Collectors.toList());
    }
}
