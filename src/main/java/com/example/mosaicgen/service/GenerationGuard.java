package com.example.mosaicgen.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Набор проектов, для которых сейчас идёт генерация. Не больше одной генерации на проект.
 */
@Component
public class GenerationGuard {

    private final Set<Long> activeProjects = ConcurrentHashMap.newKeySet();

    /**
     * @return true, если проект захвачен этим вызовом
     */
    public boolean tryAcquire(long projectId) {
        return activeProjects.add(projectId);
    }

    public void release(long projectId) {
        activeProjects.remove(projectId);
    }

    public boolean isActive(long projectId) {
        return activeProjects.contains(projectId);
    }
}
