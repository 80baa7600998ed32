package com.example.mosaicgen.controller;

import com.example.mosaicgen.dto.MosaicGenerationRequest;
import com.example.mosaicgen.dto.MosaicJobListResponse;
import com.example.mosaicgen.dto.MosaicJobResponse;
import com.example.mosaicgen.model.MosaicJob;
import com.example.mosaicgen.service.MosaicGenerationService;
import com.example.mosaicgen.service.MosaicJobMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API генерации мозаик.
 *
 * Пользователь определяется заголовком X-User-Id, который выставляет слой аутентификации.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MosaicController {

    public static final String USER_HEADER = "X-User-Id";

    private final MosaicGenerationService generationService;
    private final MosaicJobMapper jobMapper;

    /**
     * Запускает генерацию мозаики для проекта.
     *
     * POST /api/v1/projects/{projectId}/mosaics
     */
    @PostMapping("/projects/{projectId}/mosaics")
    public ResponseEntity<MosaicJobResponse> generate(
            @RequestHeader(USER_HEADER) long userId,
            @PathVariable long projectId,
            @RequestBody @Valid MosaicGenerationRequest request) {

        log.info("Mosaic generation requested by user {} for project {}", userId, projectId);

        MosaicJob job = generationService.submit(userId, projectId, request);
        return ResponseEntity.accepted().body(jobMapper.toDto(job));
    }

    /**
     * Возвращает состояние генерации.
     *
     * GET /api/v1/mosaics/{jobId}
     */
    @GetMapping("/mosaics/{jobId}")
    public ResponseEntity<MosaicJobResponse> getStatus(
            @RequestHeader(USER_HEADER) long userId,
            @PathVariable String jobId) {

        log.debug("Getting status for mosaic job: {}", jobId);

        MosaicJob job = generationService.getStatus(userId, jobId);
        return ResponseEntity.ok(jobMapper.toDto(job));
    }

    /**
     * Список генераций проекта, новые первыми.
     *
     * GET /api/v1/projects/{projectId}/mosaics
     */
    @GetMapping("/projects/{projectId}/mosaics")
    public ResponseEntity<MosaicJobListResponse> listByProject(
            @RequestHeader(USER_HEADER) long userId,
            @PathVariable long projectId) {

        return ResponseEntity.ok(jobMapper.toListDto(generationService.listByProject(userId, projectId)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
