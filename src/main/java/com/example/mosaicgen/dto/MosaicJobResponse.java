package com.example.mosaicgen.dto;

import com.example.mosaicgen.exception.MosaicErrorCode;
import com.example.mosaicgen.model.JobStatus;
import com.example.mosaicgen.model.MosaicStyle;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Состояние задачи генерации для опрашивающих клиентов.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MosaicJobResponse {
    private String id;
    private Long projectId;
    private JobStatus status;

    /**
     * Прогресс выполнения (0-100)
     */
    private int progress;

    private String currentStep;

    private Integer tileSize;
    private Integer tileDensity;
    private Integer colorAdjustment;
    private MosaicStyle style;

    /**
     * URL результатов (только для COMPLETED)
     */
    private String sdUrl;
    private String hdUrl;

    /**
     * Ошибка (только для FAILED)
     */
    private MosaicErrorCode errorCode;
    private String error;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
