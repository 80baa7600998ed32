package com.example.mosaicgen.model;

import com.example.mosaicgen.exception.MosaicErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Задача генерации мозаики.
 *
 * Изменяемые поля (status, progress, пути, ошибка) пишет только конвейер,
 * владеющий задачей. Хранилище отдаёт наружу копии.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MosaicJob {
    private String id;
    private long userId;
    private long projectId;

    /**
     * Ссылка на основное изображение (относительно корня загрузок)
     */
    private String mainImage;

    /**
     * Ссылки на плитки в порядке запроса, неизменяемый список
     */
    private List<String> tileImages;

    private int tileSize;
    private int tileDensity;
    private int colorAdjustment;
    private MosaicStyle style;

    private JobStatus status;
    private int progress;
    private String currentStep;

    private String sdPath;
    private String hdPath;

    private MosaicErrorCode errorCode;
    private String errorMessage;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public MosaicJob copy() {
        return toBuilder().build();
    }
}
