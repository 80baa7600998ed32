package com.example.mosaicgen.dto;

import com.example.mosaicgen.model.MosaicStyle;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Запрос на генерацию мозаики.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MosaicGenerationRequest {
    /**
     * Ссылка на основное изображение
     */
    @NotBlank(message = "Main image is required")
    private String mainImage;

    /**
     * Ссылки на изображения-плитки
     */
    @NotEmpty(message = "At least one tile image is required")
    private List<@NotBlank String> tileImages;

    /**
     * Размер плитки HD в пикселях (по умолчанию из конфигурации)
     */
    @Min(10)
    @Max(200)
    private Integer tileSize;

    @Min(1)
    @Max(100)
    private Integer tileDensity;

    @Min(0)
    @Max(100)
    private Integer colorAdjustment;

    private MosaicStyle style;
}
