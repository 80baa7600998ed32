package com.example.mosaicgen.config;

import com.example.mosaicgen.model.MosaicStyle;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация генерации мозаик.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "mosaic")
public class MosaicConfig {

    /**
     * Качество JPEG для SD и HD (0-100)
     */
    private int jpegQuality = 90;

    private OutputConfig output = new OutputConfig();

    private DefaultsConfig defaults = new DefaultsConfig();

    @Data
    public static class OutputConfig {
        /**
         * Имя поддиректории проекта для результатов
         */
        private String directory = "mosaics";

        /**
         * Шаблон временной метки в именах файлов
         */
        private String timestampPattern = "yyyyMMddHHmmssSSS";
    }

    /**
     * Значения настроек, если запрос их не содержит.
     */
    @Data
    public static class DefaultsConfig {
        private int tileSize = 50;
        private int tileDensity = 80;
        private int colorAdjustment = 50;
        private MosaicStyle style = MosaicStyle.CLASSIC;
    }
}
