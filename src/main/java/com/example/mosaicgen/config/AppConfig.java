package com.example.mosaicgen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Основная конфигурация приложения.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {
    /**
     * Корневая директория загруженных изображений и сгенерированных мозаик
     */
    private String uploadsDir = "./uploads";
}
