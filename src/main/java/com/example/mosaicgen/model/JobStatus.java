package com.example.mosaicgen.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Статус задачи генерации. PROCESSING переходит ровно один раз в COMPLETED или FAILED.
 */
public enum JobStatus {
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }

    /**
     * Значение в API: имя в нижнем регистре.
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
