package com.example.mosaicgen.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Стиль мозаики. Сохраняется вместе с задачей, на раскладку плиток пока не влияет.
 */
public enum MosaicStyle {
    CLASSIC,
    RANDOM,
    FLOWING;

    /**
     * Значение в API: имя в нижнем регистре.
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
