package com.example.mosaicgen.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.awt.image.BufferedImage;

/**
 * Пара холстов SD и HD одного запуска конвейера.
 */
@Getter
@AllArgsConstructor
public class MosaicCanvas {
    private final BufferedImage sd;
    private final BufferedImage hd;

    public void flush() {
        sd.flush();
        hd.flush();
    }
}
