package com.example.mosaicgen.service;

/**
 * Колбэк прогресса генерации.
 */
@FunctionalInterface
public interface MosaicProgressListener {
    void onProgress(int progress, String step);
}
