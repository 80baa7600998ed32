package com.example.mosaicgen.exception;

/**
 * Виды ошибок генерации мозаики.
 */
public enum MosaicErrorCode {
    ALREADY_IN_PROGRESS,
    IMAGE_NOT_FOUND,
    JOB_NOT_FOUND,
    DECODE_ERROR,
    NO_TILES_AVAILABLE,
    IO_ERROR,
    ENCODE_ERROR
}
