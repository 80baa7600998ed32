package com.example.mosaicgen.exception;

import lombok.Getter;

/**
 * Ошибка генерации мозаики с кодом вида ошибки.
 */
@Getter
public class MosaicException extends RuntimeException {

    private final MosaicErrorCode errorCode;

    public MosaicException(MosaicErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MosaicException(MosaicErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static MosaicException alreadyInProgress(long projectId) {
        return new MosaicException(MosaicErrorCode.ALREADY_IN_PROGRESS,
                "A mosaic generation is already in progress for project " + projectId);
    }

    public static MosaicException jobNotFound(String jobId) {
        return new MosaicException(MosaicErrorCode.JOB_NOT_FOUND, "Mosaic job not found: " + jobId);
    }

    public static MosaicException imageNotFound(String reference) {
        return new MosaicException(MosaicErrorCode.IMAGE_NOT_FOUND, "Image not found: " + reference);
    }

    public static MosaicException noTilesAvailable() {
        return new MosaicException(MosaicErrorCode.NO_TILES_AVAILABLE, "No valid tile images found");
    }
}
