package com.example.mosaicgen.service;

import com.example.mosaicgen.dto.MosaicJobListResponse;
import com.example.mosaicgen.dto.MosaicJobResponse;
import com.example.mosaicgen.model.JobStatus;
import com.example.mosaicgen.model.MosaicJob;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Маппинг задач в DTO.
 */
@Component
public class MosaicJobMapper {

    static final String UPLOADS_URL_PREFIX = "/uploads/";

    public MosaicJobResponse toDto(MosaicJob job) {
        MosaicJobResponse.MosaicJobResponseBuilder builder = MosaicJobResponse.builder()
                .id(job.getId())
                .projectId(job.getProjectId())
                .status(job.getStatus())
                .progress(job.getProgress())
                .currentStep(job.getCurrentStep())
                .tileSize(job.getTileSize())
                .tileDensity(job.getTileDensity())
                .colorAdjustment(job.getColorAdjustment())
                .style(job.getStyle())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt());

        if (job.getStatus() == JobStatus.COMPLETED) {
            builder.sdUrl(toUrl(job.getSdPath()))
                    .hdUrl(toUrl(job.getHdPath()));
        }

        if (job.getStatus() == JobStatus.FAILED) {
            builder.errorCode(job.getErrorCode())
                    .error(job.getErrorMessage());
        }

        return builder.build();
    }

    public MosaicJobListResponse toListDto(List<MosaicJob> jobs) {
        List<MosaicJobResponse> mosaics = jobs.stream()
                .map(this::toDto)
                .collect(Collectors.toList());

        return MosaicJobListResponse.builder()
                .mosaics(mosaics)
                .count(mosaics.size())
                .build();
    }

    private String toUrl(String reference) {
        return reference != null ? UPLOADS_URL_PREFIX + reference : null;
    }
}
