package com.example.mosaicgen.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Список задач проекта.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MosaicJobListResponse {
    private List<MosaicJobResponse> mosaics;
    private int count;
}
