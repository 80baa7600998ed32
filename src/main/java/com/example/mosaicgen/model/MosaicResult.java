package com.example.mosaicgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Результат генерации: ссылки на записанные файлы.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MosaicResult {
    private String sdPath;
    private String hdPath;
    private int tileCount;
}
