package com.example.mosaicgen.service;

import com.example.mosaicgen.config.MosaicConfig;
import com.example.mosaicgen.exception.MosaicException;
import com.example.mosaicgen.metrics.MosaicMetrics;
import com.example.mosaicgen.model.MosaicCanvas;
import com.example.mosaicgen.model.MosaicJob;
import com.example.mosaicgen.model.MosaicResult;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Конвейер генерации мозаики для одной задачи.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MosaicWorkflow {
    private final ImageStore imageStore;
    private final MosaicCompositor compositor;
    private final MosaicConfig mosaicConfig;
    private final MosaicMetrics mosaicMetrics;

    public MosaicResult generate(MosaicJob job, MosaicProgressListener listener) {
        return generate(job, listener, ThreadLocalRandom.current());
    }

    /**
     * Выполняет все шаги генерации, сообщая о прогрессе после каждого шага.
     * Прогресс 100 и статус завершения выставляет вызывающий.
     *
     * @param job      задача (читаются только входные данные)
     * @param listener получатель прогресса, может быть null
     * @param random   источник случайного выбора плиток
     * @return ссылки на SD и HD файлы
     */
    public MosaicResult generate(MosaicJob job, MosaicProgressListener listener, Random random) {
        Timer.Sample totalSample = mosaicMetrics.startTimer();
        mosaicMetrics.incrementActiveJobs();

        BufferedImage mainImage = null;
        MosaicCanvas canvas = null;
        List<BufferedImage> tiles = new ArrayList<>();

        try {
            // 1. Поиск файлов
            Timer.Sample resolveSample = mosaicMetrics.startTimer();
            Path mainPath = imageStore.resolve(job.getMainImage());
            notify(listener, 10, "Main image resolved");

            List<Path> tilePaths = resolveTiles(job);
            mosaicMetrics.recordStepDuration(resolveSample, "resolve");
            notify(listener, 20, "Tile images resolved");

            // 2. Директория и имена результатов
            Path outputDir = imageStore.createDirectories(
                    "user_" + job.getUserId(),
                    "project_" + job.getProjectId(),
                    mosaicConfig.getOutput().getDirectory());
            String timestamp = LocalDateTime.now()
                    .format(DateTimeFormatter.ofPattern(mosaicConfig.getOutput().getTimestampPattern()));
            Path sdFile = outputDir.resolve("mosaic_sd_" + timestamp + ".jpg");
            Path hdFile = outputDir.resolve("mosaic_hd_" + timestamp + ".jpg");
            notify(listener, 30, "Output location prepared");

            // 3. Декодирование и холсты
            Timer.Sample decodeSample = mosaicMetrics.startTimer();
            mainImage = imageStore.read(mainPath);
            notify(listener, 40, "Main image decoded (" + mainImage.getWidth() + "x" + mainImage.getHeight() + ")");

            canvas = compositor.createCanvas(mainImage);
            mainImage.flush();
            notify(listener, 50, "Canvas allocated");

            tiles = decodeTiles(job, tilePaths);
            if (tiles.isEmpty()) {
                throw MosaicException.noTilesAvailable();
            }
            mosaicMetrics.setTileCount(tiles.size());
            mosaicMetrics.recordStepDuration(decodeSample, "decode");
            notify(listener, 60, "Decoded " + tiles.size() + " tile images");

            // 4. Раскладка плиток
            Timer.Sample composeSample = mosaicMetrics.startTimer();
            compositor.paint(canvas.getSd(), tiles, MosaicCompositor.sdCellSize(job.getTileSize()), random);
            notify(listener, 70, "SD mosaic composed");

            compositor.paint(canvas.getHd(), tiles, job.getTileSize(), random);
            mosaicMetrics.recordStepDuration(composeSample, "compose");
            notify(listener, 80, "HD mosaic composed");

            // 5. Запись JPEG
            Timer.Sample encodeSample = mosaicMetrics.startTimer();
            imageStore.write(sdFile, compositor.encodeJpeg(canvas.getSd()));
            notify(listener, 90, "SD mosaic saved");

            imageStore.write(hdFile, compositor.encodeJpeg(canvas.getHd()));
            mosaicMetrics.recordStepDuration(encodeSample, "encode");

            mosaicMetrics.recordCompleted();
            return MosaicResult.builder()
                    .sdPath(imageStore.toReference(sdFile))
                    .hdPath(imageStore.toReference(hdFile))
                    .tileCount(tiles.size())
                    .build();

        } catch (RuntimeException e) {
            mosaicMetrics.recordFailed();
            throw e;
        } finally {
            mosaicMetrics.decrementActiveJobs();
            mosaicMetrics.recordTotalDuration(totalSample);
            if (mainImage != null) {
                mainImage.flush();
            }
            if (canvas != null) {
                canvas.flush();
            }
            tiles.forEach(BufferedImage::flush);
        }
    }

    /**
     * Ненайденные плитки пропускаются, пустой список проверяется после декодирования.
     */
    private List<Path> resolveTiles(MosaicJob job) {
        List<Path> paths = new ArrayList<>(job.getTileImages().size());
        for (String reference : job.getTileImages()) {
            try {
                paths.add(imageStore.resolve(reference));
            } catch (MosaicException e) {
                log.warn("Job {}: skipping tile {}: {}", job.getId(), reference, e.getMessage());
            }
        }
        return paths;
    }

    private List<BufferedImage> decodeTiles(MosaicJob job, List<Path> tilePaths) {
        List<BufferedImage> tiles = new ArrayList<>(tilePaths.size());
        for (Path path : tilePaths) {
            try {
                tiles.add(imageStore.read(path));
            } catch (MosaicException e) {
                log.warn("Job {}: skipping tile {}: {}", job.getId(), path.getFileName(), e.getMessage());
            }
        }
        return tiles;
    }

    private void notify(MosaicProgressListener listener, int progress, String step) {
        if (listener != null) {
            listener.onProgress(progress, step);
        }
    }
}
