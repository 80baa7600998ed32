package com.example.mosaicgen.service;

import com.example.mosaicgen.config.AppConfig;
import com.example.mosaicgen.exception.MosaicErrorCode;
import com.example.mosaicgen.exception.MosaicException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Доступ к файлам в корне загрузок: разрешение ссылок, чтение и запись изображений.
 *
 * Ссылка на файл всегда хранится относительно корня, с разделителем "/".
 * При чтении допускаются старые формы ссылок ("/uploads/...", "uploads/...", "/...").
 */
@Slf4j
@Service
public class ImageStore {

    private static final String UPLOADS_PREFIX = "uploads/";

    private final Path root;

    public ImageStore(AppConfig appConfig) {
        this.root = Path.of(appConfig.getUploadsDir()).toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Приводит ссылку к каноническому виду относительно корня загрузок.
     *
     * @param reference ссылка в любом из допустимых форматов
     * @return ссылка без ведущего разделителя и префикса uploads/
     */
    public String normalize(String reference) {
        if (reference == null || reference.isBlank()) {
            throw MosaicException.imageNotFound(String.valueOf(reference));
        }

        String normalized = reference.trim().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.startsWith(UPLOADS_PREFIX)) {
            normalized = normalized.substring(UPLOADS_PREFIX.length());
        }
        return normalized;
    }

    /**
     * Разрешает ссылку в существующий файл внутри корня загрузок.
     *
     * @param reference ссылка на изображение
     * @return абсолютный путь к файлу
     */
    public Path resolve(String reference) {
        String normalized = normalize(reference);

        Path path;
        try {
            path = root.resolve(normalized).normalize();
        } catch (InvalidPathException e) {
            throw MosaicException.imageNotFound(reference);
        }

        if (!path.startsWith(root) || !Files.isRegularFile(path) || !isInsideRoot(path)) {
            throw MosaicException.imageNotFound(reference);
        }
        return path;
    }

    /**
     * Проверяет, что файл после раскрытия символических ссылок остаётся внутри корня загрузок.
     */
    private boolean isInsideRoot(Path path) {
        try {
            return path.toRealPath().startsWith(root.toRealPath());
        } catch (IOException e) {
            log.warn("Cannot resolve real path of {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Открывает и декодирует изображение (JPEG, PNG и другие форматы ImageIO).
     *
     * @param reference ссылка на изображение
     * @return декодированный растр
     */
    public BufferedImage open(String reference) {
        return read(resolve(reference));
    }

    /**
     * Декодирует уже разрешённый файл.
     *
     * @param path путь внутри корня загрузок
     * @return декодированный растр
     */
    public BufferedImage read(Path path) {
        String reference = toReference(path);
        log.debug("Decoding image {}", reference);

        BufferedImage image;
        try (InputStream in = Files.newInputStream(path)) {
            image = ImageIO.read(in);
        } catch (IIOException e) {
            throw new MosaicException(MosaicErrorCode.DECODE_ERROR,
                    "Failed to decode image " + reference + ": " + e.getMessage(), e);
        } catch (NoSuchFileException e) {
            throw MosaicException.imageNotFound(reference);
        } catch (IOException e) {
            throw new MosaicException(MosaicErrorCode.IO_ERROR,
                    "Failed to read image " + reference + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // некоторые декодеры падают на повреждённых данных без IIOException
            throw new MosaicException(MosaicErrorCode.DECODE_ERROR,
                    "Failed to decode image " + reference + ": " + e.getMessage(), e);
        }

        if (image == null) {
            throw new MosaicException(MosaicErrorCode.DECODE_ERROR,
                    "Unsupported or corrupt image format: " + reference);
        }
        return image;
    }

    /**
     * Создаёт директорию внутри корня загрузок.
     *
     * @param segments сегменты пути относительно корня
     * @return абсолютный путь директории
     */
    public Path createDirectories(String... segments) {
        Path dir = root;
        for (String segment : segments) {
            dir = dir.resolve(segment);
        }

        try {
            Files.createDirectories(dir);
            return dir;
        } catch (IOException e) {
            log.error("Error creating directory {}", dir, e);
            throw new MosaicException(MosaicErrorCode.IO_ERROR,
                    "Failed to create directory " + toReference(dir) + ": " + e.getMessage(), e);
        }
    }

    public void write(Path file, byte[] content) {
        try {
            Files.write(file, content);
            log.debug("Written {} bytes to {}", content.length, file);
        } catch (IOException e) {
            log.error("Error writing file {}", file, e);
            throw new MosaicException(MosaicErrorCode.IO_ERROR,
                    "Failed to write " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Переводит путь внутри корня в каноническую ссылку для хранения.
     */
    public String toReference(Path path) {
        Path relative = root.relativize(path.toAbsolutePath().normalize());
        return relative.toString().replace('\\', '/');
    }
}
