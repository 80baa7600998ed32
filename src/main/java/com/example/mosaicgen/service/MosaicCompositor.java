package com.example.mosaicgen.service;

import com.example.mosaicgen.config.MosaicConfig;
import com.example.mosaicgen.exception.MosaicErrorCode;
import com.example.mosaicgen.exception.MosaicException;
import com.example.mosaicgen.model.MosaicCanvas;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Сборка мозаики: раскладка плиток по сетке на холстах SD и HD и кодирование в JPEG.
 *
 * Плитка для каждой ячейки выбирается случайно и равновероятно, цвет основного
 * изображения при выборе не учитывается.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MosaicCompositor {

    private final MosaicConfig mosaicConfig;

    /**
     * Собирает оба холста целиком.
     *
     * @param main     основное изображение, задаёт размеры холстов
     * @param tiles    декодированные плитки
     * @param tileSize размер ячейки HD в пикселях
     * @return холсты SD и HD
     */
    public MosaicCanvas compose(BufferedImage main, List<BufferedImage> tiles, int tileSize) {
        return compose(main, tiles, tileSize, ThreadLocalRandom.current());
    }

    public MosaicCanvas compose(BufferedImage main, List<BufferedImage> tiles, int tileSize, Random random) {
        requireTiles(tiles);
        MosaicCanvas canvas = createCanvas(main);
        paint(canvas.getSd(), tiles, sdCellSize(tileSize), random);
        paint(canvas.getHd(), tiles, tileSize, random);
        return canvas;
    }

    /**
     * Создаёт холсты: HD совпадает с основным изображением, SD вдвое меньше по каждой стороне.
     */
    public MosaicCanvas createCanvas(BufferedImage main) {
        int width = main.getWidth();
        int height = main.getHeight();
        if (width < 2 || height < 2) {
            throw new IllegalArgumentException(
                    "Main image is too small for a mosaic: " + width + "x" + height);
        }

        BufferedImage sd = new BufferedImage(width / 2, height / 2, BufferedImage.TYPE_INT_RGB);
        BufferedImage hd = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        return new MosaicCanvas(sd, hd);
    }

    public static int sdCellSize(int tileSize) {
        return tileSize / 2;
    }

    /**
     * Заполняет холст ячейками cellSize x cellSize слева направо, сверху вниз.
     * Крайние неполные ячейки обрезаются границей холста.
     */
    public void paint(BufferedImage canvas, List<BufferedImage> tiles, int cellSize, Random random) {
        if (cellSize < 1) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellSize);
        }
        requireTiles(tiles);

        List<BufferedImage> scaledTiles = new ArrayList<>(tiles.size());
        for (BufferedImage tile : tiles) {
            scaledTiles.add(scale(tile, cellSize));
        }

        int cells = 0;
        Graphics2D g = canvas.createGraphics();
        try {
            g.setComposite(AlphaComposite.SrcOver);
            for (int y = 0; y < canvas.getHeight(); y += cellSize) {
                for (int x = 0; x < canvas.getWidth(); x += cellSize) {
                    BufferedImage tile = scaledTiles.get(random.nextInt(scaledTiles.size()));
                    g.drawImage(tile, x, y, null);
                    cells++;
                }
            }
        } finally {
            g.dispose();
            scaledTiles.forEach(BufferedImage::flush);
        }

        log.debug("Painted {} cells of {}px on {}x{} canvas",
                cells, cellSize, canvas.getWidth(), canvas.getHeight());
    }

    /**
     * Масштабирует плитку до size x size билинейной интерполяцией, сохраняя альфа-канал.
     */
    BufferedImage scale(BufferedImage source, int size) {
        BufferedImage scaled = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setComposite(AlphaComposite.Src);
            g.drawImage(source, 0, 0, size, size, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    /**
     * Кодирует холст в JPEG с качеством из конфигурации.
     */
    public byte[] encodeJpeg(BufferedImage image) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
        if (!writers.hasNext()) {
            throw new MosaicException(MosaicErrorCode.ENCODE_ERROR, "No JPEG writer available");
        }

        ImageWriter writer = writers.next();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(jpegQuality());

            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new MosaicException(MosaicErrorCode.ENCODE_ERROR, "JPEG encoding failed: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }

    private float jpegQuality() {
        int quality = Math.max(0, Math.min(100, mosaicConfig.getJpegQuality()));
        return quality / 100f;
    }

    private void requireTiles(List<BufferedImage> tiles) {
        if (tiles == null || tiles.isEmpty()) {
            throw MosaicException.noTilesAvailable();
        }
    }
}
