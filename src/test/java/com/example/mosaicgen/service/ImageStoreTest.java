package com.example.mosaicgen.service;

import com.example.mosaicgen.TestImages;
import com.example.mosaicgen.config.AppConfig;
import com.example.mosaicgen.exception.MosaicErrorCode;
import com.example.mosaicgen.exception.MosaicException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ImageStoreTest {

    @TempDir
    Path tempDir;

    private Path uploadsDir;
    private ImageStore imageStore;

    @BeforeEach
    void setUp() throws IOException {
        uploadsDir = Files.createDirectories(tempDir.resolve("uploads"));
        AppConfig appConfig = new AppConfig();
        appConfig.setUploadsDir(uploadsDir.toString());
        imageStore = new ImageStore(appConfig);
    }

    @Test
    void shouldNormalizeAllReferenceConventions() {
        assertEquals("user_1/main.jpg", imageStore.normalize("/uploads/user_1/main.jpg"));
        assertEquals("user_1/main.jpg", imageStore.normalize("uploads/user_1/main.jpg"));
        assertEquals("user_1/main.jpg", imageStore.normalize("/user_1/main.jpg"));
        assertEquals("user_1/main.jpg", imageStore.normalize("user_1/main.jpg"));
        assertEquals("user_1/main.jpg", imageStore.normalize("user_1\\main.jpg"));
    }

    @Test
    void shouldResolveReferenceWithAnyPrefix() throws IOException {
        Path file = TestImages.writePng(uploadsDir.resolve("user_1/tiles/a.png"), 4, 4, Color.RED);

        assertEquals(file.toAbsolutePath().normalize(), imageStore.resolve("/uploads/user_1/tiles/a.png"));
        assertEquals(file.toAbsolutePath().normalize(), imageStore.resolve("uploads/user_1/tiles/a.png"));
        assertEquals(file.toAbsolutePath().normalize(), imageStore.resolve("/user_1/tiles/a.png"));
    }

    @Test
    void shouldReportMissingImageAsNotFound() {
        MosaicException ex = assertThrows(MosaicException.class,
                () -> imageStore.resolve("user_1/missing.jpg"));

        assertEquals(MosaicErrorCode.IMAGE_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    void shouldNotResolveOutsideUploadsRoot() throws IOException {
        TestImages.writePng(tempDir.resolve("secret.png"), 2, 2, Color.BLACK);

        MosaicException ex = assertThrows(MosaicException.class,
                () -> imageStore.resolve("../secret.png"));

        assertEquals(MosaicErrorCode.IMAGE_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    void shouldNotFollowSymlinkOutsideUploadsRoot() throws IOException {
        // Given: ссылка внутри корня указывает на файл снаружи
        Path secret = TestImages.writePng(tempDir.resolve("outside/secret.png"), 2, 2, Color.BLACK);
        Path link = uploadsDir.resolve("user_1/linked.png");
        Files.createDirectories(link.getParent());
        try {
            Files.createSymbolicLink(link, secret);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "Symbolic links are not supported: " + e.getMessage());
        }

        // When & Then
        MosaicException ex = assertThrows(MosaicException.class, () -> imageStore.open("user_1/linked.png"));
        assertEquals(MosaicErrorCode.IMAGE_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    void shouldFollowSymlinkInsideUploadsRoot() throws IOException {
        Path target = TestImages.writePng(uploadsDir.resolve("user_1/tiles/a.png"), 3, 5, Color.RED);
        Path link = uploadsDir.resolve("user_1/alias.png");
        try {
            Files.createSymbolicLink(link, target);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "Symbolic links are not supported: " + e.getMessage());
        }

        assertEquals(3, imageStore.open("user_1/alias.png").getWidth());
    }

    @Test
    void shouldRejectBlankReference() {
        assertThrows(MosaicException.class, () -> imageStore.resolve(" "));
        assertThrows(MosaicException.class, () -> imageStore.resolve(null));
        assertThrows(MosaicException.class, () -> imageStore.resolve("/uploads/"));
    }

    @Test
    void shouldDecodePngAndJpeg() throws IOException {
        TestImages.writePng(uploadsDir.resolve("p/a.png"), 30, 20, Color.BLUE);
        TestImages.writeJpeg(uploadsDir.resolve("p/b.jpg"), 64, 48, Color.GREEN);

        BufferedImage png = imageStore.open("p/a.png");
        BufferedImage jpeg = imageStore.open("/uploads/p/b.jpg");

        assertEquals(30, png.getWidth());
        assertEquals(20, png.getHeight());
        assertEquals(64, jpeg.getWidth());
        assertEquals(48, jpeg.getHeight());
    }

    @Test
    void shouldReportUndecodableBytesAsDecodeError() throws IOException {
        TestImages.writeGarbage(uploadsDir.resolve("p/broken.jpg"));

        MosaicException ex = assertThrows(MosaicException.class, () -> imageStore.open("p/broken.jpg"));

        assertEquals(MosaicErrorCode.DECODE_ERROR, ex.getErrorCode());
    }

    @Test
    void shouldConvertPathToRootRelativeReference() {
        Path output = uploadsDir.resolve("user_1").resolve("project_2").resolve("mosaics").resolve("m.jpg");

        assertEquals("user_1/project_2/mosaics/m.jpg", imageStore.toReference(output));
    }

    @Test
    void shouldCreateDirectoriesAndWriteFiles() throws IOException {
        Path dir = imageStore.createDirectories("user_1", "project_2", "mosaics");
        Path file = dir.resolve("out.bin");

        imageStore.write(file, new byte[]{1, 2, 3});

        assertTrue(Files.isDirectory(uploadsDir.resolve("user_1/project_2/mosaics")));
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(file));
    }

    @Test
    void shouldReportDirectoryFailureAsIoError() throws IOException {
        Files.writeString(uploadsDir.resolve("blocked"), "file, not a directory");

        MosaicException ex = assertThrows(MosaicException.class,
                () -> imageStore.createDirectories("blocked", "mosaics"));

        assertEquals(MosaicErrorCode.IO_ERROR, ex.getErrorCode());
    }
}
