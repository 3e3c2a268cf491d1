package io.thumbd.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Pre-rendered JPEG thumbnails addressed by a stable image identifier. Entries are
 * never swept by size; they leave only through {@link #clear()} or when unreadable.
 */
final class ThumbnailStore {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailStore.class);
    private static final String EXTENSION = ".jpg";

    private final Path directory;

    private ThumbnailStore(Path directory) {
        this.directory = directory;
    }

    static ThumbnailStore open(Path directory) throws IOException {
        Files.createDirectories(directory);
        return new ThumbnailStore(directory);
    }

    Optional<BufferedImage> get(String imageId) {
        Path path = pathOf(imageId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            BufferedImage image = ImageIO.read(path.toFile());
            if (image == null) {
                log.atWarn()
                    .addKeyValue("imageId", imageId)
                    .log("Thumbnail is not a readable image, deleting");
                deleteQuietly(path);
                return Optional.empty();
            }
            return Optional.of(image);
        } catch (IOException e) {
            log.atWarn()
                .addKeyValue("imageId", imageId)
                .addKeyValue("error", e.getMessage())
                .log("Failed to read thumbnail, deleting");
            deleteQuietly(path);
            return Optional.empty();
        }
    }

    boolean put(String imageId, BufferedImage image, int quality) {
        Path path = pathOf(imageId);
        Path temp = directory.resolve(path.getFileName() + ".tmp");
        try {
            Files.createDirectories(directory);
            try (OutputStream out = Files.newOutputStream(temp)) {
                Images.writeJpeg(image, out, quality);
            }
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (IOException e) {
            log.atWarn()
                .addKeyValue("imageId", imageId)
                .setCause(e)
                .log("Failed to save thumbnail");
            deleteQuietly(temp);
            return false;
        }
    }

    boolean contains(String imageId) {
        return Files.exists(pathOf(imageId));
    }

    int clear() {
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path path : stream) {
                try {
                    Files.deleteIfExists(path);
                    deleted++;
                } catch (IOException e) {
                    log.debug("Failed to delete thumbnail {}: {}", path, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.atWarn()
                .addKeyValue("directory", directory)
                .addKeyValue("error", e.getMessage())
                .log("Failed to clear thumbnails");
        }
        return deleted;
    }

    Path pathOf(String imageId) {
        if (imageId == null || imageId.isBlank()) {
            throw new IllegalArgumentException("imageId must not be blank");
        }
        if (imageId.contains("/") || imageId.contains("\\") || imageId.contains("..")) {
            throw new IllegalArgumentException("imageId must not contain path separators: " + imageId);
        }
        return directory.resolve(imageId + EXTENSION);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Failed to delete {}: {}", path, e.getMessage());
        }
    }
}
