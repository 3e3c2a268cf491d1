package io.thumbd.cli;

import io.thumbd.cache.CacheConfig;
import io.thumbd.loader.DispatcherConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class ThumbdConfigTest {

    private static final Path ROOT = Path.of("/var/lib/thumbd");
    private static final long MB = 1024 * 1024;

    @Test
    void emptyPropertiesYieldDefaults() {
        ThumbdConfig config = ThumbdConfig.fromProperties(new Properties(), ROOT);

        assertThat(config.cache()).isEqualTo(CacheConfig.defaults(ROOT));
        assertThat(config.dispatcher()).isEqualTo(DispatcherConfig.defaults());
    }

    @Test
    void recognizedKeysOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(ThumbdConfig.CACHE_DIR, "/tmp/c");
        properties.setProperty(ThumbdConfig.THUMBNAILS_DIR, "/tmp/t");
        properties.setProperty(ThumbdConfig.DISK_MAX_MB, "500");
        properties.setProperty(ThumbdConfig.MEMORY_MAX_MB, " 64 ");
        properties.setProperty(ThumbdConfig.MAX_CONCURRENT, "8");

        ThumbdConfig config = ThumbdConfig.fromProperties(properties, ROOT);

        assertThat(config.cache().cacheDirectory()).isEqualTo(Path.of("/tmp/c"));
        assertThat(config.cache().thumbnailsDirectory()).isEqualTo(Path.of("/tmp/t"));
        assertThat(config.cache().maxDiskBytes()).isEqualTo(500 * MB);
        assertThat(config.cache().maxMemoryBytes()).isEqualTo(64 * MB);
        assertThat(config.dispatcher().baseMaxConcurrent()).isEqualTo(8);
    }

    @Test
    void nonNumericSizeIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(ThumbdConfig.DISK_MAX_MB, "lots");

        assertThatThrownBy(() -> ThumbdConfig.fromProperties(properties, ROOT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(ThumbdConfig.DISK_MAX_MB);
    }

    @Test
    void zeroConcurrencyIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(ThumbdConfig.MAX_CONCURRENT, "0");

        assertThatThrownBy(() -> ThumbdConfig.fromProperties(properties, ROOT))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
