package io.thumbd.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CacheKeyTest {

    @Test
    void baseKeyIsMd5HexOfUrl() {
        assertThat(CacheKey.of("abc").value()).isEqualTo("900150983cd24fb0d6963f7d28e17f72");
    }

    @Test
    void keysAreDeterministic() {
        String url = "https://example.org/images/1.jpg";

        assertThat(CacheKey.of(url)).isEqualTo(CacheKey.of(url));
        assertThat(CacheKey.variant(url, ThumbnailSize.of(150, 150)))
            .isEqualTo(CacheKey.variant(url, ThumbnailSize.of(150, 150)));
    }

    @Test
    void variantKeyHashesUrlAndSize() {
        String url = "https://example.org/images/1.jpg";

        assertThat(CacheKey.variant(url, ThumbnailSize.of(150, 150)))
            .isEqualTo(CacheKey.of(url + "|150x150"));
    }

    @Test
    void differentSizesProduceDifferentKeys() {
        String url = "https://example.org/images/1.jpg";

        CacheKey small = CacheKey.variant(url, ThumbnailSize.of(100, 100));
        CacheKey large = CacheKey.variant(url, ThumbnailSize.of(200, 200));

        assertThat(small).isNotEqualTo(large);
        assertThat(small).isNotEqualTo(CacheKey.of(url));
    }

    @Test
    void fileNameAppendsExtension() {
        CacheKey key = CacheKey.of("abc");
        assertThat(key.fileName(".cache")).isEqualTo("900150983cd24fb0d6963f7d28e17f72.cache");
    }
}
