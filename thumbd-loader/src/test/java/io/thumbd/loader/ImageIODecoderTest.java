package io.thumbd.loader;

import io.thumbd.common.exception.LoadException;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ImageIODecoderTest {

    private final ImageDecoder decoder = ImageIODecoder.INSTANCE;

    @Test
    void decodesPng() {
        BufferedImage image = decoder.decode(TestImages.png(12, 7));

        assertThat(image.getWidth()).isEqualTo(12);
        assertThat(image.getHeight()).isEqualTo(7);
    }

    @Test
    void rejectsEmptyData() {
        assertThatThrownBy(() -> decoder.decode(new byte[0]))
            .isInstanceOf(LoadException.Decode.class);
    }

    @Test
    void rejectsNonImageData() {
        byte[] html = "<html><body>rate limited</body></html>".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> decoder.decode(html))
            .isInstanceOf(LoadException.Decode.class)
            .hasMessageContaining("Unrecognized");
    }
}
