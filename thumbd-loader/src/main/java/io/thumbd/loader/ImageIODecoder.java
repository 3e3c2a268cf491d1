package io.thumbd.loader;

import io.thumbd.common.exception.LoadException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

public final class ImageIODecoder implements ImageDecoder {

    public static final ImageIODecoder INSTANCE = new ImageIODecoder();

    private ImageIODecoder() {}

    @Override
    public BufferedImage decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new LoadException.Decode("Empty image data");
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image == null) {
                throw new LoadException.Decode("Unrecognized image format");
            }
            return image;
        } catch (IOException e) {
            throw new LoadException.Decode("Cannot decode image data: " + e.getMessage(), e);
        }
    }
}
