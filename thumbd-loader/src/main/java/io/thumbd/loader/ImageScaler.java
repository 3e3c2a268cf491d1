package io.thumbd.loader;

import io.thumbd.common.ThumbnailSize;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

public final class ImageScaler {

    private ImageScaler() {}

    /**
     * Scales {@code source} to the largest size that fits inside {@code bounds} while
     * keeping its aspect ratio.
     */
    public static BufferedImage fit(BufferedImage source, ThumbnailSize bounds) {
        double scale = Math.min(
            (double) bounds.width() / source.getWidth(),
            (double) bounds.height() / source.getHeight()
        );
        int width = Math.max(1, (int) Math.round(source.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(source.getHeight() * scale));

        if (width == source.getWidth() && height == source.getHeight()) {
            return source;
        }

        int type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage scaled = new BufferedImage(width, height, type);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }
}
