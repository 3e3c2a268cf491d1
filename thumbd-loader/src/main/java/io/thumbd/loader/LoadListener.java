package io.thumbd.loader;

import io.thumbd.common.ThumbnailSize;

import java.awt.image.BufferedImage;

public interface LoadListener {

    /**
     * @param size the requested bounds, or {@code null} when the original image was requested
     */
    void onLoaded(String url, ThumbnailSize size, BufferedImage image);

    void onFailed(String url, String message);

    default void onCancelled(String url) {}
}
