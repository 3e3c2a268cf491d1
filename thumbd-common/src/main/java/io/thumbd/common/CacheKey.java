package io.thumbd.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content address of a cached image. Base keys hash the URL alone; variant keys hash
 * {@code url + "|" + WxH} and only ever name scaled images held in memory.
 */
public record CacheKey(String value) {

    private static final HexFormat HEX = HexFormat.of();

    public CacheKey {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("value must not be empty");
        }
    }

    public static CacheKey of(String url) {
        Objects.requireNonNull(url, "url");
        return new CacheKey(md5Hex(url));
    }

    public static CacheKey variant(String url, ThumbnailSize size) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(size, "size");
        return new CacheKey(md5Hex(url + "|" + size.width() + "x" + size.height()));
    }

    public String fileName(String extension) {
        return value + extension;
    }

    @Override
    public String toString() {
        return value;
    }

    private static String md5Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HEX.formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
