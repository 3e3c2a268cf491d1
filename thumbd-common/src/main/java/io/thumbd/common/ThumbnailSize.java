package io.thumbd.common;

public record ThumbnailSize(int width, int height) {

    public ThumbnailSize {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive");
        }
        if (height <= 0) {
            throw new IllegalArgumentException("height must be positive");
        }
    }

    public static ThumbnailSize of(int width, int height) {
        return new ThumbnailSize(width, height);
    }

    public static ThumbnailSize parse(String text) {
        int sep = text.indexOf('x');
        if (sep <= 0 || sep == text.length() - 1) {
            throw new IllegalArgumentException("Expected WIDTHxHEIGHT, got: " + text);
        }
        try {
            return new ThumbnailSize(
                Integer.parseInt(text.substring(0, sep)),
                Integer.parseInt(text.substring(sep + 1))
            );
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected WIDTHxHEIGHT, got: " + text, e);
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
