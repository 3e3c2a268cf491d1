package io.thumbd.loader;

import io.thumbd.common.exception.LoadException;

import java.awt.image.BufferedImage;

@FunctionalInterface
public interface ImageDecoder {

    BufferedImage decode(byte[] data) throws LoadException.Decode;
}
