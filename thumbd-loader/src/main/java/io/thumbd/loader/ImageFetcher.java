package io.thumbd.loader;

import io.thumbd.common.exception.LoadException;

@FunctionalInterface
public interface ImageFetcher {

    /**
     * Downloads the raw bytes behind {@code url}. Timeouts and retries belong to the
     * implementation; any failure is reported as a {@link LoadException}.
     */
    byte[] fetch(String url) throws LoadException;
}
