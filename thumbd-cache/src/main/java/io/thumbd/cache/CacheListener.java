package io.thumbd.cache;

@FunctionalInterface
public interface CacheListener {

    void onCacheCleared();
}
