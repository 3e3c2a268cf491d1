package io.thumbd.loader;

public enum LoadOutcome {
    CACHED,
    STARTED,
    JOINED,
    QUEUED;

    public boolean resolvedFromCache() {
        return this == CACHED;
    }
}
