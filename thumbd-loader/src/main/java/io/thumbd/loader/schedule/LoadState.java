package io.thumbd.loader.schedule;

public enum LoadState {
    PLACEHOLDER,
    LOADING,
    LOADED,
    ERROR;

    public boolean isTerminal() {
        return this == LOADED || this == ERROR;
    }
}
