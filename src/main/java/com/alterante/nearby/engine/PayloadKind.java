package com.alterante.nearby.engine;

public enum PayloadKind {
    FILES,
    TEXT,
    URL,
    WIFI;

    public boolean isText() {
        return this != FILES;
    }
}
