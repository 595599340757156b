package com.alterante.nearby.engine;

public enum Visibility {
    VISIBLE,
    INVISIBLE,
    TEMPORARILY_VISIBLE;

    public static Visibility of(boolean visible) {
        return visible ? VISIBLE : INVISIBLE;
    }
}
