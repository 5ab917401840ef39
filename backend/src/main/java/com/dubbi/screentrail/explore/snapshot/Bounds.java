package com.dubbi.screentrail.explore.snapshot;

public record Bounds(int left, int top, int right, int bottom) {
    public static final Bounds EMPTY = new Bounds(0, 0, 0, 0);

    public int width() {
        return Math.max(0, right - left);
    }

    public int height() {
        return Math.max(0, bottom - top);
    }
}
