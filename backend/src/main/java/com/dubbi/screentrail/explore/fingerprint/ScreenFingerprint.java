package com.dubbi.screentrail.explore.fingerprint;

import java.util.Objects;

/**
 * 화면 구조의 64자리 hex 지문
 */
public record ScreenFingerprint(String value) {
    public static final ScreenFingerprint EMPTY = new ScreenFingerprint("0".repeat(64));
    /** 대상 앱 밖으로 나간 전이의 도착점 */
    public static final ScreenFingerprint EXTERNAL = new ScreenFingerprint("f".repeat(64));

    public ScreenFingerprint {
        Objects.requireNonNull(value, "value");
        if (value.length() != 64) {
            throw new IllegalArgumentException("fingerprint must be 64 hex chars: " + value);
        }
    }

    public boolean isExternal() {
        return EXTERNAL.equals(this);
    }

    public String shortValue() {
        return value.substring(0, 12);
    }

    @Override
    public String toString() {
        return value;
    }
}
