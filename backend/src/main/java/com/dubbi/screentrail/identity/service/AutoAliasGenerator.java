package com.dubbi.screentrail.identity.service;

import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 탐색 중 요소 별칭 자동 생성.
 * text -> label -> resourceTag 꼬리 순으로 쓰고, 모두 없으면 조작 가능한 요소에 한해 "타입 n"을 붙인다.
 */
public class AutoAliasGenerator {
    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 50;

    private final ConcurrentHashMap<String, AtomicInteger> genericCounters = new ConcurrentHashMap<>();

    public Optional<String> generate(ElementSnapshot element, String appId) {
        for (String raw : new String[] {element.text(), element.label(), resourceTail(element.resourceTag())}) {
            String cleaned = sanitize(raw);
            if (cleaned.length() >= MIN_LENGTH) {
                return Optional.of(truncate(cleaned));
            }
        }
        if (!element.clickable() && !element.editable()) return Optional.empty();

        String type = typeName(element.typeTag());
        int n = genericCounters.computeIfAbsent(appId + "|" + type, k -> new AtomicInteger()).incrementAndGet();
        return Optional.of(type + " " + n);
    }

    static String sanitize(String raw) {
        if (raw == null) return "";
        String normalized = AliasIndex.normalize(raw);
        return normalized.replaceAll("[^\\p{L}\\p{N} ]+", " ").trim().replaceAll("\\s+", " ");
    }

    private static String truncate(String value) {
        if (value.length() <= MAX_LENGTH) return value;
        String cut = value.substring(0, MAX_LENGTH);
        int lastSpace = cut.lastIndexOf(' ');
        return (lastSpace >= MIN_LENGTH ? cut.substring(0, lastSpace) : cut).trim();
    }

    /** com.app:id/btn_submit -> "btn submit" */
    private static String resourceTail(String resourceTag) {
        if (resourceTag == null || resourceTag.isBlank()) return null;
        String tail = resourceTag;
        int slash = tail.lastIndexOf('/');
        if (slash >= 0) tail = tail.substring(slash + 1);
        return tail.replace('_', ' ').replace('-', ' ');
    }

    /** android.widget.ImageButton -> "imagebutton" */
    private static String typeName(String typeTag) {
        if (typeTag == null || typeTag.isBlank()) return "element";
        String tail = typeTag;
        int dot = tail.lastIndexOf('.');
        if (dot >= 0) tail = tail.substring(dot + 1);
        int colon = tail.indexOf(':');
        if (colon >= 0) tail = tail.substring(colon + 1);
        String cleaned = tail.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        return cleaned.isEmpty() ? "element" : cleaned;
    }
}
