package com.dubbi.screentrail.identity.service;

import com.dubbi.screentrail.explore.fingerprint.VolatilityFilter;
import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;

/**
 * 요소 정체성의 구조 서명. 좌표와 handle은 포함하지 않는다.
 */
public record ElementSignature(
        String ancestorPath,
        String typeTag,
        String resourceTag,
        String text,
        String label
) {
    public ElementSignature {
        ancestorPath = nullToEmpty(ancestorPath);
        typeTag = nullToEmpty(typeTag);
        resourceTag = nullToEmpty(resourceTag);
        text = nullToEmpty(text);
        label = nullToEmpty(label);
    }

    public static ElementSignature of(ElementSnapshot element, VolatilityFilter filter) {
        return new ElementSignature(
                element.ancestorPath(),
                element.typeTag(),
                element.resourceTag(),
                filter.apply(element.text()),
                filter.apply(element.label())
        );
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
