package com.dubbi.screentrail.graph.service;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import java.util.List;

public record ScreenNode(
        ScreenFingerprint fingerprint,
        String title,
        int depth,
        List<String> elementIds
) {
    public ScreenNode {
        elementIds = elementIds == null ? List.of() : List.copyOf(elementIds);
    }
}
