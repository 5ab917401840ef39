package com.dubbi.screentrail.explore.snapshot;

import java.util.List;

/**
 * 한 번의 읽기 결과. root의 ancestorPath는 생성 시점에 다시 계산된다.
 */
public record ScreenSnapshot(
        String foregroundAppId,
        String appVersion,
        String title,
        ElementSnapshot root
) {
    public ScreenSnapshot {
        appVersion = appVersion == null ? "" : appVersion;
        root = root == null ? null : ElementTrees.withAncestorPaths(root);
    }

    public boolean isEmpty() {
        return root == null;
    }

    public List<ElementSnapshot> elements() {
        return root == null ? List.of() : ElementTrees.preOrder(root);
    }

    public boolean isForeground(String appId) {
        return appId != null && appId.equals(foregroundAppId);
    }
}
