package com.dubbi.screentrail.explore.classify;

import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;

public record ClassifiedElement(ElementSnapshot element, ElementCategory category) {
    /** 탐색 중 클릭해도 되는 요소인지 */
    public boolean isClickTarget() {
        return category.kind() == ElementCategory.Kind.SAFE_ACTIONABLE
                && element.clickable()
                && element.enabled();
    }

    public boolean is(ElementCategory.Kind kind) {
        return category.kind() == kind;
    }
}
