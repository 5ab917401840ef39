package com.dubbi.screentrail.explore.snapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 번의 읽기 시점에 관측한 UI 요소와 그 하위 트리.
 * handle은 해당 읽기에서만 유효하다.
 */
public record ElementSnapshot(
        String handle,
        String typeTag,
        String text,
        String label,
        String resourceTag,
        Bounds bounds,
        boolean clickable,
        boolean focusable,
        boolean scrollable,
        boolean editable,
        boolean password,
        boolean enabled,
        String ancestorPath,
        List<ElementSnapshot> children
) {
    public ElementSnapshot {
        typeTag = typeTag == null ? "" : typeTag;
        bounds = bounds == null ? Bounds.EMPTY : bounds;
        ancestorPath = ancestorPath == null ? "" : ancestorPath;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Builder builder(String typeTag) {
        return new Builder(typeTag);
    }

    /** 사람이 읽을 수 있는 이름: text, label, resourceTag 순 */
    public String displayText() {
        if (text != null && !text.isBlank()) return text.trim();
        if (label != null && !label.isBlank()) return label.trim();
        if (resourceTag != null && !resourceTag.isBlank()) return resourceTag.trim();
        return "";
    }

    public ElementSnapshot withAncestorPath(String path) {
        return new ElementSnapshot(handle, typeTag, text, label, resourceTag, bounds, clickable, focusable,
                scrollable, editable, password, enabled, path, children);
    }

    public ElementSnapshot withChildren(List<ElementSnapshot> newChildren) {
        return new ElementSnapshot(handle, typeTag, text, label, resourceTag, bounds, clickable, focusable,
                scrollable, editable, password, enabled, ancestorPath, newChildren);
    }

    public static final class Builder {
        private final String typeTag;
        private String handle;
        private String text;
        private String label;
        private String resourceTag;
        private Bounds bounds = Bounds.EMPTY;
        private boolean clickable;
        private boolean focusable;
        private boolean scrollable;
        private boolean editable;
        private boolean password;
        private boolean enabled = true;
        private final List<ElementSnapshot> children = new ArrayList<>();

        private Builder(String typeTag) {
            this.typeTag = typeTag;
        }

        public Builder handle(String handle) {
            this.handle = handle;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder resourceTag(String resourceTag) {
            this.resourceTag = resourceTag;
            return this;
        }

        public Builder bounds(Bounds bounds) {
            this.bounds = bounds;
            return this;
        }

        public Builder clickable(boolean clickable) {
            this.clickable = clickable;
            return this;
        }

        public Builder focusable(boolean focusable) {
            this.focusable = focusable;
            return this;
        }

        public Builder scrollable(boolean scrollable) {
            this.scrollable = scrollable;
            return this;
        }

        public Builder editable(boolean editable) {
            this.editable = editable;
            return this;
        }

        public Builder password(boolean password) {
            this.password = password;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder child(ElementSnapshot child) {
            this.children.add(child);
            return this;
        }

        public Builder children(List<ElementSnapshot> children) {
            this.children.addAll(children);
            return this;
        }

        public ElementSnapshot build() {
            return new ElementSnapshot(handle, typeTag, text, label, resourceTag, bounds, clickable, focusable,
                    scrollable, editable, password, enabled, "", children);
        }
    }
}
