package com.dubbi.screentrail.explore.snapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 요소 트리 순회/경로 계산 유틸리티
 */
public final class ElementTrees {
    private ElementTrees() {}

    public static List<ElementSnapshot> preOrder(ElementSnapshot root) {
        List<ElementSnapshot> out = new ArrayList<>();
        if (root == null) return out;
        Deque<ElementSnapshot> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ElementSnapshot current = stack.pop();
            out.add(current);
            List<ElementSnapshot> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /** 경로 세그먼트: typeTag 또는 typeTag#resourceTag */
    public static String segment(ElementSnapshot element) {
        String tag = element.resourceTag();
        if (tag == null || tag.isBlank()) return element.typeTag();
        return element.typeTag() + "#" + tag;
    }

    public static String pathOf(ElementSnapshot element) {
        if (element.ancestorPath().isEmpty()) return segment(element);
        return element.ancestorPath() + "/" + segment(element);
    }

    /** 위치 인덱스 없이 구조 경로만으로 ancestorPath를 채운 복사본 */
    public static ElementSnapshot withAncestorPaths(ElementSnapshot root) {
        return assignPaths(root, "");
    }

    private static ElementSnapshot assignPaths(ElementSnapshot element, String ancestorPath) {
        ElementSnapshot placed = element.withAncestorPath(ancestorPath);
        if (placed.children().isEmpty()) return placed;
        String childPath = pathOf(placed);
        List<ElementSnapshot> children = new ArrayList<>(placed.children().size());
        for (ElementSnapshot child : placed.children()) {
            children.add(assignPaths(child, childPath));
        }
        return placed.withChildren(children);
    }

    public static Optional<ElementSnapshot> findByPath(ElementSnapshot root, String path) {
        if (root == null || path == null) return Optional.empty();
        return preOrder(root).stream().filter(e -> pathOf(e).equals(path)).findFirst();
    }

    /** 스크롤 병합 등에 쓰는 구조 키 */
    public static String structuralKey(ElementSnapshot element) {
        return pathOf(element) + "|" + nullToEmpty(element.text()) + "|" + nullToEmpty(element.label());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
