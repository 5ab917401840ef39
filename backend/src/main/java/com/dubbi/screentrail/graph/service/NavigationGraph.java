package com.dubbi.screentrail.graph.service;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;

/**
 * 한 앱의 내비게이션 그래프 스냅샷 (불변).
 * 화면은 인덱스로, 간선은 인접 리스트로 참조한다.
 */
public final class NavigationGraph {
    private final String appId;
    private final List<ScreenNode> screens;
    private final List<NavigationEdge> edges;
    private final Map<ScreenFingerprint, Integer> indexByFingerprint;
    private final List<List<Integer>> outgoing;

    NavigationGraph(String appId, List<ScreenNode> screens, List<NavigationEdge> edges) {
        this.appId = appId;
        this.screens = List.copyOf(screens);
        this.edges = List.copyOf(edges);
        this.indexByFingerprint = new HashMap<>();
        for (int i = 0; i < this.screens.size(); i++) {
            indexByFingerprint.put(this.screens.get(i).fingerprint(), i);
        }
        List<List<Integer>> adjacency = new ArrayList<>();
        for (int i = 0; i < this.screens.size(); i++) adjacency.add(new ArrayList<>());
        for (int e = 0; e < this.edges.size(); e++) {
            Integer from = indexByFingerprint.get(this.edges.get(e).from());
            if (from != null) adjacency.get(from).add(e);
        }
        this.outgoing = adjacency;
    }

    public static NavigationGraph empty(String appId) {
        return new NavigationGraph(appId, List.of(), List.of());
    }

    public String appId() {
        return appId;
    }

    public List<ScreenNode> screens() {
        return screens;
    }

    public List<NavigationEdge> edges() {
        return edges;
    }

    public boolean containsScreen(ScreenFingerprint fingerprint) {
        return indexByFingerprint.containsKey(fingerprint);
    }

    public Optional<ScreenNode> screen(ScreenFingerprint fingerprint) {
        Integer index = indexByFingerprint.get(fingerprint);
        return index == null ? Optional.empty() : Optional.of(screens.get(index));
    }

    public List<NavigationEdge> outgoing(ScreenFingerprint fingerprint) {
        Integer index = indexByFingerprint.get(fingerprint);
        if (index == null) return List.of();
        return outgoing.get(index).stream().map(edges::get).toList();
    }

    /** BFS 최단 경로. 도달 불가면 빈 Optional, 같은 화면이면 빈 경로. */
    public Optional<List<NavigationEdge>> shortestPath(ScreenFingerprint from, ScreenFingerprint to) {
        Integer start = indexByFingerprint.get(from);
        Integer goal = indexByFingerprint.get(to);
        if (start == null || goal == null) return Optional.empty();
        if (start.equals(goal)) return Optional.of(List.of());

        Map<Integer, Integer> viaEdge = new HashMap<>();
        Queue<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        viaEdge.put(start, -1);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int edgeIndex : outgoing.get(current)) {
                Integer next = indexByFingerprint.get(edges.get(edgeIndex).to());
                if (next == null || viaEdge.containsKey(next)) continue;
                viaEdge.put(next, edgeIndex);
                if (next.equals(goal)) return Optional.of(unwind(viaEdge, goal));
                queue.add(next);
            }
        }
        return Optional.empty();
    }

    private List<NavigationEdge> unwind(Map<Integer, Integer> viaEdge, int goal) {
        List<NavigationEdge> path = new ArrayList<>();
        int cursor = goal;
        while (viaEdge.get(cursor) != -1) {
            NavigationEdge edge = edges.get(viaEdge.get(cursor));
            path.add(edge);
            cursor = indexByFingerprint.get(edge.from());
        }
        Collections.reverse(path);
        return path;
    }
}
