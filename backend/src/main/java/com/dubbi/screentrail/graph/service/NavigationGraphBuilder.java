package com.dubbi.screentrail.graph.service;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 앱별 내비게이션 그래프 누적기.
 * 같은 (from, trigger, to) 간선은 한 번만 기록된다.
 */
public class NavigationGraphBuilder {
    private final ConcurrentHashMap<String, Arena> arenas = new ConcurrentHashMap<>();
    private final Clock clock;

    public NavigationGraphBuilder(Clock clock) {
        this.clock = clock;
    }

    public void addScreen(String appId, ScreenFingerprint fingerprint, String title, int depth, List<String> elementIds) {
        arena(appId).putScreen(new ScreenNode(fingerprint, title, depth, elementIds));
    }

    /** @return 새 간선이면 true */
    public boolean addEdge(String appId, ScreenFingerprint from, String triggerElementId, ScreenFingerprint to) {
        return arena(appId).putEdge(new NavigationEdge(from, triggerElementId, to, clock.instant()));
    }

    public NavigationGraph getGraph(String appId) {
        Arena arena = arenas.get(appId);
        if (arena == null) return NavigationGraph.empty(appId);
        return arena.snapshot(appId);
    }

    private Arena arena(String appId) {
        return arenas.computeIfAbsent(appId, k -> new Arena());
    }

    private static final class Arena {
        private final List<ScreenNode> screens = new ArrayList<>();
        private final Map<ScreenFingerprint, Integer> index = new HashMap<>();
        private final List<NavigationEdge> edges = new ArrayList<>();
        private final Set<NavigationEdge.Transition> transitions = new HashSet<>();
        private final Set<ScreenFingerprint> placeholders = new HashSet<>();

        synchronized void putScreen(ScreenNode node) {
            Integer existing = index.get(node.fingerprint());
            if (existing == null) {
                index.put(node.fingerprint(), screens.size());
                screens.add(node);
                return;
            }
            // a screen first seen as an edge endpoint gets its real content once explored
            if (placeholders.remove(node.fingerprint())) {
                screens.set(existing, node);
            }
        }

        synchronized boolean putEdge(NavigationEdge edge) {
            if (!transitions.add(edge.transition())) return false;
            ensureScreen(edge.from());
            ensureScreen(edge.to());
            edges.add(edge);
            return true;
        }

        private void ensureScreen(ScreenFingerprint fingerprint) {
            if (index.containsKey(fingerprint)) return;
            String title = fingerprint.isExternal() ? "external" : null;
            index.put(fingerprint, screens.size());
            screens.add(new ScreenNode(fingerprint, title, -1, List.of()));
            placeholders.add(fingerprint);
        }

        synchronized NavigationGraph snapshot(String appId) {
            return new NavigationGraph(appId, screens, edges);
        }
    }
}
