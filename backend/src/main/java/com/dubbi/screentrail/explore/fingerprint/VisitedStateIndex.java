package com.dubbi.screentrail.explore.fingerprint;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 세션 단위 방문 지문 집합. 한 번 들어간 지문은 세션이 끝날 때까지 빠지지 않는다.
 */
public class VisitedStateIndex {
    private final Set<ScreenFingerprint> visited = ConcurrentHashMap.newKeySet();

    public boolean contains(ScreenFingerprint fingerprint) {
        return visited.contains(fingerprint);
    }

    /** @return 새로 추가되었으면 true */
    public boolean markVisited(ScreenFingerprint fingerprint) {
        return visited.add(fingerprint);
    }

    public void seed(Collection<ScreenFingerprint> fingerprints) {
        if (fingerprints == null) return;
        visited.addAll(fingerprints);
    }

    public int size() {
        return visited.size();
    }

    public Set<ScreenFingerprint> snapshot() {
        return Set.copyOf(visited);
    }
}
