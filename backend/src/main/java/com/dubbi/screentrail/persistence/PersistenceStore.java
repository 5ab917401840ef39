package com.dubbi.screentrail.persistence;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import com.dubbi.screentrail.graph.service.NavigationGraph;
import com.dubbi.screentrail.identity.service.Alias;
import com.dubbi.screentrail.identity.service.ElementIdentity;
import java.util.List;
import java.util.Set;

/**
 * 탐색 결과 저장소. 세션이 끝날 때 한 번 flush하고, 시작할 때 load한다.
 * 모든 flush는 멱등이다.
 */
public interface PersistenceStore {
    void flushGraph(String appVersion, NavigationGraph graph);

    void flushIdentities(String appId, List<ElementIdentity> identities);

    void flushAliases(String appId, List<Alias> aliases);

    /** 저장된 앱 버전이 같을 때만 그 버전에서 본 화면 지문을 돌려준다. */
    Set<ScreenFingerprint> loadVisitedStates(String appId, String appVersion);

    List<ElementIdentity> loadIdentities(String appId);

    List<Alias> loadAliases(String appId);
}
