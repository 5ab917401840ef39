package com.dubbi.screentrail.identity.service;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 요소 정체성 레지스트리.
 * 같은 앱에서 같은 구조 서명은 발견 순서와 실행 횟수에 상관없이 같은 id가 된다.
 */
public class IdentityRegistry {
    private final ConcurrentHashMap<String, ElementIdentity> identitiesById = new ConcurrentHashMap<>();
    private final Clock clock;

    public IdentityRegistry(Clock clock) {
        this.clock = clock;
    }

    public String resolveOrCreate(ElementSignature signature, String appId) {
        String id = ElementIdentity.idFor(appId, signature);
        identitiesById.computeIfAbsent(id, k -> new ElementIdentity(k, appId, signature, null, clock.instant()));
        return id;
    }

    /** @return 자식이 등록되어 있지 않으면 false */
    public boolean recordParent(String childId, String parentId) {
        if (childId == null || childId.equals(parentId)) return false;
        return identitiesById.computeIfPresent(childId, (k, v) -> v.withParentId(parentId)) != null;
    }

    public Optional<ElementIdentity> find(String id) {
        return Optional.ofNullable(identitiesById.get(id));
    }

    public List<ElementIdentity> identities(String appId) {
        return identitiesById.values().stream()
                .filter(i -> i.appId().equals(appId))
                .sorted(Comparator.comparing(ElementIdentity::id))
                .toList();
    }

    public List<ElementIdentity> children(String parentId) {
        return identitiesById.values().stream()
                .filter(i -> parentId.equals(i.parentId()))
                .sorted(Comparator.comparing(ElementIdentity::id))
                .toList();
    }

    public int count(String appId) {
        return (int) identitiesById.values().stream().filter(i -> i.appId().equals(appId)).count();
    }

    /** 저장소에서 읽은 정체성을 채운다. 이미 있는 id는 건드리지 않는다. */
    public void load(Collection<ElementIdentity> identities) {
        if (identities == null) return;
        for (ElementIdentity identity : identities) {
            identitiesById.putIfAbsent(identity.id(), identity);
        }
    }
}
