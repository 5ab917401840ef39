package com.dubbi.screentrail.persistence;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import com.dubbi.screentrail.graph.domain.NavigationEdgeEntity;
import com.dubbi.screentrail.graph.domain.NavigationEdgeRepository;
import com.dubbi.screentrail.graph.domain.ScreenStateEntity;
import com.dubbi.screentrail.graph.domain.ScreenStateRepository;
import com.dubbi.screentrail.graph.service.NavigationEdge;
import com.dubbi.screentrail.graph.service.NavigationGraph;
import com.dubbi.screentrail.graph.service.ScreenNode;
import com.dubbi.screentrail.identity.domain.AliasEntity;
import com.dubbi.screentrail.identity.domain.AliasRepository;
import com.dubbi.screentrail.identity.domain.ElementIdentityEntity;
import com.dubbi.screentrail.identity.domain.ElementIdentityRepository;
import com.dubbi.screentrail.identity.service.Alias;
import com.dubbi.screentrail.identity.service.ElementIdentity;
import com.dubbi.screentrail.identity.service.ElementSignature;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA 기반 저장소. 같은 그래프/정체성/별칭을 여러 번 flush해도 행이 늘지 않는다.
 */
@Service
public class JpaPersistenceStore implements PersistenceStore {
    private static final Logger log = LoggerFactory.getLogger(JpaPersistenceStore.class);

    private final ScreenStateRepository screenStateRepository;
    private final NavigationEdgeRepository navigationEdgeRepository;
    private final ElementIdentityRepository elementIdentityRepository;
    private final AliasRepository aliasRepository;

    public JpaPersistenceStore(
            ScreenStateRepository screenStateRepository,
            NavigationEdgeRepository navigationEdgeRepository,
            ElementIdentityRepository elementIdentityRepository,
            AliasRepository aliasRepository
    ) {
        this.screenStateRepository = screenStateRepository;
        this.navigationEdgeRepository = navigationEdgeRepository;
        this.elementIdentityRepository = elementIdentityRepository;
        this.aliasRepository = aliasRepository;
    }

    @Override
    @Transactional
    public void flushGraph(String appVersion, NavigationGraph graph) {
        String appId = graph.appId();
        for (ScreenNode node : graph.screens()) {
            var entity = screenStateRepository.findByAppIdAndFingerprint(appId, node.fingerprint().value())
                    .orElseGet(() -> new ScreenStateEntity(UUID.randomUUID(), appId, node.fingerprint().value()));
            entity.update(appVersion, node.title(), node.depth(), node.elementIds());
            screenStateRepository.save(entity);
        }

        int inserted = 0;
        for (NavigationEdge edge : graph.edges()) {
            String from = edge.from().value();
            String to = edge.to().value();
            if (navigationEdgeRepository.existsTransition(appId, from, edge.triggerElementId(), to)) continue;
            navigationEdgeRepository.save(new NavigationEdgeEntity(UUID.randomUUID(), appId, from, edge.triggerElementId(), to, edge.discoveredAt()));
            inserted++;
        }
        log.info("[Store] flushed graph for {}: {} screens, {} new edges", appId, graph.screens().size(), inserted);
    }

    @Override
    @Transactional
    public void flushIdentities(String appId, List<ElementIdentity> identities) {
        for (ElementIdentity identity : identities) {
            var existing = elementIdentityRepository.findById(identity.id());
            if (existing.isPresent()) {
                existing.get().setParentId(identity.parentId());
                continue;
            }
            ElementSignature s = identity.signature();
            elementIdentityRepository.save(new ElementIdentityEntity(
                    identity.id(),
                    identity.appId(),
                    s.ancestorPath(),
                    s.typeTag(),
                    s.resourceTag(),
                    s.text(),
                    s.label(),
                    identity.parentId(),
                    identity.firstSeenAt()
            ));
        }
    }

    @Override
    @Transactional
    public void flushAliases(String appId, List<Alias> aliases) {
        for (Alias alias : aliases) {
            if (aliasRepository.existsTuple(alias.appId(), alias.phrase(), alias.identityId(), alias.source())) continue;
            aliasRepository.save(new AliasEntity(UUID.randomUUID(), alias.appId(), alias.phrase(), alias.identityId(), alias.source()));
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Set<ScreenFingerprint> loadVisitedStates(String appId, String appVersion) {
        return screenStateRepository.findFingerprintsByAppIdAndAppVersion(appId, appVersion == null ? "" : appVersion).stream()
                .map(ScreenFingerprint::new)
                .collect(Collectors.toSet());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ElementIdentity> loadIdentities(String appId) {
        return elementIdentityRepository.findByAppId(appId).stream()
                .map(e -> new ElementIdentity(
                        e.getId(),
                        e.getAppId(),
                        new ElementSignature(e.getAncestorPath(), e.getTypeTag(), e.getResourceTag(), e.getElementText(), e.getElementLabel()),
                        e.getParentId(),
                        e.getFirstSeenAt()
                ))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alias> loadAliases(String appId) {
        return aliasRepository.findByAppId(appId).stream()
                .map(a -> new Alias(a.getPhrase(), a.getIdentityId(), a.getAppId(), a.getSource()))
                .toList();
    }
}
