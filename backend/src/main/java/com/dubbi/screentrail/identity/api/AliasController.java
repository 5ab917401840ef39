package com.dubbi.screentrail.identity.api;

import com.dubbi.screentrail.common.dto.ListResponse;
import com.dubbi.screentrail.identity.api.dto.AliasDtos.AddAliasRequest;
import com.dubbi.screentrail.identity.api.dto.AliasDtos.AliasDTO;
import com.dubbi.screentrail.identity.api.dto.AliasDtos.CandidateDTO;
import com.dubbi.screentrail.identity.api.dto.AliasDtos.ResolveResponse;
import com.dubbi.screentrail.identity.service.Alias;
import com.dubbi.screentrail.identity.service.AliasIndex;
import com.dubbi.screentrail.identity.service.AliasSource;
import com.dubbi.screentrail.identity.service.ElementIdentity;
import com.dubbi.screentrail.identity.service.IdentityRegistry;
import com.dubbi.screentrail.persistence.PersistenceStore;
import java.util.List;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 음성 명령 문구 -> 요소 정체성 해석
 */
@RestController
@RequestMapping("/api/apps/{appId}/aliases")
public class AliasController {
    private final AliasIndex aliasIndex;
    private final IdentityRegistry identityRegistry;
    private final PersistenceStore persistenceStore;

    public AliasController(AliasIndex aliasIndex, IdentityRegistry identityRegistry, PersistenceStore persistenceStore) {
        this.aliasIndex = aliasIndex;
        this.identityRegistry = identityRegistry;
        this.persistenceStore = persistenceStore;
    }

    @GetMapping
    public ListResponse<AliasDTO> list(@PathVariable String appId) {
        warmUp(appId);
        return ListResponse.of(aliasIndex.aliases(appId).stream().map(AliasController::toDto).toList());
    }

    @GetMapping("/resolve")
    public ResolveResponse resolve(@PathVariable String appId, @RequestParam(required = false) String phrase) {
        warmUp(appId);
        var candidates = aliasIndex.resolve(phrase, appId).stream()
                .map(c -> new CandidateDTO(
                        c.identityId(),
                        identityRegistry.find(c.identityId()).map(ElementIdentity::displayName).orElse(null),
                        c.matchedPhrase(),
                        c.score(),
                        c.exact(),
                        c.source()
                ))
                .toList();
        return new ResolveResponse(phrase, candidates);
    }

    @PostMapping
    public ResponseEntity<AliasDTO> add(@PathVariable String appId, @Valid @RequestBody AddAliasRequest req) {
        warmUp(appId);
        var identity = identityRegistry.find(req.identityId());
        if (identity.isEmpty()) return ResponseEntity.notFound().build();
        if (!identity.get().appId().equals(appId)) return ResponseEntity.badRequest().build();
        if (AliasIndex.normalize(req.phrase()).isEmpty()) return ResponseEntity.badRequest().build();

        Alias alias = aliasIndex.addAlias(req.phrase(), req.identityId(), appId, AliasSource.MANUAL);
        persistenceStore.flushAliases(appId, List.of(alias));
        return ResponseEntity.ok(toDto(alias));
    }

    // after a restart the in-memory index is empty until the first exploration; fill it from the store
    private void warmUp(String appId) {
        if (identityRegistry.count(appId) > 0) return;
        identityRegistry.load(persistenceStore.loadIdentities(appId));
        aliasIndex.load(persistenceStore.loadAliases(appId));
    }

    private static AliasDTO toDto(Alias a) {
        return new AliasDTO(a.phrase(), a.identityId(), a.appId(), a.source());
    }
}
