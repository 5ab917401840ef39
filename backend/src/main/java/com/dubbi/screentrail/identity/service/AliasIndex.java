package com.dubbi.screentrail.identity.service;

import com.dubbi.screentrail.common.util.TextSimilarity;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 앱별 문구 -> 요소 정체성 색인.
 * resolve는 정확 일치를 먼저, 그다음 편집거리 유사도(임계값 이상)를 돌려준다.
 */
public class AliasIndex {
    public static final double DEFAULT_THRESHOLD = 0.70;

    private static final Comparator<AliasCandidate> RANKING = Comparator
            .comparing(AliasCandidate::exact).reversed()
            .thenComparing(Comparator.comparingDouble(AliasCandidate::score).reversed())
            .thenComparing(c -> c.source() == AliasSource.MANUAL ? 0 : 1)
            .thenComparing(AliasCandidate::matchedPhrase)
            .thenComparing(AliasCandidate::identityId);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Alias>> aliasesByApp = new ConcurrentHashMap<>();
    private final double similarityThreshold;

    public AliasIndex(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public static String normalize(String phrase) {
        if (phrase == null) return "";
        String folded = Normalizer.normalize(phrase, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        return folded.trim().replaceAll("\\s+", " ");
    }

    /** 같은 (문구, 정체성, 앱, 출처) 조합은 한 번만 저장된다. */
    public Alias addAlias(String phrase, String identityId, String appId, AliasSource source) {
        String normalized = normalize(phrase);
        if (normalized.isEmpty()) throw new IllegalArgumentException("alias phrase must not be blank");
        if (identityId == null || appId == null) throw new IllegalArgumentException("identityId and appId are required");
        Alias alias = new Alias(normalized, identityId, appId, source == null ? AliasSource.AUTO : source);
        aliasesByApp.computeIfAbsent(appId, k -> new CopyOnWriteArrayList<>()).addIfAbsent(alias);
        return alias;
    }

    public boolean hasAliases(String identityId, String appId) {
        List<Alias> aliases = aliasesByApp.get(appId);
        return aliases != null && aliases.stream().anyMatch(a -> a.identityId().equals(identityId));
    }

    public List<Alias> aliases(String appId) {
        List<Alias> aliases = aliasesByApp.get(appId);
        return aliases == null ? List.of() : List.copyOf(aliases);
    }

    public List<Alias> aliasesOf(String identityId, String appId) {
        return aliases(appId).stream().filter(a -> a.identityId().equals(identityId)).toList();
    }

    public void load(Collection<Alias> aliases) {
        if (aliases == null) return;
        for (Alias alias : aliases) {
            aliasesByApp.computeIfAbsent(alias.appId(), k -> new CopyOnWriteArrayList<>()).addIfAbsent(alias);
        }
    }

    /**
     * 문구를 후보 목록으로 해석한다. 정체성마다 가장 좋은 후보 하나만 남긴다.
     * 모르는 앱이나 빈 문구는 빈 목록.
     */
    public List<AliasCandidate> resolve(String phrase, String appId) {
        if (appId == null) return List.of();
        String query = normalize(phrase);
        if (query.isEmpty()) return List.of();
        List<Alias> aliases = aliasesByApp.get(appId);
        if (aliases == null || aliases.isEmpty()) return List.of();

        Map<String, AliasCandidate> bestByIdentity = new HashMap<>();
        for (Alias alias : aliases) {
            boolean exact = alias.phrase().equals(query);
            double score = exact ? 1.0 : TextSimilarity.similarity(query, alias.phrase());
            if (!exact && score < similarityThreshold) continue;
            AliasCandidate candidate = new AliasCandidate(alias.identityId(), alias.phrase(), score, exact, alias.source());
            bestByIdentity.merge(alias.identityId(), candidate, (a, b) -> RANKING.compare(a, b) <= 0 ? a : b);
        }

        List<AliasCandidate> out = new ArrayList<>(bestByIdentity.values());
        out.sort(RANKING);
        return out;
    }
}
