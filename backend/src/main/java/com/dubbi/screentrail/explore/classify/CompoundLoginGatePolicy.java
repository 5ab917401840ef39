package com.dubbi.screentrail.explore.classify;

import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ElementTrees;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 비밀번호 입력 + 보조 신호 조합으로 로그인 화면을 판정한다.
 * 보조 신호: 주변의 로그인 문구, 하위의 로그인 문구, 주변의 일반 입력칸(아이디).
 * 다른 비밀번호 칸은 신호가 아니다. 비밀번호 변경 화면은 로그인 화면이 아니다.
 */
public class CompoundLoginGatePolicy implements LoginGatePolicy {
    public static final List<String> DEFAULT_KEYWORDS = List.of(
            "\\b(log\\s*in|sign\\s*in|login|signin)\\b",
            "\\b(user\\s*name|username|e-?mail)\\b",
            "\\b(forgot|continue\\s+with)\\b"
    );

    private final List<Pattern> keywords;
    private final int minSupportingSignals;
    private final int searchLevels;

    public CompoundLoginGatePolicy(List<String> keywordRegexes, int minSupportingSignals, int searchLevels) {
        List<String> source = (keywordRegexes == null || keywordRegexes.isEmpty()) ? DEFAULT_KEYWORDS : keywordRegexes;
        this.keywords = source.stream().map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE)).toList();
        this.minSupportingSignals = Math.max(1, minSupportingSignals);
        this.searchLevels = Math.max(1, searchLevels);
    }

    public static CompoundLoginGatePolicy defaults() {
        return new CompoundLoginGatePolicy(DEFAULT_KEYWORDS, 1, 2);
    }

    @Override
    public OptionalInt evaluate(ElementSnapshot element, List<ElementSnapshot> ancestors) {
        if (!element.password()) return OptionalInt.empty();
        int signals = supportingSignals(element, ancestors);
        return signals >= minSupportingSignals ? OptionalInt.of(signals) : OptionalInt.empty();
    }

    int supportingSignals(ElementSnapshot element, List<ElementSnapshot> ancestors) {
        Set<ElementSnapshot> own = Collections.newSetFromMap(new IdentityHashMap<>());
        own.addAll(ElementTrees.preOrder(element));

        boolean descendantLabel = own.stream()
                .filter(e -> e != element)
                .anyMatch(this::looksLikeLogin);

        boolean nearbyLabel = false;
        boolean nearbyPlainInput = false;
        if (!ancestors.isEmpty()) {
            ElementSnapshot scope = ancestors.get(Math.min(searchLevels, ancestors.size()) - 1);
            for (ElementSnapshot e : ElementTrees.preOrder(scope)) {
                if (own.contains(e) || e.password()) continue;
                if (looksLikeLogin(e)) nearbyLabel = true;
                if (e.editable() && !e.password()) nearbyPlainInput = true;
            }
        }

        int signals = 0;
        if (descendantLabel) signals++;
        if (nearbyLabel) signals++;
        if (nearbyPlainInput) signals++;
        return signals;
    }

    private boolean looksLikeLogin(ElementSnapshot e) {
        return matches(e.text()) || matches(e.label());
    }

    private boolean matches(String value) {
        if (value == null || value.isBlank()) return false;
        for (Pattern p : keywords) {
            if (p.matcher(value).find()) return true;
        }
        return false;
    }
}
