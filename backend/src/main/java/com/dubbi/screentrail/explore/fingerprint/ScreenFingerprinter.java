package com.dubbi.screentrail.explore.fingerprint;

import com.dubbi.screentrail.common.util.Hashing;
import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ElementTrees;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 화면 지문 계산기.
 * 전위 순회로 type/resourceTag/필터링된 text,label/플래그/깊이 마커를 직렬화해 SHA-256을 취한다.
 * 좌표(bounds)와 handle은 포함하지 않는다.
 */
public class ScreenFingerprinter {
    private final VolatilityFilter volatilityFilter;

    public ScreenFingerprinter(VolatilityFilter volatilityFilter) {
        this.volatilityFilter = volatilityFilter;
    }

    public VolatilityFilter volatilityFilter() {
        return volatilityFilter;
    }

    public ScreenFingerprint computeFingerprint(ScreenSnapshot snapshot) {
        if (snapshot == null || snapshot.isEmpty()) return ScreenFingerprint.EMPTY;
        return computeFingerprint(snapshot.root());
    }

    /** 스크롤 컨테이너처럼 하위 트리만의 지문 */
    public ScreenFingerprint computeFingerprint(ElementSnapshot subtree) {
        if (subtree == null) return ScreenFingerprint.EMPTY;
        StringBuilder sb = new StringBuilder(256);
        serialize(subtree, 0, sb);
        return new ScreenFingerprint(Hashing.sha256Hex(sb.toString()));
    }

    /** 두 화면의 구조 유사도 (Jaccard). 뒤로가기 검증에 쓴다. */
    public double structuralSimilarity(ScreenSnapshot a, ScreenSnapshot b) {
        Set<String> left = structuralTokens(a);
        Set<String> right = structuralTokens(b);
        if (left.isEmpty() && right.isEmpty()) return 1.0;
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private Set<String> structuralTokens(ScreenSnapshot snapshot) {
        Set<String> tokens = new HashSet<>();
        if (snapshot == null || snapshot.isEmpty()) return tokens;
        for (ElementSnapshot e : snapshot.elements()) {
            tokens.add(ElementTrees.pathOf(e) + "|" + volatilityFilter.apply(e.text()) + "|" + volatilityFilter.apply(e.label()));
        }
        return tokens;
    }

    private void serialize(ElementSnapshot element, int depth, StringBuilder sb) {
        sb.append('(').append(depth).append(':')
                .append(element.typeTag()).append('|')
                .append(element.resourceTag() == null ? "" : element.resourceTag()).append('|')
                .append(volatilityFilter.apply(element.text())).append('|')
                .append(volatilityFilter.apply(element.label())).append('|')
                .append(flags(element));
        List<ElementSnapshot> children = element.children();
        for (ElementSnapshot child : children) {
            serialize(child, depth + 1, sb);
        }
        sb.append(')');
    }

    private static String flags(ElementSnapshot e) {
        return new String(new char[] {
                e.clickable() ? 'c' : '-',
                e.focusable() ? 'f' : '-',
                e.scrollable() ? 's' : '-',
                e.editable() ? 'e' : '-',
                e.password() ? 'p' : '-',
                e.enabled() ? 'n' : '-'
        });
    }
}
