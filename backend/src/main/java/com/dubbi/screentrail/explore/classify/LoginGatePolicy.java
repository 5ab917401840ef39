package com.dubbi.screentrail.explore.classify;

import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import java.util.List;
import java.util.OptionalInt;

/**
 * 로그인 화면 판정 정책
 */
@FunctionalInterface
public interface LoginGatePolicy {
    /**
     * @param element   판정할 요소
     * @param ancestors 가까운 조상부터의 목록 (없으면 빈 목록)
     * @return 로그인 화면이면 근거가 된 보조 신호 수, 아니면 empty
     */
    OptionalInt evaluate(ElementSnapshot element, List<ElementSnapshot> ancestors);

    static LoginGatePolicy never() {
        return (element, ancestors) -> OptionalInt.empty();
    }
}
