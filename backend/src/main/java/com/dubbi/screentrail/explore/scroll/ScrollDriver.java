package com.dubbi.screentrail.explore.scroll;

import com.dubbi.screentrail.explore.snapshot.ActionKind;
import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import java.util.Optional;

/**
 * 스크롤 노출기가 쓰는 최소한의 읽기/스크롤 통로.
 * 실패는 false/empty로 알리고, 취소는 예외로 전파한다.
 */
public interface ScrollDriver {
    boolean scroll(ElementSnapshot container, ActionKind direction);

    Optional<ScreenSnapshot> read();
}
