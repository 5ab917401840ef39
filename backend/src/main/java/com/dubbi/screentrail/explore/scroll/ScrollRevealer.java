package com.dubbi.screentrail.explore.scroll;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprint;
import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprinter;
import com.dubbi.screentrail.explore.snapshot.ActionKind;
import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ElementTrees;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 스크롤 컨테이너를 끝까지 넘기며 새로 보이는 요소를 조금씩 돌려준다.
 * 컨테이너 하위 지문이 두 번 연속 같거나 최대 스텝에 닿으면 멈추고,
 * 멈출 때 넘긴 만큼 되돌려 놓는다.
 */
public class ScrollRevealer {
    private static final Logger log = LoggerFactory.getLogger(ScrollRevealer.class);

    private final ScreenFingerprinter fingerprinter;
    private final int maxSteps;

    public ScrollRevealer(ScreenFingerprinter fingerprinter, int maxSteps) {
        this.fingerprinter = fingerprinter;
        this.maxSteps = Math.max(0, maxSteps);
    }

    /** 호출마다 처음부터 다시 스크롤하는 Iterable */
    public Iterable<List<ElementSnapshot>> reveal(ElementSnapshot container, ScrollDriver driver) {
        return () -> new RevealIterator(container, driver);
    }

    /** 노출된 요소를 모두 모아 돌려준다 (스크롤 복원까지 끝난 뒤 반환) */
    public List<ElementSnapshot> revealAll(ElementSnapshot container, ScrollDriver driver) {
        List<ElementSnapshot> all = new ArrayList<>();
        for (List<ElementSnapshot> batch : reveal(container, driver)) {
            all.addAll(batch);
        }
        return all;
    }

    private final class RevealIterator implements Iterator<List<ElementSnapshot>> {
        private final ScrollDriver driver;
        private final String containerPath;
        private final Set<String> seenKeys = new HashSet<>();
        private ElementSnapshot current;
        private ScreenFingerprint lastFingerprint;
        private int steps;
        private boolean finished;
        private List<ElementSnapshot> next;

        RevealIterator(ElementSnapshot container, ScrollDriver driver) {
            this.driver = driver;
            this.current = container;
            this.containerPath = ElementTrees.pathOf(container);
            this.lastFingerprint = fingerprinter.computeFingerprint(container);
            for (ElementSnapshot e : ElementTrees.preOrder(container)) {
                seenKeys.add(ElementTrees.structuralKey(e));
            }
        }

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (finished) return false;
            next = advance();
            return next != null;
        }

        @Override
        public List<ElementSnapshot> next() {
            if (!hasNext()) throw new NoSuchElementException();
            List<ElementSnapshot> out = next;
            next = null;
            return out;
        }

        private List<ElementSnapshot> advance() {
            while (steps < maxSteps) {
                if (!driver.scroll(current, ActionKind.SCROLL_FORWARD)) {
                    log.debug("scroll forward rejected on {} after {} steps", containerPath, steps);
                    break;
                }
                steps++;

                Optional<ScreenSnapshot> snapshot = driver.read();
                if (snapshot.isEmpty()) break;
                Optional<ElementSnapshot> located = ElementTrees.findByPath(snapshot.get().root(), containerPath);
                if (located.isEmpty()) {
                    log.debug("scroll container {} disappeared", containerPath);
                    break;
                }
                current = located.get();

                ScreenFingerprint fingerprint = fingerprinter.computeFingerprint(current);
                if (fingerprint.equals(lastFingerprint)) break;
                lastFingerprint = fingerprint;

                List<ElementSnapshot> fresh = new ArrayList<>();
                for (ElementSnapshot e : ElementTrees.preOrder(current)) {
                    if (seenKeys.add(ElementTrees.structuralKey(e))) fresh.add(e);
                }
                if (!fresh.isEmpty()) return fresh;
            }
            finish();
            return null;
        }

        private void finish() {
            finished = true;
            int restored = 0;
            while (restored < steps) {
                if (!driver.scroll(current, ActionKind.SCROLL_BACKWARD)) {
                    log.warn("scroll restore stopped on {} ({} of {} steps)", containerPath, restored, steps);
                    return;
                }
                restored++;
            }
        }
    }
}
