package com.dubbi.screentrail.explore.scroll;

import static org.assertj.core.api.Assertions.assertThat;

import com.dubbi.screentrail.explore.fingerprint.ScreenFingerprinter;
import com.dubbi.screentrail.explore.fingerprint.VolatilityFilter;
import com.dubbi.screentrail.explore.snapshot.ActionKind;
import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ScrollRevealerTest {
    private final ScreenFingerprinter fingerprinter = new ScreenFingerprinter(VolatilityFilter.defaults());

    /** 한 번에 pageSize개씩 보이는 목록. total이 음수면 끝이 없다. */
    private static final class ListDriver implements ScrollDriver {
        private final int total;
        private final int pageSize;
        private int offset;
        private int forward;
        private int backward;

        ListDriver(int total, int pageSize) {
            this.total = total;
            this.pageSize = pageSize;
        }

        ScreenSnapshot snapshot() {
            ElementSnapshot.Builder feed = ElementSnapshot.builder("androidx.recyclerview.widget.RecyclerView")
                    .handle("feed").resourceTag("feed").scrollable(true);
            int end = total < 0 ? offset + pageSize : Math.min(total, offset + pageSize);
            for (int i = offset; i < end; i++) {
                feed.child(ElementSnapshot.builder("android.widget.TextView").resourceTag("row").text("Story " + i).build());
            }
            return new ScreenSnapshot("com.example.news", "1", "Feed", feed.build());
        }

        @Override
        public boolean scroll(ElementSnapshot container, ActionKind direction) {
            if (direction == ActionKind.SCROLL_FORWARD) {
                if (total >= 0 && offset + pageSize >= total) return false;
                offset += pageSize;
                forward++;
                return true;
            }
            if (offset == 0) return false;
            offset -= pageSize;
            backward++;
            return true;
        }

        @Override
        public Optional<ScreenSnapshot> read() {
            return Optional.of(snapshot());
        }
    }

    @Test
    void revealsEveryRowOfFiniteListAndScrollsBack() {
        ListDriver driver = new ListDriver(10, 4);
        ScrollRevealer revealer = new ScrollRevealer(fingerprinter, 10);

        List<ElementSnapshot> revealed = revealer.revealAll(driver.snapshot().root(), driver);

        assertThat(revealed).extracting(ElementSnapshot::text)
                .containsExactly("Story 4", "Story 5", "Story 6", "Story 7", "Story 8", "Story 9");
        assertThat(driver.forward).isEqualTo(2);
        assertThat(driver.backward).isEqualTo(2);
        assertThat(driver.offset).isZero();
    }

    @Test
    void endlessListStopsAtStepBudget() {
        ListDriver driver = new ListDriver(-1, 3);
        ScrollRevealer revealer = new ScrollRevealer(fingerprinter, 5);

        List<List<ElementSnapshot>> batches = new ArrayList<>();
        revealer.reveal(driver.snapshot().root(), driver).forEach(batches::add);

        assertThat(batches).hasSize(5);
        assertThat(batches).allSatisfy(batch -> assertThat(batch).hasSize(3));
        assertThat(driver.forward).isEqualTo(5);
        assertThat(driver.offset).isZero();
    }

    @Test
    void stableContainerEndsWithoutBatches() {
        ScrollDriver stuck = new ScrollDriver() {
            private final ListDriver inner = new ListDriver(3, 3);

            @Override
            public boolean scroll(ElementSnapshot container, ActionKind direction) {
                // accepted but nothing moves
                return true;
            }

            @Override
            public Optional<ScreenSnapshot> read() {
                return Optional.of(inner.snapshot());
            }
        };
        ListDriver initial = new ListDriver(3, 3);

        List<ElementSnapshot> revealed = new ScrollRevealer(fingerprinter, 10).revealAll(initial.snapshot().root(), stuck);

        assertThat(revealed).isEmpty();
    }

    @Test
    void eachIterationStartsOver() {
        ListDriver driver = new ListDriver(6, 3);
        Iterable<List<ElementSnapshot>> reveal = new ScrollRevealer(fingerprinter, 10).reveal(driver.snapshot().root(), driver);

        int first = 0;
        for (List<ElementSnapshot> batch : reveal) first += batch.size();
        int second = 0;
        for (List<ElementSnapshot> batch : reveal) second += batch.size();

        assertThat(first).isEqualTo(3);
        assertThat(second).isEqualTo(3);
    }
}
