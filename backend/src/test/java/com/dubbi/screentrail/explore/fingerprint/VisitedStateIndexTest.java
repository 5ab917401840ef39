package com.dubbi.screentrail.explore.fingerprint;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class VisitedStateIndexTest {

    @Test
    void markVisitedReportsOnlyFirstInsert() {
        VisitedStateIndex index = new VisitedStateIndex();
        ScreenFingerprint fp = new ScreenFingerprint("a".repeat(64));

        assertThat(index.contains(fp)).isFalse();
        assertThat(index.markVisited(fp)).isTrue();
        assertThat(index.markVisited(fp)).isFalse();
        assertThat(index.contains(fp)).isTrue();
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void seedAddsKnownStates() {
        VisitedStateIndex index = new VisitedStateIndex();
        index.seed(List.of(new ScreenFingerprint("b".repeat(64)), new ScreenFingerprint("c".repeat(64))));
        index.seed(null);

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.markVisited(new ScreenFingerprint("b".repeat(64)))).isFalse();
    }
}
