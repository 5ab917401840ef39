package com.dubbi.screentrail.explore.fingerprint;

import static org.assertj.core.api.Assertions.assertThat;

import com.dubbi.screentrail.explore.snapshot.Bounds;
import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import org.junit.jupiter.api.Test;

class ScreenFingerprinterTest {
    private final ScreenFingerprinter fingerprinter = new ScreenFingerprinter(VolatilityFilter.defaults());

    private static ScreenSnapshot inbox(String clock, String badge, Bounds buttonBounds) {
        ElementSnapshot root = ElementSnapshot.builder("android.widget.FrameLayout")
                .resourceTag("content")
                .child(ElementSnapshot.builder("android.widget.TextView").resourceTag("status_clock").text(clock).build())
                .child(ElementSnapshot.builder("android.widget.TextView").resourceTag("title").text("Inbox").build())
                .child(ElementSnapshot.builder("android.widget.TextView").resourceTag("badge").text(badge).build())
                .child(ElementSnapshot.builder("android.widget.Button").resourceTag("compose").text("Compose")
                        .clickable(true).bounds(buttonBounds).build())
                .build();
        return new ScreenSnapshot("com.example.mail", "3.1", "Inbox", root);
    }

    @Test
    void sameTreeGivesSameFingerprint() {
        ScreenSnapshot a = inbox("09:41", "3", new Bounds(0, 0, 100, 40));
        ScreenSnapshot b = inbox("09:41", "3", new Bounds(0, 0, 100, 40));

        assertThat(fingerprinter.computeFingerprint(a)).isEqualTo(fingerprinter.computeFingerprint(b));
        assertThat(fingerprinter.computeFingerprint(a).value()).hasSize(64).matches("[0-9a-f]{64}");
    }

    @Test
    void clockAndBadgeChangesDoNotChangeFingerprint() {
        ScreenSnapshot morning = inbox("09:41", "3", new Bounds(0, 0, 100, 40));
        ScreenSnapshot later = inbox("10:02 pm", "12", new Bounds(0, 0, 100, 40));

        assertThat(fingerprinter.computeFingerprint(later)).isEqualTo(fingerprinter.computeFingerprint(morning));
    }

    @Test
    void boundsNeverAffectFingerprint() {
        ScreenSnapshot portrait = inbox("09:41", "3", new Bounds(0, 0, 100, 40));
        ScreenSnapshot landscape = inbox("09:41", "3", new Bounds(600, 300, 900, 360));

        assertThat(fingerprinter.computeFingerprint(landscape)).isEqualTo(fingerprinter.computeFingerprint(portrait));
    }

    @Test
    void structuralChangeChangesFingerprint() {
        ScreenSnapshot inbox = inbox("09:41", "3", Bounds.EMPTY);
        ElementSnapshot sent = ElementSnapshot.builder("android.widget.FrameLayout")
                .resourceTag("content")
                .child(ElementSnapshot.builder("android.widget.TextView").resourceTag("title").text("Sent").build())
                .build();

        assertThat(fingerprinter.computeFingerprint(new ScreenSnapshot("com.example.mail", "3.1", "Sent", sent)))
                .isNotEqualTo(fingerprinter.computeFingerprint(inbox));
    }

    @Test
    void flagsArePartOfFingerprint() {
        ElementSnapshot enabled = ElementSnapshot.builder("android.widget.Button").text("Next").clickable(true).build();
        ElementSnapshot disabled = ElementSnapshot.builder("android.widget.Button").text("Next").clickable(true).enabled(false).build();

        assertThat(fingerprinter.computeFingerprint(disabled)).isNotEqualTo(fingerprinter.computeFingerprint(enabled));
    }

    @Test
    void emptySnapshotIsEmptyFingerprint() {
        assertThat(fingerprinter.computeFingerprint(new ScreenSnapshot("com.example.mail", "", null, null)))
                .isEqualTo(ScreenFingerprint.EMPTY);
        assertThat(fingerprinter.computeFingerprint((ScreenSnapshot) null)).isEqualTo(ScreenFingerprint.EMPTY);
    }

    @Test
    void structuralSimilarityIgnoresVolatileText() {
        ScreenSnapshot a = inbox("09:41", "3", Bounds.EMPTY);
        ScreenSnapshot b = inbox("11:15", "7", Bounds.EMPTY);

        assertThat(fingerprinter.structuralSimilarity(a, b)).isEqualTo(1.0);
    }

    @Test
    void volatilityFilterKeepsPageNumbers() {
        VolatilityFilter filter = VolatilityFilter.defaults();

        assertThat(filter.apply("Page 2")).isEqualTo("Page 2");
        assertThat(filter.apply("5 min ago")).isEqualTo("{v}");
        assertThat(filter.apply("Order 1234567")).isEqualTo("Order {v}");
        assertThat(filter.apply(null)).isEmpty();
    }
}
