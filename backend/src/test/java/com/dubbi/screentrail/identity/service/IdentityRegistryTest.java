package com.dubbi.screentrail.identity.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.dubbi.screentrail.explore.fingerprint.VolatilityFilter;
import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class IdentityRegistryTest {
    private static final String APP = "com.example.shop";
    private final Clock clock = Clock.fixed(Instant.parse("2026-01-05T09:00:00Z"), ZoneOffset.UTC);
    private final VolatilityFilter filter = VolatilityFilter.defaults();

    private static List<ElementSnapshot> tabs() {
        ElementSnapshot root = ElementSnapshot.builder("android.widget.FrameLayout").resourceTag("tabs")
                .child(ElementSnapshot.builder("android.widget.Button").resourceTag("tab_home").text("Home").build())
                .child(ElementSnapshot.builder("android.widget.Button").resourceTag("tab_cart").text("Cart").build())
                .child(ElementSnapshot.builder("android.widget.Button").resourceTag("tab_profile").text("Profile").build())
                .build();
        return new ScreenSnapshot(APP, "1", null, root).elements();
    }

    private List<String> register(IdentityRegistry registry, List<ElementSnapshot> elements) {
        List<String> ids = new ArrayList<>();
        for (ElementSnapshot e : elements) ids.add(registry.resolveOrCreate(ElementSignature.of(e, filter), APP));
        return ids;
    }

    @Test
    void sameSignatureResolvesToSameId() {
        IdentityRegistry registry = new IdentityRegistry(clock);
        ElementSnapshot home = tabs().get(1);

        String first = registry.resolveOrCreate(ElementSignature.of(home, filter), APP);
        String second = registry.resolveOrCreate(ElementSignature.of(home, filter), APP);

        assertThat(first).isEqualTo(second).hasSize(32);
        assertThat(registry.count(APP)).isEqualTo(1);
        assertThat(registry.find(first)).get().extracting(ElementIdentity::displayName).isEqualTo("Home");
    }

    @Test
    void discoveryOrderDoesNotChangeIds() {
        List<ElementSnapshot> forward = tabs();
        List<ElementSnapshot> reversed = new ArrayList<>(forward);
        Collections.reverse(reversed);

        IdentityRegistry a = new IdentityRegistry(clock);
        IdentityRegistry b = new IdentityRegistry(clock);
        register(a, forward);
        register(b, reversed);

        assertThat(b.identities(APP)).extracting(ElementIdentity::id)
                .containsExactlyElementsOf(a.identities(APP).stream().map(ElementIdentity::id).toList());
    }

    @Test
    void idsAreScopedPerApp() {
        IdentityRegistry registry = new IdentityRegistry(clock);
        ElementSignature signature = ElementSignature.of(tabs().get(1), filter);

        assertThat(registry.resolveOrCreate(signature, APP))
                .isNotEqualTo(registry.resolveOrCreate(signature, "com.example.other"));
    }

    @Test
    void volatileTextSharesIdentity() {
        IdentityRegistry registry = new IdentityRegistry(clock);
        ElementSnapshot morning = ElementSnapshot.builder("android.widget.TextView").resourceTag("clock").text("09:15").build();
        ElementSnapshot evening = ElementSnapshot.builder("android.widget.TextView").resourceTag("clock").text("21:40").build();

        assertThat(registry.resolveOrCreate(ElementSignature.of(morning, filter), APP))
                .isEqualTo(registry.resolveOrCreate(ElementSignature.of(evening, filter), APP));
    }

    @Test
    void recordParentLinksKnownChildren() {
        IdentityRegistry registry = new IdentityRegistry(clock);
        List<String> ids = register(registry, tabs());

        assertThat(registry.recordParent(ids.get(1), ids.get(0))).isTrue();
        assertThat(registry.recordParent("unknown", ids.get(0))).isFalse();
        assertThat(registry.recordParent(ids.get(0), ids.get(0))).isFalse();
        assertThat(registry.children(ids.get(0))).extracting(ElementIdentity::id).containsExactly(ids.get(1));
    }

    @Test
    void loadKeepsExistingEntries() {
        IdentityRegistry registry = new IdentityRegistry(clock);
        String id = register(registry, tabs()).get(1);
        ElementIdentity stale = new ElementIdentity(id, APP, new ElementSignature("x", "y", "", "", ""), null, Instant.EPOCH);

        registry.load(List.of(stale));

        assertThat(registry.find(id)).get().extracting(ElementIdentity::firstSeenAt).isEqualTo(clock.instant());
    }
}
