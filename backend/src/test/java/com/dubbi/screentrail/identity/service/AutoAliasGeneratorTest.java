package com.dubbi.screentrail.identity.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import org.junit.jupiter.api.Test;

class AutoAliasGeneratorTest {
    private static final String APP = "com.example.app";
    private final AutoAliasGenerator generator = new AutoAliasGenerator();

    @Test
    void prefersTextThenLabelThenResourceTail() {
        ElementSnapshot withText = ElementSnapshot.builder("android.widget.Button").text("Open Settings!").label("Settings button").build();
        ElementSnapshot withLabel = ElementSnapshot.builder("android.widget.ImageButton").label("Search").build();
        ElementSnapshot withResource = ElementSnapshot.builder("android.widget.ImageButton").resourceTag("com.app:id/btn_share_photo").build();

        assertThat(generator.generate(withText, APP)).contains("open settings");
        assertThat(generator.generate(withLabel, APP)).contains("search");
        assertThat(generator.generate(withResource, APP)).contains("btn share photo");
    }

    @Test
    void tooShortTextFallsThrough() {
        ElementSnapshot ok = ElementSnapshot.builder("android.widget.Button").text("OK").label("Confirm").build();

        assertThat(generator.generate(ok, APP)).contains("confirm");
    }

    @Test
    void longTextIsCutAtWordBoundary() {
        String text = "This is a very long description that keeps going well past the limit";
        ElementSnapshot element = ElementSnapshot.builder("android.widget.TextView").text(text).build();

        String alias = generator.generate(element, APP).orElseThrow();
        assertThat(alias.length()).isLessThanOrEqualTo(AutoAliasGenerator.MAX_LENGTH);
        assertThat(text.toLowerCase()).startsWith(alias);
    }

    @Test
    void unnamedControlsGetNumberedTypeNames() {
        ElementSnapshot icon = ElementSnapshot.builder("android.widget.ImageButton").clickable(true).build();

        assertThat(generator.generate(icon, APP)).contains("imagebutton 1");
        assertThat(generator.generate(icon, APP)).contains("imagebutton 2");
        assertThat(generator.generate(icon, "com.example.other")).contains("imagebutton 1");
    }

    @Test
    void unnamedDecorationGetsNoAlias() {
        ElementSnapshot spacer = ElementSnapshot.builder("android.view.View").build();

        assertThat(generator.generate(spacer, APP)).isEmpty();
    }
}
