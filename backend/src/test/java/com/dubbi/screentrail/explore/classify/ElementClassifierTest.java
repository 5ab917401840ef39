package com.dubbi.screentrail.explore.classify;

import static org.assertj.core.api.Assertions.assertThat;

import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ElementClassifierTest {
    private final ElementClassifier classifier =
            new ElementClassifier(DangerousPatternRules.defaults(), CompoundLoginGatePolicy.defaults());

    private static ElementSnapshot button(String text) {
        return ElementSnapshot.builder("android.widget.Button").text(text).clickable(true).build();
    }

    private static ScreenSnapshot loginScreen() {
        ElementSnapshot form = ElementSnapshot.builder("android.widget.LinearLayout").resourceTag("login_form")
                .child(ElementSnapshot.builder("android.widget.TextView").text("Sign in to continue").build())
                .child(ElementSnapshot.builder("android.widget.EditText").resourceTag("email").label("Email").editable(true).build())
                .child(ElementSnapshot.builder("android.widget.EditText").resourceTag("password").label("Password")
                        .editable(true).password(true).build())
                .child(button("Log in"))
                .build();
        return new ScreenSnapshot("com.example.app", "1", "Login", form);
    }

    @Test
    void plainButtonIsSafe() {
        assertThat(classifier.classify(button("Settings"))).isInstanceOf(ElementCategory.SafeActionable.class);
    }

    @Test
    void logoutAndDeleteAreDangerous() {
        ElementCategory logout = classifier.classify(button("Log out"));
        ElementCategory delete = classifier.classify(button("Delete conversation"));

        assertThat(logout).isEqualTo(new ElementCategory.Dangerous("LOGOUT", DangerousPatternRules.DEFAULTS.get("LOGOUT")));
        assertThat(((ElementCategory.Dangerous) delete).reason()).isEqualTo("DELETE");
        assertThat(delete.label()).isEqualTo("dangerous:DELETE");
    }

    @Test
    void resourceTagAloneCanBeDangerous() {
        ElementSnapshot icon = ElementSnapshot.builder("android.widget.ImageButton").resourceTag("com.app:id/btn_sign_out")
                .clickable(true).build();

        assertThat(classifier.classify(icon).kind()).isEqualTo(ElementCategory.Kind.DANGEROUS);
    }

    @Test
    void clickableRowIsDangerousWhenItsChildSaysSo() {
        ElementSnapshot row = ElementSnapshot.builder("android.widget.LinearLayout").clickable(true)
                .child(ElementSnapshot.builder("android.widget.TextView").text("Remove device").build())
                .build();

        assertThat(classifier.classify(row).kind()).isEqualTo(ElementCategory.Kind.DANGEROUS);
    }

    @Test
    void editableFieldIsTextInputEvenWithDangerousWords() {
        ElementSnapshot search = ElementSnapshot.builder("android.widget.EditText").label("Search to delete").editable(true).build();

        assertThat(classifier.classify(search)).isEqualTo(new ElementCategory.TextInput(false));
    }

    @Test
    void passwordWithoutSupportingSignalsIsMaskedInput() {
        ElementSnapshot pin = ElementSnapshot.builder("android.widget.EditText").password(true).editable(true).build();

        assertThat(classifier.classify(pin)).isEqualTo(new ElementCategory.TextInput(true));
        assertThat(classifier.classify(pin).label()).isEqualTo("masked-input");
    }

    @Test
    void passwordInsideLoginFormIsLoginGate() {
        List<ClassifiedElement> classified = classifier.classifyScreen(loginScreen());

        List<ClassifiedElement> gates = classified.stream().filter(c -> c.is(ElementCategory.Kind.LOGIN_GATE)).toList();
        assertThat(gates).hasSize(1);
        assertThat(gates.get(0).element().resourceTag()).isEqualTo("password");
        // heading and the plain email field both count
        assertThat(((ElementCategory.LoginGate) gates.get(0).category()).signals()).isEqualTo(2);
    }

    @Test
    void changePasswordFormIsNotLoginGate() {
        ElementSnapshot form = ElementSnapshot.builder("android.widget.LinearLayout").resourceTag("change_password")
                .child(ElementSnapshot.builder("android.widget.TextView").text("Change password").build())
                .child(ElementSnapshot.builder("android.widget.EditText").resourceTag("current").label("Current password")
                        .editable(true).password(true).build())
                .child(ElementSnapshot.builder("android.widget.EditText").resourceTag("fresh").label("New password")
                        .editable(true).password(true).build())
                .child(button("Save"))
                .build();

        List<ClassifiedElement> classified = classifier.classifyScreen(new ScreenSnapshot("com.example.app", "1", "Security", form));

        assertThat(classified).noneMatch(c -> c.is(ElementCategory.Kind.LOGIN_GATE));
        assertThat(classified.stream().filter(c -> c.category().equals(new ElementCategory.TextInput(true)))).hasSize(2);
    }

    @Test
    void classificationIsTotal() {
        List<ClassifiedElement> classified = classifier.classifyScreen(loginScreen());

        assertThat(classified).hasSize(loginScreen().elements().size());
        assertThat(classified).allSatisfy(c -> assertThat(c.category()).isNotNull());
        Map<ElementCategory.Kind, Long> byKind = classified.stream()
                .collect(Collectors.groupingBy(c -> c.category().kind(), Collectors.counting()));
        assertThat(EnumSet.allOf(ElementCategory.Kind.class)).containsAll(byKind.keySet());
    }

    @Test
    void onlySafeEnabledClickablesAreClickTargets() {
        ElementSnapshot disabled = ElementSnapshot.builder("android.widget.Button").text("Next").clickable(true).enabled(false).build();

        assertThat(new ClassifiedElement(button("Next"), classifier.classify(button("Next"))).isClickTarget()).isTrue();
        assertThat(new ClassifiedElement(disabled, classifier.classify(disabled)).isClickTarget()).isFalse();
        assertThat(new ClassifiedElement(button("Log out"), classifier.classify(button("Log out"))).isClickTarget()).isFalse();
    }

    @Test
    void permissionControllerIsDetected() {
        PermissionPromptDetector detector = new PermissionPromptDetector(PermissionPromptDetector.DEFAULT_PACKAGES);
        ElementSnapshot root = ElementSnapshot.builder("android.widget.FrameLayout").build();

        assertThat(detector.isPermissionPrompt(new ScreenSnapshot("com.android.permissioncontroller", "", null, root))).isTrue();
        assertThat(detector.isPermissionPrompt(new ScreenSnapshot("com.example.app", "", null, root))).isFalse();
    }
}
