package com.dubbi.screentrail.explore.classify;

import com.dubbi.screentrail.explore.snapshot.ElementSnapshot;
import com.dubbi.screentrail.explore.snapshot.ElementTrees;
import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 요소 분류기. 우선순위: LoginGate > TextInput > Dangerous > SafeActionable.
 * 모든 요소는 정확히 하나의 분류를 가진다.
 */
public class ElementClassifier {
    private final DangerousPatternRules dangerousRules;
    private final LoginGatePolicy loginGatePolicy;

    public ElementClassifier(DangerousPatternRules dangerousRules, LoginGatePolicy loginGatePolicy) {
        this.dangerousRules = dangerousRules;
        this.loginGatePolicy = loginGatePolicy;
    }

    public ElementCategory classify(ElementSnapshot element) {
        return classify(element, List.of());
    }

    public ElementCategory classify(ElementSnapshot element, ElementSnapshot parent) {
        return classify(element, parent == null ? List.of() : List.of(parent));
    }

    public ElementCategory classify(ElementSnapshot element, List<ElementSnapshot> ancestors) {
        if (element.password()) {
            OptionalInt signals = loginGatePolicy.evaluate(element, ancestors);
            if (signals.isPresent()) return new ElementCategory.LoginGate(signals.getAsInt());
        }
        if (element.editable() || element.password()) {
            return new ElementCategory.TextInput(element.password());
        }
        Optional<DangerousPatternRules.Rule> match = dangerousRules.firstMatch(haystack(element));
        if (match.isPresent()) {
            return new ElementCategory.Dangerous(match.get().reason(), match.get().pattern().pattern());
        }
        return new ElementCategory.SafeActionable();
    }

    /** 화면 전체를 전위 순서로 분류 */
    public List<ClassifiedElement> classifyScreen(ScreenSnapshot snapshot) {
        List<ClassifiedElement> out = new ArrayList<>();
        if (snapshot == null || snapshot.isEmpty()) return out;
        walk(snapshot.root(), new LinkedList<>(), out);
        return out;
    }

    private void walk(ElementSnapshot element, LinkedList<ElementSnapshot> ancestors, List<ClassifiedElement> out) {
        out.add(new ClassifiedElement(element, classify(element, List.copyOf(ancestors))));
        ancestors.addFirst(element);
        for (ElementSnapshot child : element.children()) {
            walk(child, ancestors, out);
        }
        ancestors.removeFirst();
    }

    private static String haystack(ElementSnapshot element) {
        StringBuilder sb = new StringBuilder();
        append(sb, element.text());
        append(sb, element.label());
        if (element.resourceTag() != null) {
            // btn_log_out -> "btn log out"
            append(sb, element.resourceTag().replaceAll("[_\\-/.:]+", " "));
        }
        // a clickable row is as dangerous as the words rendered inside it
        if (element.clickable()) {
            for (ElementSnapshot d : ElementTrees.preOrder(element)) {
                if (d == element) continue;
                append(sb, d.text());
                append(sb, d.label());
            }
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String value) {
        if (value == null || value.isBlank()) return;
        sb.append(value).append(' ');
    }
}
