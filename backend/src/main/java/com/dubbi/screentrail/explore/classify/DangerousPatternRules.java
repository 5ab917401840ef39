package com.dubbi.screentrail.explore.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 우선순위가 있는 위험 행동 규칙. 첫 번째로 일치한 규칙이 이유가 된다.
 */
public record DangerousPatternRules(List<Rule> rules) {
    public record Rule(String reason, Pattern pattern) {}

    public static final Map<String, String> DEFAULTS = defaultRules();

    private static Map<String, String> defaultRules() {
        // insertion order is priority
        Map<String, String> rules = new LinkedHashMap<>();
        rules.put("LOGOUT", "\\b(log\\s*out|sign\\s*out|log\\s*off|sign\\s*off)\\b");
        rules.put("DELETE", "\\b(delete|remove|erase|discard|wipe|clear\\s+(all|data|history|cache))\\b");
        rules.put("PURCHASE", "\\b(buy|purchase|checkout|check\\s*out|pay|place\\s+order|order\\s+now|subscribe|upgrade|add\\s+to\\s+cart)\\b");
        rules.put("ACCOUNT", "\\b(deactivate|close\\s+account|unsubscribe|cancel\\s+subscription)\\b");
        rules.put("DEVICE", "\\b(uninstall|factory\\s+reset|reset|restart|reboot|shut\\s*down|power\\s+off)\\b");
        rules.put("SEND", "\\b(send|post|publish|call|dial)\\b");
        return Collections.unmodifiableMap(rules);
    }

    public static DangerousPatternRules defaults() {
        return fromReasonToRegex(DEFAULTS);
    }

    public static DangerousPatternRules fromReasonToRegex(Map<String, String> reasonToRegex) {
        return new DangerousPatternRules(reasonToRegex.entrySet().stream()
                .map(e -> new Rule(e.getKey(), Pattern.compile(e.getValue(), Pattern.CASE_INSENSITIVE)))
                .toList());
    }

    public Optional<Rule> firstMatch(String haystack) {
        if (haystack == null || haystack.isBlank()) return Optional.empty();
        for (Rule rule : rules) {
            if (rule.pattern().matcher(haystack).find()) return Optional.of(rule);
        }
        return Optional.empty();
    }
}
