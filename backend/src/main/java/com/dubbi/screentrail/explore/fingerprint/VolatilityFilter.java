package com.dubbi.screentrail.explore.fingerprint;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 시계/날짜/카운터처럼 매 읽기마다 바뀌는 텍스트를 자리표시자로 치환한다.
 */
public class VolatilityFilter {
    static final String PLACEHOLDER = "{v}";

    public static final List<String> DEFAULT_PATTERNS = List.of(
            // 12:30, 09:15:02, 3:05 pm
            "\\b\\d{1,2}:\\d{2}(:\\d{2})?(\\s*[ap]\\.?m\\.?)?\\b",
            // 2024-01-31, 31/01/2024, 1.31.24
            "\\b\\d{1,4}[/.-]\\d{1,2}[/.-]\\d{1,4}\\b",
            // 5 min ago, 3 hours ago
            "\\b\\d+\\s*(s|sec|secs|seconds?|m|min|mins|minutes?|h|hr|hrs|hours?|d|days?|w|wks?|weeks?)\\s+ago\\b",
            // badge style counters: "12", "(3)", "4 unread"
            "^\\s*\\d+\\+?\\s*$",
            "\\(\\d+\\+?\\)",
            "\\b\\d+\\+?\\s*(new|unread|notifications?|messages?|items?|likes?|comments?)\\b",
            "\\b\\d{1,3}%",
            // order numbers, timestamps and other long digit runs
            "\\b\\d{5,}\\b"
    );

    private final List<Pattern> patterns;

    public VolatilityFilter(List<String> regexes) {
        List<String> source = (regexes == null || regexes.isEmpty()) ? DEFAULT_PATTERNS : regexes;
        this.patterns = source.stream()
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public static VolatilityFilter defaults() {
        return new VolatilityFilter(DEFAULT_PATTERNS);
    }

    public String apply(String text) {
        if (text == null) return "";
        String out = text.trim();
        for (Pattern pattern : patterns) {
            out = pattern.matcher(out).replaceAll(PLACEHOLDER);
        }
        return out;
    }
}
