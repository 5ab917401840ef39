package com.dubbi.screentrail.common.util;

/**
 * 편집 거리 기반 문자열 유사도 (1 - distance / maxLength)
 */
public final class TextSimilarity {
    private TextSimilarity() {}

    public static double similarity(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) return 1.0;
        return 1.0 - (double) levenshtein(left, right) / maxLength;
    }

    public static int levenshtein(String a, String b) {
        int[][] dp = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) dp[i][0] = i;
        for (int j = 0; j <= b.length(); j++) dp[0][j] = j;

        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                dp[i][j] = Math.min(
                        Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1),
                        dp[i - 1][j - 1] + cost
                );
            }
        }
        return dp[a.length()][b.length()];
    }
}
