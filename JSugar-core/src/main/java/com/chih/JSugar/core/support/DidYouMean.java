package com.chih.JSugar.core.support;

import java.util.Collection;
import java.util.Locale;

/**
 * 基于编辑距离（Levenshtein，大小写不敏感）的 "Did you mean" 建议
 */
public final class DidYouMean {

    public static final int DEFAULT_MAX_DISTANCE = 2;

    private DidYouMean() {
    }

    public static String suggest(String input, Collection<String> candidates) {
        return suggest(input, candidates, DEFAULT_MAX_DISTANCE);
    }

    /**
     * @return 距离最近的候选（距离相同时取先出现的）；
     * 输入与某个候选大小写不敏感相等，或没有候选在 maxDistance 以内时返回 null
     */
    public static String suggest(String input, Collection<String> candidates, int maxDistance) {
        if (input == null || candidates == null || candidates.isEmpty()) {
            return null;
        }

        String needle = input.toLowerCase(Locale.ROOT);
        String best = null;
        int bestDistance = Integer.MAX_VALUE;

        for (String candidate : candidates) {
            int distance = distance(needle, candidate.toLowerCase(Locale.ROOT));
            if (distance == 0) {
                return null;
            }
            if (distance <= maxDistance && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }

        return best;
    }

    /**
     * 大小写不敏感的编辑距离
     */
    public static int distance(String left, String right) {
        String a = left.toLowerCase(Locale.ROOT);
        String b = right.toLowerCase(Locale.ROOT);

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[b.length()];
    }
}
