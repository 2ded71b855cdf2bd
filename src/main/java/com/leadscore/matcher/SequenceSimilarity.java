package com.leadscore.matcher;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp similarity of two character sequences.
 * <p>
 * The longest common block is located first (leftmost in {@code a}, then leftmost in {@code b}),
 * and the regions on either side of it are matched recursively. The ratio is {@code 2 * M / T},
 * where {@code M} is the total number of matched characters and {@code T} the combined length.
 * </p>
 */
public final class SequenceSimilarity {

    private SequenceSimilarity() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    static int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> regions = new ArrayDeque<>();
        regions.push(new int[]{0, a.length(), 0, b.length()});

        while (!regions.isEmpty()) {
            int[] region = regions.pop();
            int aLo = region[0], aHi = region[1], bLo = region[2], bHi = region[3];
            int[] block = longestBlock(a, b, aLo, aHi, bLo, bHi);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            int i = block[0], j = block[1];
            if (aLo < i && bLo < j) {
                regions.push(new int[]{aLo, i, bLo, j});
            }
            if (i + size < aHi && j + size < bHi) {
                regions.push(new int[]{i + size, aHi, j + size, bHi});
            }
        }
        return matched;
    }

    private static int[] longestBlock(String a, String b, int aLo, int aHi, int bLo, int bHi) {
        int bestI = aLo, bestJ = bLo, bestSize = 0;
        int[] previous = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[bHi - bLo + 1];
            char c = a.charAt(i);
            for (int j = bLo; j < bHi; j++) {
                if (b.charAt(j) != c) {
                    continue;
                }
                int k = previous[j - bLo] + 1;
                current[j - bLo + 1] = k;
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            previous = current;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
