package de.bsommerfeld.triage.engine.similarity;

/**
 * Edit-distance similarity of two strings in [0, 1], based on the
 * insert/delete distance: {@code 1 - indel(a, b) / (|a| + |b|)}.
 * Equivalent to {@code 2 * lcs(a, b) / (|a| + |b|)}.
 */
public final class FuzzyRatio {

    private FuzzyRatio() {
    }

    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0)
            return 1.0;
        return 2.0 * longestCommonSubsequence(a, b) / total;
    }

    /**
     * Two-row dynamic program, O(|a|·|b|) time and O(min(|a|, |b|)) memory.
     */
    static int longestCommonSubsequence(String a, String b) {
        if (a.length() < b.length()) {
            String swap = a;
            a = b;
            b = swap;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
