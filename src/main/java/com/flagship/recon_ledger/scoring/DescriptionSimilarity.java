package com.flagship.recon_ledger.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Text similarity between statement descriptions and ledger memos.
 *
 * similarity = 100 * (0.6 * (1 - levenshtein / maxLen) + 0.4 * tokenJaccard), computed on
 * normalized text. Empty input on either side scores 0.
 */
public final class DescriptionSimilarity {

    private static final BigDecimal EDIT_WEIGHT = new BigDecimal("0.6");
    private static final BigDecimal TOKEN_WEIGHT = new BigDecimal("0.4");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private DescriptionSimilarity() {
    }

    /**
     * Lower case, non-alphanumerics to spaces, whitespace collapsed.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{Nd}]+", " ")
            .trim()
            .replaceAll("\\s+", " ");
    }

    /**
     * First normalized token, used to group a payee's transactions. Empty if there is none.
     */
    public static String merchantKey(String description) {
        String normalized = normalize(description);
        int space = normalized.indexOf(' ');
        return space < 0 ? normalized : normalized.substring(0, space);
    }

    public static BigDecimal similarity(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        if (a.isEmpty() || b.isEmpty()) {
            return BigDecimal.ZERO.setScale(4);
        }

        int maxLen = Math.max(a.length(), b.length());
        BigDecimal editRatio = BigDecimal.ONE.subtract(
            BigDecimal.valueOf(levenshtein(a, b)).divide(BigDecimal.valueOf(maxLen), 8, RoundingMode.HALF_UP));

        return HUNDRED.multiply(EDIT_WEIGHT.multiply(editRatio).add(TOKEN_WEIGHT.multiply(tokenJaccard(a, b))))
            .setScale(4, RoundingMode.HALF_UP);
    }

    static int levenshtein(String a, String b) {
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

    static BigDecimal tokenJaccard(String a, String b) {
        Set<String> left = new HashSet<>(Arrays.asList(a.split(" ")));
        Set<String> right = new HashSet<>(Arrays.asList(b.split(" ")));
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return BigDecimal.valueOf(left.size()).divide(BigDecimal.valueOf(union.size()), 8, RoundingMode.HALF_UP);
    }
}
