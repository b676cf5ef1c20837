package com.flagship.recon_ledger.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class DescriptionSimilarityTest {

    @Test
    @DisplayName("Normalization lowercases, strips punctuation and collapses whitespace")
    void testNormalize() {
        assertEquals("acme corp inv 1042", DescriptionSimilarity.normalize("  ACME-Corp.   INV#1042 "));
        assertEquals("", DescriptionSimilarity.normalize(null));
    }

    @Test
    @DisplayName("Identical text after normalization scores 100")
    void testIdenticalScores100() {
        BigDecimal score = DescriptionSimilarity.similarity("ACME Corp", "acme, corp");
        assertEquals(0, new BigDecimal("100").compareTo(score));
    }

    @Test
    @DisplayName("Empty text on either side scores 0")
    void testEmptyScoresZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(DescriptionSimilarity.similarity("", "acme")));
        assertEquals(0, BigDecimal.ZERO.compareTo(DescriptionSimilarity.similarity("acme", "  ...")));
    }

    @Test
    @DisplayName("Similarity is symmetric and bounded")
    void testSymmetricAndBounded() {
        BigDecimal ab = DescriptionSimilarity.similarity("Stripe payout March", "stripe payout");
        BigDecimal ba = DescriptionSimilarity.similarity("stripe payout", "Stripe payout March");
        assertEquals(0, ab.compareTo(ba));
        assertTrue(ab.compareTo(BigDecimal.ZERO) > 0);
        assertTrue(ab.compareTo(new BigDecimal("100")) < 0);
    }

    @Test
    @DisplayName("Levenshtein and token Jaccard behave on known inputs")
    void testComponents() {
        assertEquals(3, DescriptionSimilarity.levenshtein("kitten", "sitting"));
        assertEquals(0, DescriptionSimilarity.levenshtein("same", "same"));
        assertEquals(0, new BigDecimal("0.4").compareTo(DescriptionSimilarity.tokenJaccard("a b c", "b c d e")));
    }

    @Test
    @DisplayName("Merchant key is the first normalized token")
    void testMerchantKey() {
        assertEquals("netflix", DescriptionSimilarity.merchantKey("NETFLIX.COM 866-579"));
        assertEquals("", DescriptionSimilarity.merchantKey("   "));
    }
}
