package com.flagship.recon_ledger.consistency;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered by declaration: LOW < MEDIUM < HIGH < CRITICAL.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * This and every more severe level.
     */
    public List<Severity> andAbove() {
        return Arrays.stream(values()).filter(s -> s.isAtLeast(this)).toList();
    }
}
