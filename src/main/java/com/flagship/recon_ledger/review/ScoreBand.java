package com.flagship.recon_ledger.review;

/**
 * Score histogram bands.
 */
enum ScoreBand {
    LOW(0, 59),
    MEDIUM(60, 79),
    HIGH(80, 89),
    VERY_HIGH(90, 100);

    private final int min;
    private final int max;

    ScoreBand(int min, int max) {
        this.min = min;
        this.max = max;
    }

    String label() {
        return min + "-" + max;
    }

    static ScoreBand of(int score) {
        for (ScoreBand band : values()) {
            if (score >= band.min && score <= band.max) {
                return band;
            }
        }
        throw new IllegalArgumentException("Score out of range: " + score);
    }
}
