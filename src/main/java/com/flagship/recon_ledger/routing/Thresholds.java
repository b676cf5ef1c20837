package com.flagship.recon_ledger.routing;

import lombok.Value;

/**
 * Score cut-offs. Requires 0 <= reviewFloor <= autoAccept <= 100.
 */
@Value
public class Thresholds {
    int autoAccept;
    int reviewFloor;

    public Thresholds(int autoAccept, int reviewFloor) {
        if (reviewFloor < 0 || reviewFloor > autoAccept || autoAccept > 100) {
            throw new IllegalArgumentException(String.format(
                "Thresholds must satisfy 0 <= review_floor <= auto_accept <= 100, got review_floor=%d, auto_accept=%d",
                reviewFloor, autoAccept));
        }
        this.autoAccept = autoAccept;
        this.reviewFloor = reviewFloor;
    }
}
