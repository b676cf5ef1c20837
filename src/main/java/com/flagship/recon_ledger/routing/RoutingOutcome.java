package com.flagship.recon_ledger.routing;

public enum RoutingOutcome {
    AUTO_ACCEPT,
    REVIEW,
    UNMATCHED
}
