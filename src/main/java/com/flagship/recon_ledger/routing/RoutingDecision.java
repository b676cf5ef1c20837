package com.flagship.recon_ledger.routing;

import lombok.Value;

/**
 * Where a score was routed, and which cap (if any) held it back from auto-accept.
 */
@Value
public class RoutingDecision {
    RoutingOutcome outcome;
    TrustCap cappedBy;

    public boolean isCapped() {
        return cappedBy != null;
    }
}
