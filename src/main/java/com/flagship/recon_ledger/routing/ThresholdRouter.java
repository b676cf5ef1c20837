package com.flagship.recon_ledger.routing;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import org.springframework.stereotype.Component;

/**
 * Classifies a composite score against thresholds.
 *
 * score >= autoAccept is AUTO_ACCEPT, score >= reviewFloor is REVIEW, anything lower is
 * UNMATCHED. An auto-accept is downgraded to REVIEW when the statement is low-trust, the
 * set contains a draft entry, or (when configured) the set has more than one entry.
 */
@Component
public class ThresholdRouter {

    private final boolean requireReviewForMultiEntry;

    public ThresholdRouter(ReconciliationProperties properties) {
        this(properties.isRequireReviewForMultiEntry());
    }

    ThresholdRouter(boolean requireReviewForMultiEntry) {
        this.requireReviewForMultiEntry = requireReviewForMultiEntry;
    }

    public RoutingDecision route(int score, Thresholds thresholds, RoutingContext context) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score out of range: " + score);
        }
        if (score < thresholds.getReviewFloor()) {
            return new RoutingDecision(RoutingOutcome.UNMATCHED, null);
        }
        if (score < thresholds.getAutoAccept()) {
            return new RoutingDecision(RoutingOutcome.REVIEW, null);
        }

        TrustCap cap = capFor(context);
        if (cap != null) {
            return new RoutingDecision(RoutingOutcome.REVIEW, cap);
        }
        return new RoutingDecision(RoutingOutcome.AUTO_ACCEPT, null);
    }

    private TrustCap capFor(RoutingContext context) {
        if (context.isLowTrust()) {
            return TrustCap.LOW_TRUST_STATEMENT;
        }
        if (context.isContainsDraft()) {
            return TrustCap.DRAFT_ENTRY;
        }
        if (requireReviewForMultiEntry && context.isMultiEntry()) {
            return TrustCap.MULTI_ENTRY;
        }
        return null;
    }
}
