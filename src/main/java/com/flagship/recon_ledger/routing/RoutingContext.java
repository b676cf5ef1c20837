package com.flagship.recon_ledger.routing;

import com.flagship.recon_ledger.scoring.MatchScore;
import com.flagship.recon_ledger.statement.BankTransaction;
import lombok.Value;

@Value
public class RoutingContext {
    boolean lowTrust;
    boolean containsDraft;
    boolean multiEntry;

    public static RoutingContext of(BankTransaction transaction, MatchScore score) {
        return new RoutingContext(transaction.isLowTrust(), score.containsDraft(), score.isMultiEntry());
    }
}
