package com.flagship.recon_ledger.scoring;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class ScoringConfiguration {

    @Bean
    public ScoringEngine scoringEngine(ReconciliationProperties properties) {
        ScoringConfig config = ScoringConfig.from(properties);
        log.info("Scoring weights: amount={}, date={}, description={}, businessFit={}, history={}",
            config.getAmountWeight(), config.getDateWeight(), config.getDescriptionWeight(),
            config.getBusinessFitWeight(), config.getHistoryWeight());
        return new ScoringEngine(config, PlausibilityTable.standard());
    }
}
