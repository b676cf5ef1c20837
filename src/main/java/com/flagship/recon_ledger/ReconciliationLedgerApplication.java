package com.flagship.recon_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ReconciliationLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconciliationLedgerApplication.class, args);
    }
}
