package com.flagship.recon_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class LedgerReportController {

    private final LedgerReportingService reportingService;

    @GetMapping("/accounting-equation")
    public AccountingEquation accountingEquation() {
        return reportingService.getAccountingEquation();
    }
}
