package com.flagship.recon_ledger.statement;

import com.flagship.recon_ledger.matching.StatementAutoRunner;
import com.flagship.recon_ledger.matching.dto.RunResponse;
import com.flagship.recon_ledger.statement.dto.BankTransactionResponse;
import com.flagship.recon_ledger.statement.dto.StatementIngestionResponse;
import com.flagship.recon_ledger.statement.dto.StatementSubmissionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/statements")
@RequiredArgsConstructor
@Slf4j
public class StatementController {

    private final StatementIngestionService ingestionService;
    private final StatementAutoRunner autoRunner;

    @PostMapping
    public ResponseEntity<StatementIngestionResponse> submit(@Valid @RequestBody StatementSubmissionRequest request) {
        log.info("Received statement: account={}, transactions={}, reference={}",
            request.getSourceAccountId(), request.getTransactions().size(), request.getDocumentReference());

        IngestionResult result = ingestionService.ingest(request.toExtraction());
        RunResponse run = autoRunner.afterIngest(result).map(RunResponse::from).orElse(null);
        return ResponseEntity.status(HttpStatus.CREATED).body(StatementIngestionResponse.from(result, run));
    }

    @GetMapping("/transactions/{transactionId}")
    public ResponseEntity<BankTransactionResponse> getTransaction(@PathVariable UUID transactionId) {
        return ResponseEntity.ok(BankTransactionResponse.from(ingestionService.getTransaction(transactionId)));
    }
}
