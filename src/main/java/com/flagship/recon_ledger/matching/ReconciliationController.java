package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.matching.dto.RunResponse;
import com.flagship.recon_ledger.matching.dto.StartRunRequest;
import com.flagship.recon_ledger.statement.ReconciliationScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Starts, inspects and cancels reconciliation runs.
 *
 * Runs execute synchronously, so POST /runs answers with the finished run. With an
 * Idempotency-Key header a repeated request returns the earlier run unchanged.
 */
@RestController
@RequestMapping("/api/reconciliation/runs")
@RequiredArgsConstructor
@Slf4j
public class ReconciliationController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final ReconciliationRunService runService;

    @PostMapping
    public ResponseEntity<RunResponse> startRun(
            @RequestBody(required = false) StartRunRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        ReconciliationScope scope = request == null ? ReconciliationScope.all() : request.toScope();
        String key = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;

        log.info("Received reconciliation run request: scope={}, idempotencyKey={}", scope, key);
        ReconciliationRun run = runService.run(scope, key);
        return ResponseEntity.ok(RunResponse.from(run));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunResponse> getRun(@PathVariable UUID runId) {
        return ResponseEntity.ok(RunResponse.from(runService.getRun(runId)));
    }

    @PostMapping("/{runId}/cancel")
    public ResponseEntity<RunResponse> cancel(@PathVariable UUID runId) {
        return ResponseEntity.accepted().body(RunResponse.from(runService.cancel(runId)));
    }
}
