package com.flagship.recon_ledger.consistency;

import com.flagship.recon_ledger.consistency.dto.CheckRunResponse;
import com.flagship.recon_ledger.consistency.dto.ConsistencyCheckResponse;
import com.flagship.recon_ledger.consistency.dto.ResolveCheckRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/consistency-checks")
@RequiredArgsConstructor
public class ConsistencyCheckController {

    private final ConsistencyChecker checker;

    @GetMapping
    public ResponseEntity<Page<ConsistencyCheckResponse>> list(
            @RequestParam(required = false) CheckStatus status,
            @RequestParam(name = "check_type", required = false) CheckType checkType,
            @RequestParam(name = "min_severity", required = false) Severity minSeverity,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        Page<ConsistencyCheck> checks = checker.listChecks(status, checkType, minSeverity,
            PageRequest.of(page, Math.min(size, 500)));
        return ResponseEntity.ok(checks.map(ConsistencyCheckResponse::from));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ConsistencyCheckResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(ConsistencyCheckResponse.from(checker.getCheck(id)));
    }

    @PostMapping("/run")
    public ResponseEntity<CheckRunResponse> run() {
        return ResponseEntity.ok(CheckRunResponse.from(checker.runChecks()));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<ConsistencyCheckResponse> resolve(@PathVariable UUID id,
                                                            @Valid @RequestBody ResolveCheckRequest request) {
        return ResponseEntity.ok(ConsistencyCheckResponse.from(
            checker.resolveCheck(id, request.getAction(), request.getNote())));
    }
}
