package com.flagship.recon_ledger.routing;

import com.flagship.recon_ledger.routing.dto.ThresholdRequest;
import com.flagship.recon_ledger.routing.dto.ThresholdResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/reconciliation/thresholds")
@RequiredArgsConstructor
public class ThresholdController {

    private final ThresholdPolicyService policyService;

    @GetMapping("/{accountId}")
    public ResponseEntity<ThresholdResponse> get(@PathVariable UUID accountId) {
        return ResponseEntity.ok(ThresholdResponse.of(accountId,
            policyService.thresholdsFor(accountId), policyService.hasOverride(accountId)));
    }

    @PutMapping("/{accountId}")
    public ResponseEntity<ThresholdResponse> put(@PathVariable UUID accountId,
                                                 @Valid @RequestBody ThresholdRequest request) {
        Thresholds saved = policyService.setOverride(accountId, request.getAutoAccept(), request.getReviewFloor());
        return ResponseEntity.ok(ThresholdResponse.of(accountId, saved, true));
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<Void> delete(@PathVariable UUID accountId) {
        policyService.clearOverride(accountId);
        return ResponseEntity.noContent().build();
    }
}
