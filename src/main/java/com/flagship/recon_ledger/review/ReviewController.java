package com.flagship.recon_ledger.review;

import com.flagship.recon_ledger.matching.ReconciliationMatch;
import com.flagship.recon_ledger.matching.dto.MatchResponse;
import com.flagship.recon_ledger.review.dto.AcceptMatchRequest;
import com.flagship.recon_ledger.review.dto.BatchDecisionRequest;
import com.flagship.recon_ledger.review.dto.BatchItemResponse;
import com.flagship.recon_ledger.review.dto.CreateEntryRequest;
import com.flagship.recon_ledger.review.dto.ManualMatchRequest;
import com.flagship.recon_ledger.review.dto.RejectMatchRequest;
import com.flagship.recon_ledger.review.dto.ReviewStatsResponse;
import com.flagship.recon_ledger.statement.ReconciliationScope;
import com.flagship.recon_ledger.statement.dto.BankTransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/reconciliation")
@RequiredArgsConstructor
public class ReviewController {

    private static final int MAX_PAGE_SIZE = 500;

    private final ReviewService reviewService;

    @GetMapping("/matches/pending")
    public ResponseEntity<Page<MatchResponse>> listPending(
            @RequestParam(name = "account_id", required = false) UUID accountId,
            @RequestParam(name = "min_score", required = false) Integer minScore,
            @RequestParam(name = "max_score", required = false) Integer maxScore,
            @RequestParam(name = "created_before", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdBefore,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        Page<ReconciliationMatch> matches = reviewService.listPending(accountId, minScore, maxScore, createdBefore,
            PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE)));
        return ResponseEntity.ok(matches.map(MatchResponse::from));
    }

    @PostMapping("/matches/{matchId}/accept")
    public ResponseEntity<MatchResponse> accept(@PathVariable UUID matchId,
                                                @Valid @RequestBody AcceptMatchRequest request) {
        return ResponseEntity.ok(MatchResponse.from(
            reviewService.accept(matchId, request.getVersion(), request.getNote())));
    }

    @PostMapping("/matches/{matchId}/reject")
    public ResponseEntity<MatchResponse> reject(@PathVariable UUID matchId,
                                                @Valid @RequestBody RejectMatchRequest request) {
        return ResponseEntity.ok(MatchResponse.from(
            reviewService.reject(matchId, request.getVersion(), request.getReason())));
    }

    @PostMapping("/matches/batch-accept")
    public ResponseEntity<List<BatchItemResponse>> batchAccept(@Valid @RequestBody BatchDecisionRequest request) {
        return ResponseEntity.ok(reviewService.batchAccept(request.toBatchItems(), request.getNote()).stream()
            .map(BatchItemResponse::from)
            .toList());
    }

    @PostMapping("/matches/batch-reject")
    public ResponseEntity<List<BatchItemResponse>> batchReject(@Valid @RequestBody BatchDecisionRequest request) {
        if (request.getReason() == null || request.getReason().isBlank()) {
            throw new IllegalArgumentException("Rejection reason is required");
        }
        return ResponseEntity.ok(reviewService.batchReject(request.toBatchItems(), request.getReason()).stream()
            .map(BatchItemResponse::from)
            .toList());
    }

    @PostMapping("/manual-matches")
    public ResponseEntity<MatchResponse> manualMatch(@Valid @RequestBody ManualMatchRequest request) {
        ReconciliationMatch match = reviewService.manualMatch(request.getTransactionId(), request.getEntryIds(),
            request.getNote());
        return ResponseEntity.status(HttpStatus.CREATED).body(MatchResponse.from(match));
    }

    @PostMapping("/transactions/{transactionId}/create-entry")
    public ResponseEntity<MatchResponse> createEntry(@PathVariable UUID transactionId,
                                                     @Valid @RequestBody CreateEntryRequest request) {
        ReconciliationMatch match = reviewService.createEntryFromTransaction(transactionId,
            request.getCounterAccountId(), request.getMemo());
        return ResponseEntity.status(HttpStatus.CREATED).body(MatchResponse.from(match));
    }

    @GetMapping("/transactions/unmatched")
    public ResponseEntity<List<BankTransactionResponse>> listUnmatched(
            @RequestParam(name = "account_id", required = false) UUID accountId,
            @RequestParam(name = "batch_id", required = false) UUID batchId,
            @RequestParam(name = "date_from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "date_to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {
        ReconciliationScope scope = new ReconciliationScope(accountId, batchId, dateFrom, dateTo);
        return ResponseEntity.ok(reviewService.listUnmatched(scope).stream()
            .map(BankTransactionResponse::from)
            .toList());
    }

    @GetMapping("/stats")
    public ResponseEntity<ReviewStatsResponse> stats(
            @RequestParam(name = "account_id", required = false) UUID accountId,
            @RequestParam(name = "batch_id", required = false) UUID batchId,
            @RequestParam(name = "date_from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "date_to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {
        ReconciliationScope scope = new ReconciliationScope(accountId, batchId, dateFrom, dateTo);
        return ResponseEntity.ok(ReviewStatsResponse.from(reviewService.stats(scope)));
    }
}
