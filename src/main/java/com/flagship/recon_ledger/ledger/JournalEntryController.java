package com.flagship.recon_ledger.ledger;

import com.flagship.recon_ledger.ledger.dto.CreateJournalEntryRequest;
import com.flagship.recon_ledger.ledger.dto.JournalEntryResponse;
import com.flagship.recon_ledger.ledger.dto.JournalLineRequest;
import com.flagship.recon_ledger.ledger.dto.UpdateLinesRequest;
import com.flagship.recon_ledger.ledger.dto.ValidationResponse;
import com.flagship.recon_ledger.ledger.dto.VersionRequest;
import com.flagship.recon_ledger.ledger.dto.VoidEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Journal entry lifecycle endpoints. Mutations that depend on what the caller last saw
 * (line edits, posting) carry the entry version in the body.
 */
@RestController
@RequestMapping("/api/journal-entries")
@RequiredArgsConstructor
public class JournalEntryController {

    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<JournalEntryResponse> createDraft(@Valid @RequestBody CreateJournalEntryRequest request) {
        SourceType sourceType = request.getSourceType() == null ? SourceType.MANUAL : request.getSourceType();
        JournalEntry draft = ledgerService.createDraft(
            request.getEntryDate(), request.getMemo(), sourceType, toLines(request.getLines()));
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(draft));
    }

    @GetMapping("/{id}")
    public JournalEntryResponse getEntry(@PathVariable("id") UUID id) {
        return JournalEntryResponse.from(ledgerService.getEntry(id));
    }

    @PutMapping("/{id}/lines")
    public JournalEntryResponse updateLines(@PathVariable("id") UUID id,
                                            @Valid @RequestBody UpdateLinesRequest request) {
        return JournalEntryResponse.from(
            ledgerService.updateDraftLines(id, request.getVersion(), toLines(request.getLines())));
    }

    @PostMapping("/{id}/validate")
    public ValidationResponse validate(@PathVariable("id") UUID id) {
        return ValidationResponse.from(ledgerService.validate(id));
    }

    @PostMapping("/{id}/post")
    public JournalEntryResponse post(@PathVariable("id") UUID id, @Valid @RequestBody VersionRequest request) {
        return JournalEntryResponse.from(ledgerService.post(id, request.getVersion()));
    }

    @PostMapping("/{id}/void")
    public JournalEntryResponse voidEntry(@PathVariable("id") UUID id, @Valid @RequestBody VoidEntryRequest request) {
        return JournalEntryResponse.from(ledgerService.voidEntry(id, request.getReason()));
    }

    private List<JournalLine> toLines(List<JournalLineRequest> lines) {
        return lines.stream().map(JournalLineRequest::toDomain).toList();
    }
}
