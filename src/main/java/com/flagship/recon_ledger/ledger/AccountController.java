package com.flagship.recon_ledger.ledger;

import com.flagship.recon_ledger.ledger.dto.AccountBalanceResponse;
import com.flagship.recon_ledger.ledger.dto.AccountResponse;
import com.flagship.recon_ledger.ledger.dto.CreateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final LedgerReportingService reportingService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(
            request.getCode(), request.getName(), request.getType(), request.getCurrency());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts() {
        return accountService.listAccounts().stream()
            .map(AccountResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.getAccount(id));
    }

    @PostMapping("/{id}/deactivate")
    public AccountResponse deactivate(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.deactivate(id));
    }

    @GetMapping("/{id}/balance")
    public AccountBalanceResponse getBalance(@PathVariable("id") UUID id) {
        Account account = accountService.getAccount(id);
        return new AccountBalanceResponse(id, reportingService.getAccountBalance(id), account.getCurrency());
    }
}
