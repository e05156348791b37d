package com.flagship.crypto_ledger.account;

import com.flagship.crypto_ledger.account.dto.AccountResponse;
import com.flagship.crypto_ledger.account.dto.WalletResponse;
import com.flagship.crypto_ledger.ledger.LedgerService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Account entry point. The caller's identity comes from the X-External-Id and
 * X-Display-Name headers set by the authenticating proxy in front of the service.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountRegistry accountRegistry;
    private final LedgerService ledgerService;

    /**
     * 201 when this call created the account, 200 when it already existed.
     */
    @PostMapping
    public ResponseEntity<AccountResponse> createOrGetAccount(HttpServletRequest request) {
        AccountResolution resolution = accountRegistry.resolveOrCreate(new HeaderIdentityProvider(request));
        Account account = resolution.getAccount();
        AccountResponse body = AccountResponse.from(account, ledgerService.getWallets(account.getId()));

        return ResponseEntity.status(resolution.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @GetMapping("/{accountId}")
    public AccountResponse getAccount(@PathVariable("accountId") UUID accountId) {
        Account account = accountRegistry.getAccount(accountId);
        return AccountResponse.from(account, ledgerService.getWallets(accountId));
    }

    @GetMapping("/{accountId}/wallets")
    public List<WalletResponse> getWallets(@PathVariable("accountId") UUID accountId) {
        return ledgerService.getWallets(accountId).stream().map(WalletResponse::from).toList();
    }
}
