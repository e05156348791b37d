package com.flagship.crypto_ledger.bonus;

import com.flagship.crypto_ledger.bonus.dto.BonusClaimResponse;
import com.flagship.crypto_ledger.bonus.dto.BonusStatusResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/accounts/{accountId}/bonus")
@RequiredArgsConstructor
public class BonusController {

    private final BonusService bonusService;

    /**
     * 201 with the claim, or 429 with Retry-After while the cooldown runs.
     */
    @PostMapping
    public ResponseEntity<BonusClaimResponse> claim(@PathVariable("accountId") UUID accountId) {
        BonusClaim claim = bonusService.claim(accountId);
        return ResponseEntity.status(HttpStatus.CREATED).body(BonusClaimResponse.from(claim));
    }

    @GetMapping
    public BonusStatusResponse status(@PathVariable("accountId") UUID accountId) {
        return BonusStatusResponse.from(bonusService.getStatus(accountId));
    }
}
