package com.flagship.crypto_ledger.offer;

import com.flagship.crypto_ledger.offer.dto.CreateOfferRequest;
import com.flagship.crypto_ledger.offer.dto.OfferResponse;
import com.flagship.crypto_ledger.offer.dto.SettlementResponse;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Peer offers. Mutations are scoped under the acting account; the board and
 * single-offer lookups are public.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class OfferController {

    private final EscrowService escrowService;

    @PostMapping("/accounts/{accountId}/offers")
    public ResponseEntity<OfferResponse> createOffer(
            @PathVariable("accountId") UUID accountId,
            @Valid @RequestBody CreateOfferRequest request) {

        TradeOffer offer = escrowService.createOffer(accountId,
            request.getOfferingCurrency(), request.getOfferingAmount(),
            request.getRequestingCurrency(), request.getRequestingAmount());

        return ResponseEntity.status(HttpStatus.CREATED).body(OfferResponse.from(offer));
    }

    @GetMapping("/accounts/{accountId}/offers")
    public List<OfferResponse> getAccountOffers(@PathVariable("accountId") UUID accountId) {
        return escrowService.listAccountOffers(accountId).stream()
            .map(OfferResponse::from)
            .toList();
    }

    @PostMapping("/accounts/{accountId}/offers/{offerId}/accept")
    public SettlementResponse acceptOffer(
            @PathVariable("accountId") UUID accountId,
            @PathVariable("offerId") UUID offerId) {
        return SettlementResponse.from(escrowService.acceptOffer(accountId, offerId));
    }

    @PostMapping("/accounts/{accountId}/offers/{offerId}/cancel")
    public OfferResponse cancelOffer(
            @PathVariable("accountId") UUID accountId,
            @PathVariable("offerId") UUID offerId) {
        return OfferResponse.from(escrowService.cancelOffer(accountId, offerId));
    }

    /**
     * Active offers, newest first. exclude_account hides the caller's own offers.
     */
    @GetMapping("/offers")
    public List<OfferResponse> getActiveOffers(
            @RequestParam(value = "exclude_account", required = false) UUID excludeAccount,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return escrowService.listActiveOffers(excludeAccount, limit).stream()
            .map(OfferResponse::from)
            .toList();
    }

    @GetMapping("/offers/{offerId}")
    public OfferResponse getOffer(@PathVariable("offerId") UUID offerId) {
        return OfferResponse.from(escrowService.getOffer(offerId));
    }
}
