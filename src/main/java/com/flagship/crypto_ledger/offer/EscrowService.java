package com.flagship.crypto_ledger.offer;

import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.event.OfferCancelledEvent;
import com.flagship.crypto_ledger.event.OfferCreatedEvent;
import com.flagship.crypto_ledger.event.OfferSettledEvent;
import com.flagship.crypto_ledger.exception.InvariantViolationException;
import com.flagship.crypto_ledger.exception.LedgerException;
import com.flagship.crypto_ledger.exception.ResourceNotFoundException;
import com.flagship.crypto_ledger.ledger.Amounts;
import com.flagship.crypto_ledger.ledger.LedgerLeg;
import com.flagship.crypto_ledger.ledger.LedgerService;
import com.flagship.crypto_ledger.ledger.TransferRequest;
import com.flagship.crypto_ledger.observability.CorrelationContext;
import com.flagship.crypto_ledger.observability.TradingMetrics;
import com.flagship.crypto_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Peer-to-peer offers backed by escrowed funds.
 *
 * create: lock the offered amount, insert the offer as ACTIVE
 * accept: swap both legs, release the creator's escrow, mark COMPLETED, append a settlement
 * cancel: return the escrow to spendable balance, mark CANCELLED
 *
 * Each operation is one database transaction. Accept and cancel lock the offer
 * row first and the wallets second, in the global wallet order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowService {

    private static final int MAX_LISTING = 200;

    private final TradeOfferRepository offerRepository;
    private final P2PSettlementRepository settlementRepository;
    private final LedgerService ledgerService;
    private final AccountRegistry accountRegistry;
    private final OutboxService outboxService;
    private final TradingSettings settings;
    private final TradingMetrics metrics;
    private final Clock clock;

    /**
     * @throws com.flagship.crypto_ledger.exception.InvalidOperationException for equal currencies or invalid amounts
     * @throws com.flagship.crypto_ledger.exception.InsufficientFundsException if the creator cannot cover the escrow
     */
    @Transactional
    public TradeOffer createOffer(UUID creatorId,
                                  String offeringCurrency, BigDecimal offeringAmount,
                                  String requestingCurrency, BigDecimal requestingAmount) {
        CorrelationContext.putAccount(creatorId);
        return instrumented("create", () -> {
            TradeOffer offer = TradeOffer.create(
                UUID.randomUUID(), creatorId,
                settings.requireSupported(offeringCurrency),
                Amounts.requirePositive(offeringAmount, "Offering amount"),
                settings.requireSupported(requestingCurrency),
                Amounts.requirePositive(requestingAmount, "Requesting amount"),
                clock.instant());
            CorrelationContext.putOffer(offer.getId());

            ledgerService.post(TransferRequest.of("Escrow lock for offer " + offer.getId(),
                LedgerLeg.lock(creatorId, offer.getOfferingCurrency(), offer.getOfferingAmount())));

            offerRepository.save(TradeOfferEntity.fromDomain(offer));
            outboxService.saveEvent(OfferCreatedEvent.of(offer));

            log.info("Offer created: offerId={}, offering={} {}, requesting={} {}",
                offer.getId(), offer.getOfferingAmount().toPlainString(), offer.getOfferingCurrency(),
                offer.getRequestingAmount().toPlainString(), offer.getRequestingCurrency());
            return offer;
        });
    }

    /**
     * Settles an offer with the acceptor as counterparty.
     *
     * Checks run in this order: self-acceptance (InvalidOperation), status
     * (OfferNotActive), acceptor funds (InsufficientFunds). Any failure leaves
     * balances and the offer untouched.
     */
    @Transactional
    public P2PSettlement acceptOffer(UUID acceptorId, UUID offerId) {
        CorrelationContext.putAccount(acceptorId);
        CorrelationContext.putOffer(offerId);
        return instrumented("accept", () -> {
            TradeOfferEntity entity = offerRepository.findByIdForUpdate(offerId)
                .orElseThrow(() -> ResourceNotFoundException.offer(offerId));

            TradeOffer completed = entity.toDomain().complete(acceptorId, clock.instant());
            UUID creatorId = completed.getCreatorId();

            TransferRequest settlement = TransferRequest.of("Settlement of offer " + offerId,
                LedgerLeg.debit(acceptorId, completed.getRequestingCurrency(), completed.getRequestingAmount()),
                LedgerLeg.credit(acceptorId, completed.getOfferingCurrency(), completed.getOfferingAmount()),
                LedgerLeg.settleLocked(creatorId, completed.getOfferingCurrency(), completed.getOfferingAmount()),
                LedgerLeg.credit(creatorId, completed.getRequestingCurrency(), completed.getRequestingAmount()));
            if (!settlement.isConserving()) {
                log.error("Offer settlement would change currency totals: offerId={}, net={}",
                    offerId, settlement.netChangeByCurrency());
                throw new InvariantViolationException("Settlement of offer " + offerId + " is not conserving");
            }
            ledgerService.post(settlement);

            entity.updateFromDomain(completed);
            offerRepository.save(entity);

            P2PSettlement record = P2PSettlement.of(completed);
            settlementRepository.save(P2PSettlementEntity.fromDomain(record));
            outboxService.saveEvent(OfferSettledEvent.of(record));

            log.info("Offer settled: offerId={}, creatorId={}, acceptorId={}, {} {} <-> {} {}",
                offerId, creatorId, acceptorId,
                completed.getOfferingAmount().toPlainString(), completed.getOfferingCurrency(),
                completed.getRequestingAmount().toPlainString(), completed.getRequestingCurrency());
            return record;
        });
    }

    /**
     * Withdraws an active offer and returns the escrow to the creator.
     */
    @Transactional
    public TradeOffer cancelOffer(UUID requesterId, UUID offerId) {
        CorrelationContext.putAccount(requesterId);
        CorrelationContext.putOffer(offerId);
        return instrumented("cancel", () -> {
            TradeOfferEntity entity = offerRepository.findByIdForUpdate(offerId)
                .orElseThrow(() -> ResourceNotFoundException.offer(offerId));

            TradeOffer cancelled = entity.toDomain().cancel(requesterId, clock.instant());

            ledgerService.post(TransferRequest.of("Escrow release for offer " + offerId,
                LedgerLeg.unlock(cancelled.getCreatorId(), cancelled.getOfferingCurrency(),
                    cancelled.getOfferingAmount())));

            entity.updateFromDomain(cancelled);
            offerRepository.save(entity);
            outboxService.saveEvent(OfferCancelledEvent.of(cancelled));

            log.info("Offer cancelled: offerId={}, released={} {}", offerId,
                cancelled.getOfferingAmount().toPlainString(), cancelled.getOfferingCurrency());
            return cancelled;
        });
    }

    /**
     * Active offers, newest first, optionally hiding one account's own offers.
     */
    @Transactional(readOnly = true)
    public List<OfferListing> listActiveOffers(UUID excludeAccountId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LISTING)));
        List<TradeOffer> offers = (excludeAccountId == null
            ? offerRepository.findByStatusOrderByCreatedAtDesc(OfferStatus.ACTIVE, page)
            : offerRepository.findByStatusAndCreatorIdNotOrderByCreatedAtDesc(OfferStatus.ACTIVE, excludeAccountId, page))
            .stream()
            .map(TradeOfferEntity::toDomain)
            .toList();

        Set<UUID> creators = offers.stream().map(TradeOffer::getCreatorId).collect(Collectors.toSet());
        Map<UUID, String> names = accountRegistry.displayNames(creators);
        return offers.stream()
            .map(offer -> new OfferListing(offer, names.getOrDefault(offer.getCreatorId(), "unknown")))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<TradeOffer> listAccountOffers(UUID accountId) {
        accountRegistry.requireExists(accountId);
        return offerRepository.findByCreatorIdAndStatusOrderByCreatedAtDesc(accountId, OfferStatus.ACTIVE)
            .stream()
            .map(TradeOfferEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public TradeOffer getOffer(UUID offerId) {
        return offerRepository.findById(offerId)
            .map(TradeOfferEntity::toDomain)
            .orElseThrow(() -> ResourceNotFoundException.offer(offerId));
    }

    @Transactional(readOnly = true)
    public long countActiveOffers() {
        return offerRepository.countByStatus(OfferStatus.ACTIVE);
    }

    private <T> T instrumented(String action, Supplier<T> operation) {
        try {
            T result = metrics.time("offer." + action, operation);
            metrics.recordOffer(action, "success");
            return result;
        } catch (LedgerException e) {
            metrics.recordOffer(action, e.getErrorCode());
            log.info("Offer {} rejected: {}", action, e.getMessage());
            throw e;
        }
    }
}
