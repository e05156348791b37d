package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.SortedSet;

/**
 * A multi-leg ledger operation. All legs commit together or none do.
 *
 * Market orders are not conserving (the simulated market is the counterparty);
 * peer settlements must be: every currency's owned total is unchanged.
 */
@Value
public class TransferRequest {
    String description;
    List<LedgerLeg> legs;

    public static TransferRequest of(String description, LedgerLeg... legs) {
        return new TransferRequest(description, List.of(legs));
    }

    /**
     * Wallets touched by this request in lock order.
     */
    public SortedSet<WalletKey> walletKeys() {
        SortedSet<WalletKey> keys = new TreeSet<>();
        for (LedgerLeg leg : legs) {
            keys.add(leg.walletKey());
        }
        return keys;
    }

    /**
     * Net change of balance + locked_balance per currency, summed over all accounts.
     */
    public Map<String, BigDecimal> netChangeByCurrency() {
        Map<String, BigDecimal> net = new TreeMap<>();
        for (LedgerLeg leg : legs) {
            net.merge(leg.getCurrency(), leg.ownedChange(), BigDecimal::add);
        }
        return net;
    }

    /**
     * True if the request only moves value between accounts and never creates or destroys it.
     */
    public boolean isConserving() {
        return netChangeByCurrency().values().stream().allMatch(change -> change.signum() == 0);
    }
}
