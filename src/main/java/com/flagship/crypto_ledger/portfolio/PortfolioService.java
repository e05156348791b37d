package com.flagship.crypto_ledger.portfolio;

import com.flagship.crypto_ledger.account.Account;
import com.flagship.crypto_ledger.account.AccountRegistry;
import com.flagship.crypto_ledger.config.TradingSettings;
import com.flagship.crypto_ledger.exception.ResourceNotFoundException;
import com.flagship.crypto_ledger.ledger.Wallet;
import com.flagship.crypto_ledger.ledger.WalletStore;
import com.flagship.crypto_ledger.trading.PriceOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-side valuation and ranking. Never locks and never writes.
 *
 * Only spendable balance is valued; escrowed funds count again once an offer
 * is cancelled or they land with the acceptor. Rankings are a point-in-time
 * snapshot: wallets are read in one pass and may trail in-flight trades.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PortfolioService {

    private static final int VALUE_SCALE = TradingSettings.AMOUNT_SCALE;

    private final WalletStore walletStore;
    private final AccountRegistry accountRegistry;
    private final PriceOracle priceOracle;
    private final TradingSettings settings;

    @Transactional(readOnly = true)
    public PortfolioValue portfolioValue(UUID accountId) {
        return portfolioValue(accountId, priceOracle.referencePrices());
    }

    /**
     * @param prices unit price of each currency in the base currency; missing currencies are worth 0
     */
    @Transactional(readOnly = true)
    public PortfolioValue portfolioValue(UUID accountId, Map<String, BigDecimal> prices) {
        List<Wallet> wallets = walletStore.findWallets(accountId);
        if (wallets.isEmpty()) {
            throw ResourceNotFoundException.account(accountId);
        }
        return value(accountId, wallets, prices);
    }

    @Transactional(readOnly = true)
    public List<LeaderboardEntry> leaderboard(int limit) {
        return leaderboard(priceOracle.referencePrices(), limit);
    }

    /**
     * Top accounts by total value; ties go to the lower account id.
     */
    @Transactional(readOnly = true)
    public List<LeaderboardEntry> leaderboard(Map<String, BigDecimal> prices, int limit) {
        return rankAll(prices).stream().limit(Math.max(0, limit)).toList();
    }

    @Transactional(readOnly = true)
    public RankInfo rankOf(UUID accountId) {
        return rankOf(accountId, priceOracle.referencePrices());
    }

    @Transactional(readOnly = true)
    public RankInfo rankOf(UUID accountId, Map<String, BigDecimal> prices) {
        List<LeaderboardEntry> ranked = rankAll(prices);
        int total = ranked.size();
        return ranked.stream()
            .filter(entry -> entry.getAccountId().equals(accountId))
            .findFirst()
            .map(entry -> new RankInfo(accountId, entry.getRank(), total,
                percentile(entry.getRank(), total), entry.getTotalValue()))
            .orElseThrow(() -> ResourceNotFoundException.account(accountId));
    }

    /**
     * Accounts ranked by spendable balance of one currency.
     */
    @Transactional(readOnly = true)
    public List<CoinHolding> coinLeaderboard(String currency, int limit) {
        String symbol = settings.requireSupported(currency);
        Map<UUID, String> names = displayNames();

        List<Wallet> wallets = new ArrayList<>(walletStore.findByCurrency(symbol));
        wallets.sort(Comparator.comparing(Wallet::getBalance).reversed()
            .thenComparing(wallet -> wallet.getAccountId().toString()));

        List<CoinHolding> holdings = new ArrayList<>();
        for (int i = 0; i < wallets.size() && i < limit; i++) {
            Wallet wallet = wallets.get(i);
            holdings.add(new CoinHolding(i + 1, wallet.getAccountId(),
                names.getOrDefault(wallet.getAccountId(), "unknown"), symbol, wallet.getBalance()));
        }
        return holdings;
    }

    private List<LeaderboardEntry> rankAll(Map<String, BigDecimal> prices) {
        Map<UUID, String> names = displayNames();
        Map<UUID, List<Wallet>> byAccount = walletStore.findAll().stream()
            .collect(Collectors.groupingBy(Wallet::getAccountId, LinkedHashMap::new, Collectors.toList()));

        List<PortfolioValue> values = new ArrayList<>();
        for (UUID accountId : names.keySet()) {
            values.add(value(accountId, byAccount.getOrDefault(accountId, List.of()), prices));
        }
        return rank(values, names);
    }

    static List<LeaderboardEntry> rank(List<PortfolioValue> values, Map<UUID, String> names) {
        List<PortfolioValue> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.comparing(PortfolioValue::getTotalValue).reversed()
            .thenComparing(value -> value.getAccountId().toString()));

        List<LeaderboardEntry> entries = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            PortfolioValue value = sorted.get(i);
            entries.add(new LeaderboardEntry(i + 1, value.getAccountId(),
                names.getOrDefault(value.getAccountId(), "unknown"), value.getTotalValue()));
        }
        return entries;
    }

    static BigDecimal percentile(int rank, int total) {
        if (total == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf((long) total - rank)
            .multiply(BigDecimal.valueOf(100))
            .divide(BigDecimal.valueOf(total), 4, RoundingMode.HALF_EVEN);
    }

    private PortfolioValue value(UUID accountId, List<Wallet> wallets, Map<String, BigDecimal> prices) {
        BigDecimal total = BigDecimal.ZERO;
        List<HoldingValue> holdings = new ArrayList<>();

        for (Wallet wallet : wallets) {
            BigDecimal price = settings.isBaseCurrency(wallet.getCurrency())
                ? BigDecimal.ONE
                : prices.get(wallet.getCurrency());
            BigDecimal value = price == null
                ? BigDecimal.ZERO
                : wallet.getBalance().multiply(price).setScale(VALUE_SCALE, RoundingMode.HALF_EVEN);
            total = total.add(value);

            if (wallet.getBalance().signum() != 0 || wallet.getLockedBalance().signum() != 0) {
                holdings.add(new HoldingValue(wallet.getCurrency(), wallet.getBalance(),
                    wallet.getLockedBalance(), price, value));
            }
        }
        return new PortfolioValue(accountId, settings.getBaseCurrency(),
            total.setScale(VALUE_SCALE, RoundingMode.HALF_EVEN), holdings);
    }

    private Map<UUID, String> displayNames() {
        return accountRegistry.findAll().stream()
            .collect(Collectors.toMap(Account::getId, Account::getDisplayName, (a, b) -> a, LinkedHashMap::new));
    }
}
