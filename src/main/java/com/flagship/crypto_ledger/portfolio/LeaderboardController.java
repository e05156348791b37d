package com.flagship.crypto_ledger.portfolio;

import com.flagship.crypto_ledger.exception.InvalidOperationException;
import com.flagship.crypto_ledger.portfolio.dto.CoinHoldingResponse;
import com.flagship.crypto_ledger.portfolio.dto.LeaderboardEntryResponse;
import com.flagship.crypto_ledger.portfolio.dto.PortfolioResponse;
import com.flagship.crypto_ledger.portfolio.dto.RankResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LeaderboardController {

    private static final int MAX_LIMIT = 100;

    private final PortfolioService portfolioService;

    @GetMapping("/accounts/{accountId}/portfolio")
    public PortfolioResponse getPortfolio(@PathVariable("accountId") UUID accountId) {
        return PortfolioResponse.from(portfolioService.portfolioValue(accountId));
    }

    @GetMapping("/accounts/{accountId}/rank")
    public RankResponse getRank(@PathVariable("accountId") UUID accountId) {
        return RankResponse.from(portfolioService.rankOf(accountId));
    }

    @GetMapping("/leaderboard")
    public List<LeaderboardEntryResponse> getLeaderboard(
            @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return portfolioService.leaderboard(checkLimit(limit)).stream()
            .map(LeaderboardEntryResponse::from)
            .toList();
    }

    @GetMapping("/leaderboard/{currency}")
    public List<CoinHoldingResponse> getCoinLeaderboard(
            @PathVariable("currency") String currency,
            @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return portfolioService.coinLeaderboard(currency, checkLimit(limit)).stream()
            .map(CoinHoldingResponse::from)
            .toList();
    }

    private static int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidOperationException("limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }
        return limit;
    }
}
