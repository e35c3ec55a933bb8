package com.walletpnl.ledger.engine;

import com.walletpnl.domain.Position;
import com.walletpnl.domain.SwapEvent;
import com.walletpnl.domain.Trade;
import com.walletpnl.domain.TradeDirection;
import com.walletpnl.domain.TradeType;
import com.walletpnl.domain.WalletPerformance;
import com.walletpnl.ledger.query.PerformanceQueryService;
import com.walletpnl.ledger.query.WalletPerformanceSnapshot;
import com.walletpnl.ledger.store.InMemoryLedgerStore;
import com.walletpnl.pricing.FixedTokenPricer;
import com.walletpnl.pricing.TokenMeta;
import com.walletpnl.pricing.TokenPricer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.walletpnl.domain.TestSwaps.SOL;
import static com.walletpnl.domain.TestSwaps.TOKEN_A;
import static com.walletpnl.domain.TestSwaps.TOKEN_B;
import static com.walletpnl.domain.TestSwaps.USDC;
import static com.walletpnl.domain.TestSwaps.WALLET;
import static com.walletpnl.domain.TestSwaps.buy;
import static com.walletpnl.domain.TestSwaps.leg;
import static com.walletpnl.domain.TestSwaps.sell;
import static com.walletpnl.domain.TestSwaps.swap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PositionLedgerTest {

    private InMemoryLedgerStore store;
    private FixedTokenPricer pricer;
    private PositionLedger ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        pricer = new FixedTokenPricer();
        ledger = new PositionLedger(store, pricer, LedgerSettings.defaults());
    }

    @Test
    @DisplayName("BUY then full SELL at known prices realizes +50% and closes the position")
    void buyThenFullSell_realizesProfitAndClosesPosition() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);
        Position opened = performance().getPositions().get(TOKEN_A);
        assertThat(opened.getAvgBuyPrice()).isEqualByComparingTo("0.10");

        List<Trade> trades = ledger.apply(sell("sig-2", 1, TOKEN_A, "100", "15"), TradeDirection.SELL);

        assertThat(trades).hasSize(1);
        Trade sellTrade = trades.get(0);
        assertThat(sellTrade.type()).isEqualTo(TradeType.SELL);
        assertThat(sellTrade.realizedPnl()).isEqualByComparingTo("5");
        assertThat(sellTrade.realizedPnlPercent()).isEqualByComparingTo("50");
        assertThat(sellTrade.partialTracking()).isFalse();
        WalletPerformance performance = performance();
        assertThat(performance.getPositions()).doesNotContainKey(TOKEN_A);
        assertThat(performance.getWinningTrades()).isEqualTo(1);
        assertThat(performance.getLosingTrades()).isZero();
        assertThat(performance.getTotalRealizedPnl()).isEqualByComparingTo("5");
        assertThat(performance.getTotalTrades()).isEqualTo(2);
    }

    @Test
    @DisplayName("SELL without a tracked position records nothing")
    void sellWithoutPosition_recordsNothing() {
        List<Trade> trades = ledger.apply(sell("sig-1", 0, TOKEN_A, "10", "5"), TradeDirection.SELL);

        assertThat(trades).isEmpty();
        assertThat(performance().getTotalTrades()).isZero();
        assertThat(performance().getTrades()).isEmpty();
        assertThat(performance().getPositions()).isEmpty();
    }

    @Test
    @DisplayName("SELL of more than the tracked balance realizes P&L on the tracked part only")
    void partialTrackingSell_usesTrackedFraction() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "50", "50"), TradeDirection.BUY);

        Trade trade = ledger.apply(sell("sig-2", 1, TOKEN_A, "80", "100"), TradeDirection.SELL).get(0);

        assertThat(trade.tokenAmount()).isEqualByComparingTo("50");
        assertThat(trade.usdValue()).isEqualByComparingTo("62.5");
        assertThat(trade.realizedPnl()).isEqualByComparingTo("12.5");
        assertThat(trade.realizedPnlPercent()).isEqualByComparingTo("25");
        assertThat(trade.pricePerToken()).isEqualByComparingTo("1.25");
        assertThat(trade.partialTracking()).isTrue();
        assertThat(performance().getPositions()).isEmpty();
    }

    @Test
    @DisplayName("IGNORED swaps leave the store untouched")
    void ignoredSwap_noStateChange() {
        SwapEvent baseToBase = swap("sig-1", 0, leg(SOL, "SOL", "1", "150"), leg(USDC, "USDC", "150", "150"));

        assertThat(ledger.apply(baseToBase, TradeDirection.IGNORED)).isEmpty();
        assertThat(store.find(WALLET)).isEmpty();
    }

    @Test
    @DisplayName("TOKEN_TO_TOKEN closes the input position and opens the output at outputValue / outputAmount")
    void tokenToToken_sellsInputAndBuysOutput() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);

        List<Trade> trades = ledger.apply(
                swap("sig-2", 1, leg(TOKEN_A, "AAA", "100", "20"), leg(TOKEN_B, "BBB", "500", "20")),
                TradeDirection.TOKEN_TO_TOKEN);

        assertThat(trades).extracting(Trade::type).containsExactly(TradeType.SELL, TradeType.BUY);
        assertThat(trades).extracting(Trade::signature).containsOnly("sig-2");
        assertThat(trades.get(0).realizedPnl()).isEqualByComparingTo("10");
        WalletPerformance performance = performance();
        assertThat(performance.getPositions()).containsOnlyKeys(TOKEN_B);
        Position b = performance.getPositions().get(TOKEN_B);
        assertThat(b.getAvgBuyPrice()).isEqualByComparingTo("0.04");
        assertThat(b.getTotalInvested()).isEqualByComparingTo("20");
        assertThat(performance.getTotalTrades()).isEqualTo(3);
    }

    @Test
    @DisplayName("TOKEN_TO_TOKEN without an input position records only the buy leg")
    void tokenToToken_withoutInputPosition_recordsBuyOnly() {
        List<Trade> trades = ledger.apply(
                swap("sig-1", 0, leg(TOKEN_A, "AAA", "100", null), leg(TOKEN_B, "BBB", "500", null)),
                TradeDirection.TOKEN_TO_TOKEN);

        assertThat(trades).extracting(Trade::type).containsExactly(TradeType.BUY);
        Position b = performance().getPositions().get(TOKEN_B);
        assertThat(b.getBalance()).isEqualByComparingTo("500");
        assertThat(b.getTotalInvested()).isEqualByComparingTo("0");
        assertThat(trades.get(0).usdValue()).isNull();
    }

    @Test
    @DisplayName("TOKEN_TO_TOKEN buy leg falls back to the input value when the output is unpriced")
    void tokenToToken_buyLegFallsBackToInputValue() {
        List<Trade> trades = ledger.apply(
                swap("sig-1", 0, leg(TOKEN_A, "AAA", "100", "30"), leg(TOKEN_B, "BBB", "300", null)),
                TradeDirection.TOKEN_TO_TOKEN);

        assertThat(trades.get(0).usdValue()).isEqualByComparingTo("30");
        assertThat(performance().getPositions().get(TOKEN_B).getAvgBuyPrice()).isEqualByComparingTo("0.1");
    }

    @Test
    @DisplayName("TOKEN_TO_TOKEN over-sell realizes on the full amount but never drives the balance negative")
    void tokenToToken_overSell_closesPosition() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "50", "50"), TradeDirection.BUY);

        Trade sellLeg = ledger.apply(
                swap("sig-2", 1, leg(TOKEN_A, "AAA", "80", "100"), leg(TOKEN_B, "BBB", "10", "100")),
                TradeDirection.TOKEN_TO_TOKEN).get(0);

        assertThat(sellLeg.tokenAmount()).isEqualByComparingTo("80");
        assertThat(sellLeg.realizedPnl()).isEqualByComparingTo("20");
        assertThat(sellLeg.partialTracking()).isFalse();
        assertThat(performance().getPositions()).doesNotContainKey(TOKEN_A);
    }

    @Test
    @DisplayName("a slow pricer during SELL does not hold the wallet lock against readers")
    void sell_slowPricer_readersNotBlocked() throws Exception {
        CountDownLatch pricing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TokenPricer slowPricer = new TokenPricer() {
            @Override
            public Optional<TokenMeta> getTokenMeta(String mint) {
                return Optional.empty();
            }

            @Override
            public Optional<BigDecimal> getPrice(String mint) {
                pricing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Optional.of(new BigDecimal("0.2"));
            }
        };
        PositionLedger slowLedger = new PositionLedger(store, slowPricer, LedgerSettings.defaults());
        PerformanceQueryService queryService = new PerformanceQueryService(store);
        slowLedger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);

        CompletableFuture<List<Trade>> writer = CompletableFuture.supplyAsync(
                () -> slowLedger.apply(sell("sig-2", 1, TOKEN_A, "50", "15"), TradeDirection.SELL));
        assertThat(pricing.await(2, TimeUnit.SECONDS)).isTrue();

        WalletPerformanceSnapshot snapshot = CompletableFuture
                .supplyAsync(() -> queryService.getPerformance(WALLET).orElseThrow())
                .get(1, TimeUnit.SECONDS);
        assertThat(snapshot.totalTrades()).isEqualTo(1);

        release.countDown();
        assertThat(writer.get(2, TimeUnit.SECONDS)).hasSize(1);
        assertThat(performance().getPositions().get(TOKEN_A).getCurrentValue()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("avgBuyPrice x balance equals totalInvested after every BUY")
    void buys_keepAverageConsistent() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);
        ledger.apply(buy("sig-2", 1, TOKEN_A, "50", "10"), TradeDirection.BUY);
        ledger.apply(buy("sig-3", 2, TOKEN_A, "7", "3.5"), TradeDirection.BUY);

        Position position = performance().getPositions().get(TOKEN_A);
        assertThat(position.getBalance()).isEqualByComparingTo("157");
        assertThat(position.getTotalInvested()).isEqualByComparingTo("23.5");
        assertThat(position.getAvgBuyPrice().multiply(position.getBalance()))
                .isCloseTo(position.getTotalInvested(), within(new BigDecimal("0.000000000001")));
        assertThat(position.getTrades()).hasSize(3);
    }

    @Test
    @DisplayName("BUY values the position from the output leg's implied price")
    void buy_revaluesFromOutputLeg() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);

        Position position = performance().getPositions().get(TOKEN_A);
        assertThat(position.getCurrentValue()).isEqualByComparingTo("10");
        assertThat(position.getUnrealizedPnl()).isEqualByComparingTo("0");
        assertThat(position.getUnrealizedPnlPercent()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("partial SELL shrinks cost basis pro rata and revalues from the pricer")
    void partialSell_revaluesRemainingPosition() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);
        pricer.withPrice(TOKEN_A, "0.2");

        ledger.apply(sell("sig-2", 1, TOKEN_A, "40", "8"), TradeDirection.SELL);

        Position position = performance().getPositions().get(TOKEN_A);
        assertThat(position.getBalance()).isEqualByComparingTo("60");
        assertThat(position.getTotalInvested()).isEqualByComparingTo("6");
        assertThat(position.getAvgBuyPrice()).isEqualByComparingTo("0.1");
        assertThat(position.getCurrentValue()).isEqualByComparingTo("12");
        assertThat(position.getUnrealizedPnl()).isEqualByComparingTo("6");
        assertThat(position.getUnrealizedPnlPercent()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("partial SELL with no price available leaves the remaining value unknown")
    void partialSell_unknownPrice_clearsValuation() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);

        ledger.apply(sell("sig-2", 1, TOKEN_A, "40", "8"), TradeDirection.SELL);

        Position position = performance().getPositions().get(TOKEN_A);
        assertThat(position.getCurrentValue()).isNull();
        assertThat(position.getUnrealizedPnl()).isNull();
    }

    @Test
    @DisplayName("SELL with unknown proceeds is recorded without P&L and moves no counters")
    void sellWithUnknownProceeds_recordsTradeWithoutPnl() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);

        Trade trade = ledger.apply(sell("sig-2", 1, TOKEN_A, "40", null), TradeDirection.SELL).get(0);

        assertThat(trade.realizedPnl()).isNull();
        assertThat(trade.realizedPnlPercent()).isNull();
        assertThat(trade.usdValue()).isNull();
        assertThat(trade.tokenAmount()).isEqualByComparingTo("40");
        WalletPerformance performance = performance();
        assertThat(performance.getPositions().get(TOKEN_A).getBalance()).isEqualByComparingTo("60");
        assertThat(performance.getWinningTrades() + performance.getLosingTrades()).isZero();
        assertThat(performance.getTotalRealizedPnl()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("balance at or below the dust threshold closes the position")
    void sellLeavingDust_closesPosition() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);

        ledger.apply(sell("sig-2", 1, TOKEN_A, "99.9995", "12"), TradeDirection.SELL);

        assertThat(performance().getPositions()).isEmpty();
    }

    @Test
    @DisplayName("realized P&L within the meaningful threshold counts as neither win nor loss")
    void negligiblePnl_notCounted() {
        ledger.apply(buy("sig-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY);
        ledger.apply(sell("sig-2", 1, TOKEN_A, "50", "5.005"), TradeDirection.SELL);
        ledger.apply(sell("sig-3", 2, TOKEN_A, "50", "4"), TradeDirection.SELL);

        WalletPerformance performance = performance();
        assertThat(performance.getWinningTrades()).isZero();
        assertThat(performance.getLosingTrades()).isEqualTo(1);
        assertThat(performance.getTotalRealizedPnl()).isEqualByComparingTo("-0.995");
    }

    @Test
    @DisplayName("applying the same signature twice is a no-op")
    void duplicateSignature_ignored() {
        SwapEvent event = buy("sig-1", 0, TOKEN_A, "100", "10");
        ledger.apply(event, TradeDirection.BUY);

        assertThat(ledger.apply(event, TradeDirection.BUY)).isEmpty();
        assertThat(performance().getPositions().get(TOKEN_A).getBalance()).isEqualByComparingTo("100");
        assertThat(performance().getTotalTrades()).isEqualTo(1);
    }

    @Test
    @DisplayName("sum of trade realized P&L equals totalRealizedPnl")
    void realizedPnl_isConserved() {
        history().forEach(step -> ledger.apply(step.event(), step.direction()));

        WalletPerformance performance = performance();
        BigDecimal sum = performance.getTrades().stream()
                .map(Trade::knownRealizedPnl)
                .flatMap(Optional::stream)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(sum).isEqualByComparingTo(performance.getTotalRealizedPnl());
        assertThat(performance.getPositions().values())
                .allSatisfy(p -> assertThat(p.getBalance().signum()).isPositive());
    }

    @Test
    @DisplayName("replaying the same history into an empty store yields identical state")
    void replay_isDeterministic() {
        InMemoryLedgerStore otherStore = new InMemoryLedgerStore();
        PositionLedger other = new PositionLedger(otherStore, pricer, LedgerSettings.defaults());

        history().forEach(step -> ledger.apply(step.event(), step.direction()));
        history().forEach(step -> other.apply(step.event(), step.direction()));

        assertThat(otherStore.getOrCreate(WALLET))
                .usingRecursiveComparison()
                .isEqualTo(performance());
    }

    private WalletPerformance performance() {
        return store.getOrCreate(WALLET);
    }

    private static List<Step> history() {
        return List.of(
                new Step(buy("h-1", 0, TOKEN_A, "100", "10"), TradeDirection.BUY),
                new Step(buy("h-2", 1, TOKEN_B, "20", "40"), TradeDirection.BUY),
                new Step(sell("h-3", 2, TOKEN_A, "30", "6"), TradeDirection.SELL),
                new Step(swap("h-4", 3, leg(TOKEN_B, "BBB", "10", "15"), leg(TOKEN_A, "AAA", "50", "15")),
                        TradeDirection.TOKEN_TO_TOKEN),
                new Step(sell("h-5", 4, TOKEN_B, "15", "12"), TradeDirection.SELL),
                new Step(sell("h-6", 5, TOKEN_A, "60", null), TradeDirection.SELL));
    }

    private record Step(SwapEvent event, TradeDirection direction) {
    }
}
