package com.walletpnl.ledger.engine;

import com.walletpnl.domain.Position;
import com.walletpnl.domain.SwapEvent;
import com.walletpnl.domain.TokenLeg;
import com.walletpnl.domain.Trade;
import com.walletpnl.domain.TradeDirection;
import com.walletpnl.domain.TradeType;
import com.walletpnl.domain.WalletPerformance;
import com.walletpnl.ledger.store.LedgerStore;
import com.walletpnl.pricing.TokenPricer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Average-cost position ledger. Applies one classified swap to its wallet's positions and realized P&amp;L.
 * <p>
 * BUY adds cost and amount to the position and re-derives the average buy price. SELL realizes P&amp;L on the
 * tracked part of the sold amount against the average price and shrinks cost basis pro rata; positions at or
 * below the dust threshold are closed. TOKEN_TO_TOKEN is a SELL of the input (when tracked) followed by a BUY
 * of the output. A USD side that is unknown stays unknown on the trade: no P&amp;L is realized for it.
 * <p>
 * Each signature is applied at most once per wallet. Callers serialize work per wallet; this class also holds
 * the wallet's monitor while mutating so readers never see a half-applied swap. Pricer lookups happen before
 * the monitor is taken.
 */
@Slf4j
public class PositionLedger {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LedgerStore store;
    private final TokenPricer pricer;
    private final LedgerSettings settings;

    public PositionLedger(LedgerStore store, TokenPricer pricer, LedgerSettings settings) {
        this.store = store;
        this.pricer = pricer;
        this.settings = settings;
    }

    /**
     * Applies the swap and returns the trades recorded: none for IGNORED, duplicates and untracked sells;
     * one for BUY and SELL; up to two (SELL then BUY) for TOKEN_TO_TOKEN.
     */
    public List<Trade> apply(SwapEvent event, TradeDirection direction) {
        if (direction == null || direction == TradeDirection.IGNORED) {
            return List.of();
        }
        BigDecimal priceAfterSell = direction == TradeDirection.SELL
                ? pricer.getPrice(event.inputLeg().mint()).orElse(null)
                : null;
        WalletPerformance performance = store.getOrCreate(event.wallet());
        synchronized (performance) {
            if (!performance.markProcessed(event.signature())) {
                log.debug("Swap {} already applied for wallet {}", event.signature(), event.wallet());
                return List.of();
            }
            List<Trade> trades = new ArrayList<>(2);
            switch (direction) {
                case BUY -> applyBuy(performance, event, event.outputLeg(), event.inputLeg().usdValue())
                        .ifPresent(trades::add);
                case SELL -> applySell(performance, event, priceAfterSell).ifPresent(trades::add);
                case TOKEN_TO_TOKEN -> applyTokenToToken(performance, event, trades);
                default -> { }
            }
            if (!trades.isEmpty()) {
                performance.setLastUpdatedAt(event.timestamp());
            }
            return trades;
        }
    }

    private Optional<Trade> applyBuy(WalletPerformance performance, SwapEvent event, TokenLeg bought,
                                     BigDecimal valueUsd) {
        BigDecimal amount = bought.uiAmount();
        if (amount.signum() <= 0) {
            log.warn("Swap {} buys zero {} for wallet {}; skipped", event.signature(), bought.symbol(), event.wallet());
            return Optional.empty();
        }
        BigDecimal cost = valueUsd != null ? valueUsd : BigDecimal.ZERO;
        Position position = performance.getPositions()
                .computeIfAbsent(bought.mint(), mint -> new Position(mint, bought.symbol(), bought.name()));
        position.setTotalInvested(position.getTotalInvested().add(cost));
        position.setBalance(position.getBalance().add(amount));
        position.setAvgBuyPrice(position.getTotalInvested().divide(position.getBalance(), SCALE, ROUNDING));
        revalue(position, bought.impliedUnitPrice(SCALE).orElse(position.getLastPriceUsd()));

        BigDecimal pricePerToken = valueUsd != null ? cost.divide(amount, SCALE, ROUNDING) : null;
        Trade trade = Trade.buy(event.signature(), event.timestamp(), bought.mint(), bought.symbol(), amount,
                pricePerToken, valueUsd);
        position.addTrade(trade);
        performance.recordTrade(trade);
        return Optional.of(trade);
    }

    private Optional<Trade> applySell(WalletPerformance performance, SwapEvent event, BigDecimal priceAfter) {
        TokenLeg sold = event.inputLeg();
        Position position = openPosition(performance, sold.mint());
        if (position == null) {
            log.warn("Sell of {} {} in {} for wallet {} has no tracked position; skipped",
                    sold.uiAmount().toPlainString(), sold.symbol(), event.signature(), event.wallet());
            return Optional.empty();
        }
        if (sold.uiAmount().compareTo(position.getBalance()) > 0) {
            log.warn("Partial tracking: {} sells {} {} but only {} is tracked for wallet {}",
                    event.signature(), sold.uiAmount().toPlainString(), sold.symbol(),
                    position.getBalance().toPlainString(), event.wallet());
        }
        return realize(performance, event, position, sold, event.outputLeg().usdValue(), true, priceAfter);
    }

    private void applyTokenToToken(WalletPerformance performance, SwapEvent event, List<Trade> trades) {
        TokenLeg input = event.inputLeg();
        TokenLeg output = event.outputLeg();
        Position inputPosition = openPosition(performance, input.mint());
        if (inputPosition == null) {
            log.warn("Token swap {} spends untracked {} for wallet {}; recording the {} buy only",
                    event.signature(), input.symbol(), event.wallet(), output.symbol());
        } else {
            BigDecimal inputPrice = input.impliedUnitPrice(SCALE).orElse(inputPosition.getLastPriceUsd());
            realize(performance, event, inputPosition, input, output.usdValue(), false, inputPrice)
                    .ifPresent(trades::add);
        }
        BigDecimal boughtValue = output.usdValue() != null ? output.usdValue() : input.usdValue();
        applyBuy(performance, event, output, boughtValue).ifPresent(trades::add);
    }

    /**
     * Realizes P&amp;L for selling {@code sold} out of {@code position}. When {@code clampToBalance} is set, only
     * the tracked part of the sale carries P&amp;L and its share of the proceeds, and an over-sell is flagged as
     * partial tracking; otherwise the full amount does. The position itself never goes below zero.
     */
    private Optional<Trade> realize(WalletPerformance performance, SwapEvent event, Position position,
                                    TokenLeg sold, BigDecimal receivedUsd, boolean clampToBalance,
                                    BigDecimal priceAfter) {
        BigDecimal soldAmount = sold.uiAmount();
        if (soldAmount.signum() <= 0) {
            log.warn("Swap {} sells zero {} for wallet {}; skipped", event.signature(), sold.symbol(), event.wallet());
            return Optional.empty();
        }
        BigDecimal balanceBefore = position.getBalance();
        boolean partial = clampToBalance && soldAmount.compareTo(balanceBefore) > 0;
        BigDecimal pnlAmount = clampToBalance ? soldAmount.min(balanceBefore) : soldAmount;
        BigDecimal costBasis = position.getAvgBuyPrice().multiply(pnlAmount);

        BigDecimal proceeds = null;
        BigDecimal realizedPnl = null;
        BigDecimal realizedPnlPercent = null;
        BigDecimal pricePerToken = null;
        if (receivedUsd != null) {
            proceeds = receivedUsd.multiply(pnlAmount).divide(soldAmount, SCALE, ROUNDING);
            realizedPnl = proceeds.subtract(costBasis);
            realizedPnlPercent = costBasis.signum() > 0
                    ? realizedPnl.divide(costBasis, SCALE, ROUNDING).multiply(HUNDRED)
                    : BigDecimal.ZERO;
            pricePerToken = receivedUsd.divide(soldAmount, SCALE, ROUNDING);
            countOutcome(performance, realizedPnl);
            performance.setTotalRealizedPnl(performance.getTotalRealizedPnl().add(realizedPnl));
        } else {
            log.debug("Proceeds of {} in {} unknown; no P&L realized", sold.symbol(), event.signature());
        }

        BigDecimal reduction = soldAmount.min(balanceBefore);
        BigDecimal investedReleased = position.getTotalInvested().multiply(reduction)
                .divide(balanceBefore, SCALE, ROUNDING);
        position.setTotalInvested(position.getTotalInvested().subtract(investedReleased));
        position.setBalance(balanceBefore.subtract(reduction));

        Trade trade = new Trade(event.signature(), event.timestamp(), TradeType.SELL, sold.mint(), sold.symbol(),
                pnlAmount, pricePerToken, proceeds, realizedPnl, realizedPnlPercent, partial);
        position.addTrade(trade);
        performance.recordTrade(trade);

        if (position.getBalance().compareTo(settings.dustThreshold()) <= 0) {
            position.setBalance(BigDecimal.ZERO);
            position.setTotalInvested(BigDecimal.ZERO);
            performance.getPositions().remove(position.getMint());
        } else {
            revalue(position, priceAfter);
        }
        return Optional.of(trade);
    }

    private void countOutcome(WalletPerformance performance, BigDecimal realizedPnl) {
        if (realizedPnl.abs().compareTo(settings.minMeaningfulPnl()) <= 0) {
            return;
        }
        if (realizedPnl.signum() > 0) {
            performance.setWinningTrades(performance.getWinningTrades() + 1);
        } else {
            performance.setLosingTrades(performance.getLosingTrades() + 1);
        }
    }

    private static Position openPosition(WalletPerformance performance, String mint) {
        Position position = performance.getPositions().get(mint);
        return position != null && position.getBalance().signum() > 0 ? position : null;
    }

    /**
     * Mark-to-market at {@code unitPrice}; a null price leaves the position's value unknown.
     */
    private static void revalue(Position position, BigDecimal unitPrice) {
        if (unitPrice == null) {
            position.setCurrentValue(null);
            position.setUnrealizedPnl(null);
            position.setUnrealizedPnlPercent(null);
            return;
        }
        position.setLastPriceUsd(unitPrice);
        BigDecimal currentValue = position.getBalance().multiply(unitPrice).setScale(SCALE, ROUNDING);
        BigDecimal unrealized = currentValue.subtract(position.getTotalInvested());
        position.setCurrentValue(currentValue);
        position.setUnrealizedPnl(unrealized);
        position.setUnrealizedPnlPercent(position.getTotalInvested().signum() > 0
                ? unrealized.divide(position.getTotalInvested(), SCALE, ROUNDING).multiply(HUNDRED)
                : BigDecimal.ZERO);
    }
}
