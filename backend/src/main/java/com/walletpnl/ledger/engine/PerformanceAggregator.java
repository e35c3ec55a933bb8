package com.walletpnl.ledger.engine;

import com.walletpnl.domain.Position;
import com.walletpnl.domain.WalletPerformance;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Re-derives a wallet's summary figures from its positions and realized P&amp;L. Pure: calling it twice in a
 * row yields the same state. Positions with unknown current value contribute no unrealized P&amp;L.
 * <p>
 * ROI is {@code totalPnl / (openCostBasis + |totalRealizedPnl|) * 100}. The denominator mixes cost basis
 * with realized P&amp;L rather than total capital deployed; the figure is kept as documented.
 */
public class PerformanceAggregator {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public void recompute(WalletPerformance performance) {
        synchronized (performance) {
            BigDecimal unrealized = BigDecimal.ZERO;
            BigDecimal invested = BigDecimal.ZERO;
            for (Position position : performance.getPositions().values()) {
                if (position.getUnrealizedPnl() != null) {
                    unrealized = unrealized.add(position.getUnrealizedPnl());
                }
                invested = invested.add(position.getTotalInvested());
            }
            BigDecimal totalPnl = performance.getTotalRealizedPnl().add(unrealized);
            performance.setTotalUnrealizedPnl(unrealized);
            performance.setTotalInvested(invested);
            performance.setTotalPnl(totalPnl);

            int decided = performance.getWinningTrades() + performance.getLosingTrades();
            performance.setWinRate(decided > 0
                    ? BigDecimal.valueOf(performance.getWinningTrades()).multiply(HUNDRED)
                            .divide(BigDecimal.valueOf(decided), SCALE, ROUNDING)
                    : BigDecimal.ZERO);

            BigDecimal denominator = invested.add(performance.getTotalRealizedPnl().abs());
            performance.setRoi(denominator.signum() > 0
                    ? totalPnl.divide(denominator, SCALE, ROUNDING).multiply(HUNDRED)
                    : BigDecimal.ZERO);
        }
    }
}
