package com.walletpnl.report;

import com.walletpnl.domain.Trade;
import com.walletpnl.domain.TradeType;
import com.walletpnl.ledger.query.PositionSnapshot;
import com.walletpnl.ledger.query.WalletPerformanceSnapshot;

import java.util.List;

/**
 * Plain-text rendering of trades and wallet dashboards for the trade log.
 */
public class PerformanceDashboardFormatter {

    private static final String RULE = "=".repeat(72);
    private static final String THIN_RULE = "-".repeat(72);

    public String formatTrade(String walletAddress, Trade trade) {
        StringBuilder line = new StringBuilder()
                .append(trade.type()).append(' ')
                .append(ReportFormat.number(trade.tokenAmount())).append(' ').append(trade.tokenSymbol())
                .append(" @ ").append(ReportFormat.usd(trade.pricePerToken()))
                .append(" = ").append(ReportFormat.usd(trade.usdValue()))
                .append(" | wallet ").append(ReportFormat.shortAddress(walletAddress, 4));
        if (trade.type() == TradeType.SELL) {
            line.append(" | realized ").append(ReportFormat.signedUsd(trade.realizedPnl()))
                    .append(" (").append(ReportFormat.percent(trade.realizedPnlPercent())).append(')');
            if (trade.partialTracking()) {
                line.append(" [partial]");
            }
        }
        return line.append(" | https://solscan.io/tx/").append(trade.signature()).toString();
    }

    public String formatDashboard(WalletPerformanceSnapshot performance, List<PositionSnapshot> topPositions,
                                  List<Trade> recentTrades) {
        StringBuilder out = new StringBuilder();
        out.append('\n').append(RULE).append('\n');
        out.append("PERFORMANCE ").append(performance.walletAddress()).append('\n');
        out.append(RULE).append('\n');
        out.append(String.format("Trades: %d (W %d / L %d, win rate %s)%n",
                performance.totalTrades(), performance.winningTrades(), performance.losingTrades(),
                ReportFormat.percent(performance.winRate())));
        out.append(String.format("Realized: %s  Unrealized: %s  Total: %s%n",
                ReportFormat.signedUsd(performance.totalRealizedPnl()),
                ReportFormat.signedUsd(performance.totalUnrealizedPnl()),
                ReportFormat.signedUsd(performance.totalPnl())));
        out.append(String.format("Invested: %s  ROI: %s  Open positions: %d%n",
                ReportFormat.usd(performance.totalInvested()),
                ReportFormat.percent(performance.roi()),
                performance.positions().size()));
        if (!topPositions.isEmpty()) {
            out.append(THIN_RULE).append('\n').append("Top positions").append('\n');
            for (PositionSnapshot position : topPositions) {
                out.append(String.format("  %-10s bal %s  avg %s  value %s  uPnL %s (%s)%n",
                        position.symbol(),
                        ReportFormat.number(position.balance()),
                        ReportFormat.usd(position.avgBuyPrice()),
                        ReportFormat.usd(position.currentValue()),
                        ReportFormat.signedUsd(position.unrealizedPnl()),
                        ReportFormat.percent(position.unrealizedPnlPercent())));
            }
        }
        if (!recentTrades.isEmpty()) {
            out.append(THIN_RULE).append('\n').append("Recent trades").append('\n');
            for (Trade trade : recentTrades) {
                out.append(String.format("  %-4s %s %s for %s%s%n",
                        trade.type(),
                        ReportFormat.number(trade.tokenAmount()),
                        trade.tokenSymbol(),
                        ReportFormat.usd(trade.usdValue()),
                        trade.type() == TradeType.SELL
                                ? " (" + ReportFormat.signedUsd(trade.realizedPnl()) + ")"
                                : ""));
            }
        }
        return out.append(RULE).toString();
    }
}
