package com.walletpnl.report;

import com.walletpnl.config.TrackerProperties;
import com.walletpnl.domain.TradeRecordedEvent;
import com.walletpnl.ledger.query.PerformanceQueryService;
import com.walletpnl.ledger.query.WalletPerformanceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes one line per recorded trade to the TRADES log, and every N trades a dashboard of every wallet
 * that has traded.
 */
@Component
@Slf4j(topic = "TRADES")
public class TradeReportListener {

    private final PerformanceQueryService queryService;
    private final TrackerProperties trackerProperties;
    private final PerformanceDashboardFormatter formatter = new PerformanceDashboardFormatter();
    private final AtomicInteger tradeCount = new AtomicInteger();

    public TradeReportListener(PerformanceQueryService queryService, TrackerProperties trackerProperties) {
        this.queryService = queryService;
        this.trackerProperties = trackerProperties;
    }

    @EventListener
    public void onTradeRecorded(TradeRecordedEvent event) {
        log.info(formatter.formatTrade(event.walletAddress(), event.trade()));
        if (tradeCount.incrementAndGet() % trackerProperties.getDashboardEveryTrades() == 0) {
            logDashboard();
        }
    }

    void logDashboard() {
        for (WalletPerformanceSnapshot performance : queryService.getAllPerformances()) {
            if (performance.totalTrades() == 0) {
                continue;
            }
            String wallet = performance.walletAddress();
            log.info(formatter.formatDashboard(performance,
                    queryService.getTopPositions(wallet),
                    queryService.getRecentTrades(wallet)));
        }
    }
}
