package com.walletpnl.report;

import com.walletpnl.config.TrackerProperties;
import com.walletpnl.domain.Trade;
import com.walletpnl.domain.TradeDirection;
import com.walletpnl.domain.TradeRecordedEvent;
import com.walletpnl.domain.TradeType;
import com.walletpnl.ledger.query.PerformanceQueryService;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static com.walletpnl.domain.TestSwaps.TOKEN_A;
import static com.walletpnl.domain.TestSwaps.WALLET;
import static com.walletpnl.domain.TestSwaps.buy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TradeReportListenerTest {

    @Test
    void dashboard_loggedEveryNthTrade() {
        PerformanceQueryService queryService = mock(PerformanceQueryService.class);
        TrackerProperties properties = new TrackerProperties();
        properties.setDashboardEveryTrades(2);
        TradeReportListener listener = new TradeReportListener(queryService, properties);
        Trade trade = Trade.buy("sig-1", Instant.parse("2025-03-01T12:00:00Z"), TOKEN_A, "AAA",
                new BigDecimal("100"), new BigDecimal("0.1"), new BigDecimal("10"));
        TradeRecordedEvent event = new TradeRecordedEvent(WALLET, TradeDirection.BUY,
                buy("sig-1", 0, TOKEN_A, "100", "10"), trade);

        listener.onTradeRecorded(event);
        verify(queryService, never()).getAllPerformances();

        listener.onTradeRecorded(event);
        verify(queryService, times(1)).getAllPerformances();
    }

    @Test
    void formatTrade_sellShowsRealizedAndPartialFlag() {
        Trade sell = new Trade("sig-9", Instant.parse("2025-03-01T12:00:00Z"), TradeType.SELL,
                TOKEN_A, "AAA", new BigDecimal("50"), new BigDecimal("0.3"), new BigDecimal("15"),
                new BigDecimal("10"), new BigDecimal("200"), true);

        String line = new PerformanceDashboardFormatter().formatTrade(WALLET, sell);

        assertThat(line).contains("SELL 50.00 AAA @ $0.30 = $15.00")
                .contains("realized +$10.00 (+200.00%)")
                .contains("[partial]")
                .endsWith("https://solscan.io/tx/sig-9");
    }
}
