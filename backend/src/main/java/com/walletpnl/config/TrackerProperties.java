package com.walletpnl.config;

import com.walletpnl.common.BaseAssetRegistry;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Watched wallets and ledger thresholds. Documented in application.yml under walletpnl.tracker.
 */
@ConfigurationProperties(prefix = "walletpnl.tracker")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class TrackerProperties {

    /** Wallet addresses to watch. Startup fails when empty. */
    private List<String> wallets = new ArrayList<>();

    /** Quote assets: buying with one of these opens a position, selling into one closes it. */
    @NotEmpty
    private List<String> baseMints = new ArrayList<>(List.of(
            BaseAssetRegistry.WRAPPED_SOL_MINT,
            BaseAssetRegistry.USDC_MINT,
            BaseAssetRegistry.USDT_MINT));

    /** Balance changes at or below this UI amount are ignored by the classifier. */
    @DecimalMin("0")
    private BigDecimal noiseFloor = new BigDecimal("0.0001");

    /** A position at or below this balance after a sell is closed. */
    @DecimalMin("0")
    private BigDecimal dustThreshold = new BigDecimal("0.001");

    /** Realized P&L within ± this amount counts as neither a win nor a loss. */
    @DecimalMin("0")
    private BigDecimal minMeaningfulPnlUsd = new BigDecimal("0.01");

    /** Swaps whose known legs total less than this are skipped. Swaps with no known USD value pass. */
    @DecimalMin("0")
    private BigDecimal minSwapValueUsd = BigDecimal.ONE;

    /** Log the performance dashboard after every N recorded trades. */
    @Min(1)
    private int dashboardEveryTrades = 10;

    /** Wait before fetching a notified transaction so RPC nodes have it. */
    @Min(0)
    private long confirmationDelayMs = 1_000;
}
