package com.walletpnl.ingestion.classifier;

import com.walletpnl.common.BaseAssetRegistry;
import com.walletpnl.domain.DexVenue;
import com.walletpnl.domain.RawSwapTransaction;
import com.walletpnl.domain.SwapEvent;
import com.walletpnl.domain.TokenLeg;
import com.walletpnl.pricing.TokenMeta;
import com.walletpnl.pricing.TokenPricer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Turns a raw transaction into at most one {@link SwapEvent} for the watched wallet.
 * The venue is detected from the account keys and selects the leg parser; legs are valued through the pricer.
 * Anything that is not a two-sided swap (transfers, failed parses, dust) yields empty.
 */
@Slf4j
public class SwapClassifier {

    static final String UNKNOWN_SYMBOL = "UNKNOWN";
    static final String UNKNOWN_NAME = "Unknown Token";
    private static final TokenMeta NATIVE_SOL = new TokenMeta(BaseAssetRegistry.WRAPPED_SOL_MINT, "SOL", "Solana",
            BalanceDeltaExtractor.NATIVE_DECIMALS);

    private final BalanceDeltaExtractor extractor;
    private final TokenPricer tokenPricer;
    private final VenueSwapParser genericParser = new GenericBalanceDeltaParser();
    private final VenueSwapParser pumpFunParser = new PumpFunBondingCurveParser();

    public SwapClassifier(BalanceDeltaExtractor extractor, TokenPricer tokenPricer) {
        this.extractor = extractor;
        this.tokenPricer = tokenPricer;
    }

    public Optional<SwapEvent> classify(RawSwapTransaction tx) {
        if (tx == null || tx.signature() == null || tx.walletAddress() == null) {
            return Optional.empty();
        }
        DexVenue venue = DexVenue.detect(tx.accountKeys());
        List<BalanceDelta> deltas = extractor.extract(tx);
        Optional<LegSelection> selection = parserFor(venue).select(deltas);
        if (selection.isEmpty()) {
            log.debug("No swap in {} for wallet {} (venue {}, {} qualifying deltas)",
                    tx.signature(), tx.walletAddress(), venue, deltas.size());
            return Optional.empty();
        }
        TokenLeg input = toLeg(selection.get().input());
        TokenLeg output = toLeg(selection.get().output());
        return Optional.of(new SwapEvent(tx.signature(), tx.blockTime(), tx.walletAddress(), input, output, venue));
    }

    VenueSwapParser parserFor(DexVenue venue) {
        return switch (venue) {
            case PUMP_FUN -> pumpFunParser;
            case RAYDIUM_V4, RAYDIUM_CLMM, ORCA_WHIRLPOOL, JUPITER_V6, METEORA, UNKNOWN -> genericParser;
        };
    }

    private TokenLeg toLeg(BalanceDelta delta) {
        String mint = delta.mint();
        Optional<TokenMeta> meta = BaseAssetRegistry.WRAPPED_SOL_MINT.equals(mint)
                ? Optional.of(NATIVE_SOL)
                : tokenPricer.getTokenMeta(mint);
        BigDecimal price = tokenPricer.getPrice(mint).orElse(null);
        return TokenLeg.ofRaw(
                mint,
                meta.map(TokenMeta::symbol).orElse(UNKNOWN_SYMBOL),
                meta.map(TokenMeta::name).orElse(UNKNOWN_NAME),
                delta.rawDelta().abs(),
                delta.decimals(),
                price);
    }
}
