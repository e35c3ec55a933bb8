package com.walletpnl.ledger.engine;

import com.walletpnl.common.BaseAssetRegistry;
import com.walletpnl.domain.SwapEvent;
import com.walletpnl.domain.TradeDirection;

import java.util.Set;

/**
 * Direction of a swap relative to the base-asset set: paying with a base asset is a BUY, receiving one is a
 * SELL, neither side base is TOKEN_TO_TOKEN, both sides base is IGNORED.
 */
public class DirectionResolver {

    private final BaseAssetRegistry baseAssets;

    public DirectionResolver(BaseAssetRegistry baseAssets) {
        this.baseAssets = baseAssets;
    }

    public TradeDirection resolve(SwapEvent event) {
        return resolve(event, baseAssets.getBaseMints());
    }

    public static TradeDirection resolve(SwapEvent event, Set<String> baseMints) {
        boolean inputIsBase = baseMints.contains(event.inputLeg().mint());
        boolean outputIsBase = baseMints.contains(event.outputLeg().mint());
        if (inputIsBase && outputIsBase) {
            return TradeDirection.IGNORED;
        }
        if (inputIsBase) {
            return TradeDirection.BUY;
        }
        if (outputIsBase) {
            return TradeDirection.SELL;
        }
        return TradeDirection.TOKEN_TO_TOKEN;
    }
}
