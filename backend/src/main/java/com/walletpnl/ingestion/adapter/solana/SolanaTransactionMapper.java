package com.walletpnl.ingestion.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletpnl.domain.RawSwapTransaction;
import com.walletpnl.domain.TokenBalance;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a getTransaction result (jsonParsed or json encoding) to a {@link RawSwapTransaction} seen from one wallet.
 * Failed transactions (meta.err set) map to empty.
 */
public final class SolanaTransactionMapper {

    private SolanaTransactionMapper() {
    }

    public static Optional<RawSwapTransaction> map(String signature, String walletAddress, JsonNode result) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode meta = result.path("meta");
        if (meta.isMissingNode() || meta.isNull()) {
            return Optional.empty();
        }
        JsonNode err = meta.path("err");
        if (!err.isMissingNode() && !err.isNull()) {
            return Optional.empty();
        }
        Instant blockTime = result.path("blockTime").isNumber()
                ? Instant.ofEpochSecond(result.path("blockTime").asLong())
                : null;
        return Optional.of(new RawSwapTransaction(
                signature,
                walletAddress,
                blockTime,
                accountKeys(result.path("transaction").path("message"), meta),
                lamports(meta.path("preBalances")),
                lamports(meta.path("postBalances")),
                tokenBalances(meta.path("preTokenBalances")),
                tokenBalances(meta.path("postTokenBalances"))));
    }

    /**
     * Static keys followed by address-lookup-table keys (writable, then readonly), matching the index space
     * of pre/post balances. jsonParsed already inlines loaded keys, so duplicates are skipped.
     */
    static List<String> accountKeys(JsonNode message, JsonNode meta) {
        Set<String> keys = new LinkedHashSet<>();
        for (JsonNode key : message.path("accountKeys")) {
            String pubkey = key.isTextual() ? key.asText() : key.path("pubkey").asText(null);
            if (pubkey != null) {
                keys.add(pubkey);
            }
        }
        JsonNode loaded = meta.path("loadedAddresses");
        for (JsonNode key : loaded.path("writable")) {
            keys.add(key.asText());
        }
        for (JsonNode key : loaded.path("readonly")) {
            keys.add(key.asText());
        }
        return new ArrayList<>(keys);
    }

    private static List<Long> lamports(JsonNode array) {
        List<Long> out = new ArrayList<>();
        for (JsonNode value : array) {
            out.add(value.asLong());
        }
        return out;
    }

    private static List<TokenBalance> tokenBalances(JsonNode array) {
        List<TokenBalance> out = new ArrayList<>();
        for (JsonNode entry : array) {
            String mint = entry.path("mint").asText(null);
            JsonNode amount = entry.path("uiTokenAmount");
            if (mint == null || !amount.hasNonNull("amount")) {
                continue;
            }
            out.add(new TokenBalance(
                    entry.path("accountIndex").asInt(),
                    mint,
                    entry.path("owner").asText(null),
                    new BigInteger(amount.path("amount").asText()),
                    amount.path("decimals").asInt()));
        }
        return out;
    }
}
