package com.walletpnl.api.controller;

import com.walletpnl.api.dto.ErrorBody;
import com.walletpnl.api.dto.PositionResponse;
import com.walletpnl.api.dto.TradeResponse;
import com.walletpnl.api.dto.WalletPerformanceResponse;
import com.walletpnl.api.validation.AddressValidator;
import com.walletpnl.ledger.query.PerformanceQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only performance API: GET /wallets, GET /wallets/{address}/performance|positions|trades.
 */
@RestController
@RequestMapping("/api/v1/wallets")
@RequiredArgsConstructor
public class PerformanceController {

    private final AddressValidator addressValidator;
    private final PerformanceQueryService queryService;

    @GetMapping
    public ResponseEntity<List<WalletPerformanceResponse>> listWallets() {
        return ResponseEntity.ok(queryService.getAllPerformances().stream()
                .map(WalletPerformanceResponse::from)
                .toList());
    }

    @GetMapping("/{address}/performance")
    public ResponseEntity<?> getPerformance(@PathVariable String address) {
        if (!addressValidator.isValidAddress(address)) {
            return invalidAddress();
        }
        return queryService.getPerformance(address.trim())
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok(WalletPerformanceResponse.from(p)))
                .orElseGet(() -> walletNotFound(address));
    }

    @GetMapping("/{address}/positions")
    public ResponseEntity<?> getTopPositions(@PathVariable String address,
                                             @RequestParam(required = false) Integer limit) {
        if (!addressValidator.isValidAddress(address)) {
            return invalidAddress();
        }
        if (!addressValidator.isValidLimit(limit)) {
            return invalidLimit();
        }
        String wallet = address.trim();
        if (queryService.getPerformance(wallet).isEmpty()) {
            return walletNotFound(wallet);
        }
        int n = limit != null ? limit : PerformanceQueryService.DEFAULT_TOP_POSITIONS;
        return ResponseEntity.ok(queryService.getTopPositions(wallet, n).stream()
                .map(PositionResponse::from)
                .toList());
    }

    @GetMapping("/{address}/trades")
    public ResponseEntity<?> getRecentTrades(@PathVariable String address,
                                             @RequestParam(required = false) Integer limit) {
        if (!addressValidator.isValidAddress(address)) {
            return invalidAddress();
        }
        if (!addressValidator.isValidLimit(limit)) {
            return invalidLimit();
        }
        String wallet = address.trim();
        if (queryService.getPerformance(wallet).isEmpty()) {
            return walletNotFound(wallet);
        }
        int n = limit != null ? limit : PerformanceQueryService.DEFAULT_RECENT_TRADES;
        return ResponseEntity.ok(queryService.getRecentTrades(wallet, n).stream()
                .map(TradeResponse::from)
                .toList());
    }

    private static ResponseEntity<?> invalidAddress() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address format"));
    }

    private static ResponseEntity<?> invalidLimit() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_LIMIT",
                "limit must be between 1 and " + AddressValidator.MAX_LIMIT));
    }

    private static ResponseEntity<?> walletNotFound(String address) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorBody.of("WALLET_NOT_FOUND", "Wallet is not tracked: " + address));
    }
}
