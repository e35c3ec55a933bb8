package com.walletpnl.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.walletpnl.pricing.config.PricingProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token metadata and spot USD prices from Jupiter Ultra /search. One lookup fills both caches.
 * Fresh prices live for the configured TTL (60s by default); when a lookup fails or is throttled the last
 * known price is served from the stale cache, and only when neither exists is the price reported unavailable.
 * Mints that Jupiter does not list, or lists without a price, are remembered as misses for the price TTL and
 * not looked up again until then.
 */
@Slf4j
public class JupiterTokenPricer implements TokenPricer {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final WebClient webClient;
    private final PricingProperties properties;
    private final Caches caches;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    /** Mints whose failure was already logged at WARN; later failures go to DEBUG. */
    private final Set<String> failedLookups = ConcurrentHashMap.newKeySet();

    public JupiterTokenPricer(WebClient webClient, PricingProperties properties, Caches caches,
                              RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.properties = properties;
        this.caches = caches;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<TokenMeta> getTokenMeta(String mint) {
        if (mint == null || mint.isBlank()) {
            return Optional.empty();
        }
        TokenMeta cached = caches.meta().getIfPresent(mint);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (isRecentMiss(mint)) {
            return Optional.empty();
        }
        return lookup(mint).map(SearchHit::meta);
    }

    @Override
    public Optional<BigDecimal> getPrice(String mint) {
        if (mint == null || mint.isBlank()) {
            return Optional.empty();
        }
        BigDecimal fresh = caches.freshPrices().getIfPresent(mint);
        if (fresh != null) {
            return Optional.of(fresh);
        }
        if (!isRecentMiss(mint)) {
            Optional<BigDecimal> looked = lookup(mint).map(SearchHit::usdPrice);
            if (looked.isPresent()) {
                return looked;
            }
        }
        BigDecimal stale = caches.stalePrices().getIfPresent(mint);
        if (stale != null) {
            log.debug("Serving stale price for {}", mint);
        }
        return Optional.ofNullable(stale);
    }

    private Optional<SearchHit> lookup(String mint) {
        if (!rateLimiter.acquirePermission()) {
            log.debug("Jupiter lookup for {} throttled locally", mint);
            return Optional.empty();
        }
        try {
            String body = webClient.get()
                    .uri(uri -> uri.path("/search").queryParam("query", mint).build())
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                    .block();
            Optional<SearchHit> hit = parseSearch(body, mint, objectMapper);
            if (hit.isEmpty()) {
                caches.misses().put(mint, Boolean.TRUE);
                noteFailure(mint, "not found in Jupiter token search");
                return Optional.empty();
            }
            failedLookups.remove(mint);
            caches.meta().put(mint, hit.get().meta());
            if (hit.get().usdPrice() != null) {
                caches.misses().invalidate(mint);
                caches.freshPrices().put(mint, hit.get().usdPrice());
                caches.stalePrices().put(mint, hit.get().usdPrice());
            } else {
                caches.misses().put(mint, Boolean.TRUE);
            }
            return hit;
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 429) {
                noteFailure(mint, "rate limited by Jupiter; set walletpnl.pricing.jupiter-api-key for higher limits");
            } else {
                noteFailure(mint, e.getStatusCode() + " " + e.getMessage());
            }
        } catch (Exception e) {
            noteFailure(mint, e.toString());
        }
        return Optional.empty();
    }

    private boolean isRecentMiss(String mint) {
        return caches.misses().getIfPresent(mint) != null;
    }

    private void noteFailure(String mint, String reason) {
        if (failedLookups.add(mint)) {
            log.warn("Jupiter lookup failed for {}: {}", mint, reason);
        } else {
            log.debug("Jupiter lookup failed again for {}: {}", mint, reason);
        }
    }

    /**
     * Picks the search result whose id equals the mint, else the first result.
     * A hit without usdPrice still carries metadata; its price is null.
     */
    static Optional<SearchHit> parseSearch(String json, String mint, ObjectMapper mapper) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(json);
            if (!root.isArray() || root.isEmpty()) {
                return Optional.empty();
            }
            JsonNode chosen = root.get(0);
            for (JsonNode node : root) {
                if (mint.equals(node.path("id").asText())) {
                    chosen = node;
                    break;
                }
            }
            TokenMeta meta = new TokenMeta(
                    mint,
                    chosen.path("symbol").asText("UNKNOWN"),
                    chosen.path("name").asText("Unknown Token"),
                    chosen.path("decimals").asInt(0));
            JsonNode usd = chosen.path("usdPrice");
            BigDecimal price = usd.isNumber() && usd.decimalValue().signum() > 0
                    ? usd.decimalValue().setScale(SCALE, ROUNDING)
                    : null;
            return Optional.of(new SearchHit(meta, price));
        } catch (Exception e) {
            log.debug("Unparseable Jupiter search response for {}", mint, e);
            return Optional.empty();
        }
    }

    record SearchHit(TokenMeta meta, BigDecimal usdPrice) {
    }

    /**
     * Caffeine caches backing the pricer: fresh prices (short TTL), last-known prices, token metadata,
     * and mints recently found without a price (short TTL).
     */
    public record Caches(Cache<String, BigDecimal> freshPrices,
                         Cache<String, BigDecimal> stalePrices,
                         Cache<String, TokenMeta> meta,
                         Cache<String, Boolean> misses) {
    }
}
