package com.walletpnl.ingestion.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.walletpnl.common.RetryPolicy;
import com.walletpnl.ingestion.config.SolanaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One WebSocket connection carrying a logsSubscribe (mentions = wallet) per watched wallet.
 * Every successful logsNotification is handed to the listener as (wallet, signature); failed transactions
 * are skipped. A dropped connection is re-opened after a fixed delay, up to the configured number of
 * consecutive attempts.
 */
@Slf4j
public class SolanaLogsSubscriber {

    /**
     * Receives signatures of confirmed transactions that mention a watched wallet.
     */
    @FunctionalInterface
    public interface SignatureListener {
        void onSignature(String walletAddress, String signature);
    }

    private final WebSocketClient webSocketClient;
    private final SolanaProperties properties;
    private final ObjectMapper objectMapper;
    private final RetryPolicy reconnectPolicy;

    private final Map<Long, String> walletByRequestId = new ConcurrentHashMap<>();
    private final Map<Long, String> walletBySubscription = new ConcurrentHashMap<>();
    private final AtomicLong requestIds = new AtomicLong();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile List<String> wallets = List.of();
    private volatile SignatureListener listener;
    private volatile Disposable connection;

    public SolanaLogsSubscriber(WebSocketClient webSocketClient, SolanaProperties properties,
                                ObjectMapper objectMapper, RetryPolicy reconnectPolicy) {
        this.webSocketClient = webSocketClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.reconnectPolicy = reconnectPolicy;
    }

    public void start(List<String> wallets, SignatureListener listener) {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        this.wallets = List.copyOf(wallets);
        this.listener = listener;
        reconnectAttempts.set(0);
        connect();
    }

    public void stop() {
        running.set(false);
        Disposable current = connection;
        if (current != null) {
            current.dispose();
        }
        log.info("Solana log subscription stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void connect() {
        URI uri = URI.create(properties.getWsUrl());
        log.info("Connecting to Solana WebSocket {}", uri);
        connection = webSocketClient.execute(uri, this::handleSession)
                .subscribe(
                        unused -> { },
                        error -> {
                            log.error("Solana WebSocket error: {}", error.getMessage());
                            onDisconnect();
                        },
                        () -> {
                            log.warn("Solana WebSocket closed");
                            onDisconnect();
                        });
    }

    private Mono<Void> handleSession(WebSocketSession session) {
        reconnectAttempts.set(0);
        walletByRequestId.clear();
        walletBySubscription.clear();
        log.info("Connected to Solana WebSocket, subscribing {} wallet(s)", wallets.size());
        Flux<WebSocketMessage> requests = Flux.fromIterable(wallets)
                .map(wallet -> session.textMessage(subscribeRequest(wallet)));
        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(this::handleMessage)
                .then();
        return session.send(requests).then(inbound);
    }

    /**
     * Builds the logsSubscribe request for one wallet and remembers which wallet the request id belongs to.
     */
    String subscribeRequest(String wallet) {
        long id = requestIds.incrementAndGet();
        walletByRequestId.put(id, wallet);
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", "logsSubscribe");
        ArrayNode params = request.putArray("params");
        params.addObject().putArray("mentions").add(wallet);
        params.addObject().put("commitment", properties.getCommitment());
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize logsSubscribe request", e);
        }
    }

    void handleMessage(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparseable WebSocket message: {}", e.getOriginalMessage());
            return;
        }
        if (root.has("id") && root.path("result").isNumber()) {
            String wallet = walletByRequestId.remove(root.path("id").asLong());
            if (wallet != null) {
                walletBySubscription.put(root.path("result").asLong(), wallet);
                log.info("Subscribed to logs for wallet {}", wallet);
            }
            return;
        }
        if (root.has("error")) {
            log.warn("Solana WebSocket request {} failed: {}", root.path("id").asText(), root.path("error"));
            return;
        }
        if (!"logsNotification".equals(root.path("method").asText())) {
            return;
        }
        JsonNode params = root.path("params");
        JsonNode value = params.path("result").path("value");
        if (!value.path("err").isNull() && !value.path("err").isMissingNode()) {
            return;
        }
        String signature = value.path("signature").asText(null);
        String wallet = walletBySubscription.get(params.path("subscription").asLong());
        if (signature == null || wallet == null) {
            log.debug("Notification without signature or known subscription: {}", payload);
            return;
        }
        SignatureListener current = listener;
        if (current != null) {
            current.onSignature(wallet, signature);
        }
    }

    private void onDisconnect() {
        if (!running.get()) {
            return;
        }
        int attempt = reconnectAttempts.incrementAndGet();
        if (!reconnectPolicy.hasAttemptsLeft(attempt - 1)) {
            log.error("Max reconnection attempts ({}) reached, Solana log subscription stopped",
                    reconnectPolicy.getMaxAttempts());
            running.set(false);
            return;
        }
        long delay = reconnectPolicy.delayMs(attempt - 1);
        log.info("Reconnecting to Solana WebSocket in {} ms (attempt {}/{})",
                delay, attempt, reconnectPolicy.getMaxAttempts());
        Mono.delay(Duration.ofMillis(delay)).subscribe(tick -> {
            if (running.get()) {
                connect();
            }
        });
    }

    int getReconnectAttempts() {
        return reconnectAttempts.get();
    }
}
