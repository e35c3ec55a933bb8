package com.walletpnl.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: ledger-executor runs per-wallet swap processing (one task at a time per wallet,
 * wallets in parallel).
 */
@Configuration
public class AsyncConfig {

    public static final String LEDGER_EXECUTOR = "ledger-executor";

    @Bean(name = LEDGER_EXECUTOR)
    public Executor ledgerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("ledger-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(10);
        e.initialize();
        return e;
    }
}
