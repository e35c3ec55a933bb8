package com.walletpnl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WalletPnlApplication {

    public static void main(String[] args) {
        SpringApplication.run(WalletPnlApplication.class, args);
    }
}
