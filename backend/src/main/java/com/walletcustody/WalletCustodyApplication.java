package com.walletcustody;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WalletCustodyApplication {

    public static void main(String[] args) {
        SpringApplication.run(WalletCustodyApplication.class, args);
    }
}
