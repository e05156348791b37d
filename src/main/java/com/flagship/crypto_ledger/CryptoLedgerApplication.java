package com.flagship.crypto_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CryptoLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CryptoLedgerApplication.class, args);
    }
}
