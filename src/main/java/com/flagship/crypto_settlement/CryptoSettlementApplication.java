package com.flagship.crypto_settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CryptoSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(CryptoSettlementApplication.class, args);
    }
}
