package com.flagship.escrow_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EscrowLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EscrowLedgerApplication.class, args);
    }
}
