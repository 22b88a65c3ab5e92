package com.flagship.property_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PropertyLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropertyLedgerApplication.class, args);
    }
}
