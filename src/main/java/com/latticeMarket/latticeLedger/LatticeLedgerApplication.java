package com.latticeMarket.latticeLedger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LatticeLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LatticeLedgerApplication.class, args);
    }
}
