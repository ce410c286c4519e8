package com.flagship.general_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * General ledger service.
 *
 * Issues sequential document numbers, records double-entry vouchers and gates
 * their posting through an amount-banded approval workflow.
 */
@SpringBootApplication
public class GeneralLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeneralLedgerApplication.class, args);
    }
}
