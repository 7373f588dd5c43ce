package com.flagship.wealth_ledger;

import com.flagship.wealth_ledger.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LedgerProperties.class)
public class WealthLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WealthLedgerApplication.class, args);
    }
}
