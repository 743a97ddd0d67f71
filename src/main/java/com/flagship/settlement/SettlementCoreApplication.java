package com.flagship.settlement;

import com.flagship.settlement.config.SettlementProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the settlement core service.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(SettlementProperties.class)
public class SettlementCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(SettlementCoreApplication.class, args);
    }
}
