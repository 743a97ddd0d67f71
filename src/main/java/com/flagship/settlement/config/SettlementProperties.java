package com.flagship.settlement.config;

import com.flagship.settlement.transaction.CurrencyCode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Settlement configuration bound from the {@code settlement.*} namespace.
 *
 * Groups:
 * - fees: processor pricing applied on top of the category platform fee
 * - provider: payment provider credentials, webhook secret and timeouts
 * - escrow: operators allowed to release or resolve any escrow
 * - payout: currency seller payouts are paid in
 * - reconciliation: stale pending transaction sweep
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    private final Fees fees = new Fees();
    private final Provider provider = new Provider();
    private final Escrow escrow = new Escrow();
    private final Payout payout = new Payout();
    private final Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Fees {
        /** Processor percentage in basis points (290 = 2.9%). */
        private int processorRateBps = 290;
        /** Processor fixed fee in minor units. */
        private long processorFixedFee = 30;
    }

    @Getter
    @Setter
    public static class Provider {
        private String apiKey;
        private String webhookSecret;
        private long webhookToleranceSeconds = 300;
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 10000;
        private String payoutStatementDescriptor = "MARKETPLACE PAYOUT";
    }

    @Getter
    @Setter
    public static class Escrow {
        private Set<UUID> adminIds = new HashSet<>();
    }

    @Getter
    @Setter
    public static class Payout {
        private CurrencyCode currency = CurrencyCode.USD;
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private Duration pendingTimeout = Duration.ofMinutes(30);
    }
}
