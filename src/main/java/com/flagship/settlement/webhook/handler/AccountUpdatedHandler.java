package com.flagship.settlement.webhook.handler;

import com.flagship.settlement.catalog.SellerAccountDirectory;
import com.flagship.settlement.webhook.ProviderEvent;
import com.flagship.settlement.webhook.WebhookEventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Keeps the charge and payout capability flags of seller accounts current.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountUpdatedHandler implements WebhookEventHandler {

    private final SellerAccountDirectory accountDirectory;

    @Override
    public Set<String> supportedEventTypes() {
        return Set.of("account.updated");
    }

    @Override
    public void handle(ProviderEvent event) {
        String accountId = event.getObjectId();
        boolean chargesEnabled = event.getObject().path("charges_enabled").asBoolean(false);
        boolean payoutsEnabled = event.getObject().path("payouts_enabled").asBoolean(false);

        if (accountDirectory.updateCapabilities(accountId, chargesEnabled, payoutsEnabled)) {
            log.info("Provider account {} updated: chargesEnabled={}, payoutsEnabled={}",
                accountId, chargesEnabled, payoutsEnabled);
        } else {
            log.info("Provider account {} is not linked to any seller, ignoring update", accountId);
        }
    }
}
