package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.config.RetailerProperties;
import com.butlergroceries.retailer.model.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Hands out {@link RetailerClient}s bound to the right credential: the user's stored token when
 * one exists, otherwise the token from configuration.
 */
@Service
public class RetailerClientProvider {
    private static final Logger log = LoggerFactory.getLogger(RetailerClientProvider.class);

    private final CredentialStore credentialStore;
    private final RetailerClient defaultClient;

    public RetailerClientProvider(@Qualifier("retailerWebClient") WebClient retailerWebClient,
                                  RetailerProperties properties,
                                  CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
        Credential configured = new Credential(null, properties.getAuthToken(), properties.getRefreshToken(), null, null);
        this.defaultClient = new RetailerClient(retailerWebClient, properties, configured);
        if (!defaultClient.isConfigured()) {
            log.info("No retailer token in configuration; calls without a stored user token will be skipped");
        }
    }

    public RetailerClient defaultClient() {
        return defaultClient;
    }

    public Mono<RetailerClient> forUser(long userId) {
        return credentialStore.findByUserId(userId)
                .filter(Credential::hasAccessToken)
                .map(c -> {
                    if (c.isExpired(Instant.now())) {
                        log.warn("Retailer token for user {} expired at {}; requests will likely be rejected", userId, c.getExpiresAt());
                    }
                    return defaultClient.withCredential(c);
                })
                .onErrorResume(e -> {
                    log.warn("credential read failure for user {}: {}", userId, e.toString());
                    return Mono.empty();
                })
                .defaultIfEmpty(defaultClient);
    }
}
