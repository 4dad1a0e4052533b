package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.config.RetailerProperties;
import com.butlergroceries.retailer.dto.RetailerDtos.CredentialStatus;
import com.butlergroceries.retailer.model.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Token capture and connection status. Tokens are only recorded and checked for expiry here;
 * renewing them is left to whoever captures them.
 */
@Service
public class CredentialService {
    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final CredentialStore store;
    private final RetailerProperties properties;
    private final Clock clock;

    public CredentialService(CredentialStore store, RetailerProperties properties) {
        this(store, properties, Clock.systemUTC());
    }

    CredentialService(CredentialStore store, RetailerProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    public Mono<Credential> saveToken(long userId, String accessToken, String refreshToken) {
        if (accessToken == null || accessToken.isBlank()) {
            return Mono.error(new IllegalArgumentException("auth_token must not be blank"));
        }
        Instant expiresAt = clock.instant().plus(properties.getTokenTtl());
        Credential credential = new Credential(userId, accessToken.trim(),
                refreshToken == null ? "" : refreshToken, null, expiresAt);
        return store.upsert(credential)
                .doOnSuccess(c -> log.info("Retailer token saved for user {}", userId));
    }

    public Mono<CredentialStatus> status(long userId) {
        Instant now = clock.instant();
        return store.findByUserId(userId)
                .map(c -> new CredentialStatus(
                        c.hasAccessToken(),
                        c.isExpired(now),
                        (c.getStoreId() == null || c.getStoreId().isBlank()) ? properties.getStoreId() : c.getStoreId()))
                .switchIfEmpty(Mono.fromSupplier(() -> new CredentialStatus(
                        properties.getAuthToken() != null && !properties.getAuthToken().isBlank(),
                        false,
                        properties.getStoreId())));
    }
}
