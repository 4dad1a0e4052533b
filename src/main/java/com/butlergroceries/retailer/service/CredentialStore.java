package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.model.Credential;
import reactor.core.publisher.Mono;

/** Persistence seam for captured retailer tokens, keyed by user. */
public interface CredentialStore {
    /** Empty when the user has never saved a token. */
    Mono<Credential> findByUserId(long userId);

    Mono<Credential> upsert(Credential credential);
}
