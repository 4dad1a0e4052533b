package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.config.RetailerProperties;
import com.butlergroceries.retailer.model.Credential;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class RetailerClientProviderTest {

    private final InMemoryStores.Credentials store = new InMemoryStores.Credentials();

    private RetailerClientProvider provider(String configuredToken) {
        RetailerProperties props = new RetailerProperties();
        props.setAuthToken(configuredToken);
        return new RetailerClientProvider(WebClient.create(), props, store);
    }

    @Test
    public void storedCredentialWins() {
        store.byUser.put(3L, new Credential(3L, "user-tok", null, "12", null));
        RetailerClient client = provider("env-tok").forUser(3L).block();

        assertEquals("user-tok", client.getCredential().getAccessToken());
        assertEquals("12", client.defaultStoreId());
    }

    @Test
    public void expiredCredentialIsStillUsed() {
        store.byUser.put(3L, new Credential(3L, "old-tok", null, null, Instant.now().minusSeconds(3600)));
        assertEquals("old-tok", provider("").forUser(3L).block().getCredential().getAccessToken());
    }

    @Test
    public void missingOrBlankStoredCredentialFallsBackToConfiguration() {
        RetailerClientProvider provider = provider("env-tok");
        assertSame(provider.defaultClient(), provider.forUser(1L).block());

        store.byUser.put(1L, new Credential(1L, "", null, null, null));
        assertSame(provider.defaultClient(), provider.forUser(1L).block());
    }

    @Test
    public void storeFailureFallsBackToConfiguration() {
        store.failure = new IllegalStateException("db down");
        RetailerClientProvider provider = provider("");
        RetailerClient client = provider.forUser(1L).block();

        assertSame(provider.defaultClient(), client);
        assertFalse(client.isConfigured());
    }
}
