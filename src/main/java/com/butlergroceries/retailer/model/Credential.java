package com.butlergroceries.retailer.model;

import java.time.Instant;

/**
 * Stored access/refresh token pair authorizing calls to the retailer gateway on behalf of one user.
 * The token is captured out-of-band; this service reads it but never refreshes it.
 */
public class Credential {
    private Long userId;
    private String accessToken;
    private String refreshToken;
    /** Preferred store for this user; null means the configured default store. */
    private String storeId;
    private Instant expiresAt;

    public Credential() {
    }

    public Credential(Long userId, String accessToken, String refreshToken, String storeId, Instant expiresAt) {
        this.userId = userId;
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.storeId = storeId;
        this.expiresAt = expiresAt;
    }

    public static Credential empty() {
        return new Credential(null, null, null, null, null);
    }

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    /** True only when an expiry is recorded and has passed. */
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }
    public String getAccessToken() { return accessToken; }
    public void setAccessToken(String accessToken) { this.accessToken = accessToken; }
    public String getRefreshToken() { return refreshToken; }
    public void setRefreshToken(String refreshToken) { this.refreshToken = refreshToken; }
    public String getStoreId() { return storeId; }
    public void setStoreId(String storeId) { this.storeId = storeId; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}
