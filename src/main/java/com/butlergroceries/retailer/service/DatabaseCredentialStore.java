package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.model.Credential;
import io.r2dbc.spi.Readable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@Repository
public class DatabaseCredentialStore implements CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(DatabaseCredentialStore.class);
    private final DatabaseClient db;

    public DatabaseCredentialStore(DatabaseClient db) {
        this.db = db;
        ensureSchema().subscribe(
                v -> { },
                e -> log.warn("retailer_tokens schema check failed: {}", e.toString()));
    }

    private Mono<Void> ensureSchema() {
        String ddl = "CREATE TABLE IF NOT EXISTS retailer_tokens ("
                + "user_id BIGINT PRIMARY KEY, "
                + "access_token TEXT NOT NULL, "
                + "refresh_token TEXT, "
                + "store_id TEXT, "
                + "expires_at TIMESTAMPTZ)";
        return db.sql(ddl).fetch().rowsUpdated().then();
    }

    @Override
    public Mono<Credential> findByUserId(long userId) {
        return db.sql("SELECT user_id, access_token, refresh_token, store_id, expires_at FROM retailer_tokens WHERE user_id = :userId")
                .bind("userId", userId)
                .map(DatabaseCredentialStore::toCredential)
                .one();
    }

    @Override
    public Mono<Credential> upsert(Credential credential) {
        DatabaseClient.GenericExecuteSpec spec = db.sql(
                "INSERT INTO retailer_tokens(user_id, access_token, refresh_token, store_id, expires_at) "
                        + "VALUES(:userId, :accessToken, :refreshToken, :storeId, :expiresAt) "
                        + "ON CONFLICT (user_id) DO UPDATE SET access_token = EXCLUDED.access_token, "
                        + "refresh_token = EXCLUDED.refresh_token, expires_at = EXCLUDED.expires_at, "
                        + "store_id = COALESCE(EXCLUDED.store_id, retailer_tokens.store_id)")
                .bind("userId", credential.getUserId())
                .bind("accessToken", credential.getAccessToken());
        spec = bindNullable(spec, "refreshToken", credential.getRefreshToken(), String.class);
        spec = bindNullable(spec, "storeId", credential.getStoreId(), String.class);
        spec = bindNullable(spec, "expiresAt",
                credential.getExpiresAt() == null ? null : OffsetDateTime.ofInstant(credential.getExpiresAt(), ZoneOffset.UTC),
                OffsetDateTime.class);
        return spec.fetch().rowsUpdated().thenReturn(credential);
    }

    private static <T> DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec, String name, T value, Class<T> type) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }

    private static Credential toCredential(Readable row) {
        OffsetDateTime expires = row.get("expires_at", OffsetDateTime.class);
        return new Credential(
                row.get("user_id", Long.class),
                row.get("access_token", String.class),
                row.get("refresh_token", String.class),
                row.get("store_id", String.class),
                expires == null ? null : expires.toInstant());
    }
}
