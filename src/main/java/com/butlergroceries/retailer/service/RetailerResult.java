package com.butlergroceries.retailer.service;

import java.util.Objects;

/**
 * Outcome of one read against the retailer gateway.
 *
 * <p>Reads never fail: infrastructure problems are reported through {@link Status} and the
 * value is the caller-supplied empty fallback, so batch operations can keep going.
 */
public final class RetailerResult<T> {
    public enum Status {
        OK,
        /** No access token; no request was sent. */
        NOT_CONFIGURED,
        /** Gateway answered 401. The token must be recaptured; it is never retried. */
        AUTH_EXPIRED,
        /** Network error, timeout or unexpected HTTP status. */
        TRANSPORT_FAILURE
    }

    private final Status status;
    private final T value;
    private final String detail;

    private RetailerResult(Status status, T value, String detail) {
        this.status = status;
        this.value = Objects.requireNonNull(value, "value");
        this.detail = detail;
    }

    public static <T> RetailerResult<T> ok(T value) {
        return new RetailerResult<>(Status.OK, value, null);
    }

    public static <T> RetailerResult<T> notConfigured(T empty) {
        return new RetailerResult<>(Status.NOT_CONFIGURED, empty, "not configured");
    }

    public static <T> RetailerResult<T> authExpired(T empty) {
        return new RetailerResult<>(Status.AUTH_EXPIRED, empty, "auth expired");
    }

    public static <T> RetailerResult<T> transportFailure(T empty, String detail) {
        return new RetailerResult<>(Status.TRANSPORT_FAILURE, empty, detail);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Status getStatus() {
        return status;
    }

    public T getValue() {
        return value;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "RetailerResult{" + status + (detail != null ? ", " + detail : "") + "}";
    }
}
