package com.butlergroceries.retailer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the retailer catalog and shopping-list gateway.
 * Every field has a default so a bare environment still starts (unconfigured).
 */
@ConfigurationProperties(prefix = "retailer")
public class RetailerProperties {
    private String baseUrl = "https://gw.meijer.com";
    /**
     * Public storefront search page used to build informational deep links.
     */
    private String searchPageUrl = "https://www.meijer.com/shopping/search.html";
    private String searchPath = "/product/api/v1/search";
    private String listPath = "/loyalty/shoppinglist/GetList";
    private String listAddPath = "/loyalty/shoppinglist/AddListItem";

    /**
     * Bearer token captured out-of-band from the retailer's mobile app. Blank means "not configured".
     */
    private String authToken = "";
    private String refreshToken = "";
    private String storeId = "217";
    private String userAgent = "Meijer/8.71.0 (Android)";

    /** Ceiling applied to every single outbound call. */
    private Duration requestTimeout = Duration.ofSeconds(15);
    private int maxSearchLimit = 50;
    /** Lifetime assumed for a freshly captured token. */
    private Duration tokenTtl = Duration.ofHours(24);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getSearchPageUrl() {
        return searchPageUrl;
    }

    public void setSearchPageUrl(String searchPageUrl) {
        this.searchPageUrl = searchPageUrl;
    }

    public String getSearchPath() {
        return searchPath;
    }

    public void setSearchPath(String searchPath) {
        this.searchPath = searchPath;
    }

    public String getListPath() {
        return listPath;
    }

    public void setListPath(String listPath) {
        this.listPath = listPath;
    }

    public String getListAddPath() {
        return listAddPath;
    }

    public void setListAddPath(String listAddPath) {
        this.listAddPath = listAddPath;
    }

    public String getAuthToken() {
        return authToken;
    }

    public void setAuthToken(String authToken) {
        this.authToken = authToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public void setRefreshToken(String refreshToken) {
        this.refreshToken = refreshToken;
    }

    public String getStoreId() {
        return storeId;
    }

    public void setStoreId(String storeId) {
        this.storeId = storeId;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getMaxSearchLimit() {
        return maxSearchLimit;
    }

    public void setMaxSearchLimit(int maxSearchLimit) {
        this.maxSearchLimit = maxSearchLimit;
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public void setTokenTtl(Duration tokenTtl) {
        this.tokenTtl = tokenTtl;
    }
}
