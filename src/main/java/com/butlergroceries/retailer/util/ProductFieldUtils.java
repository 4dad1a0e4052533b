package com.butlergroceries.retailer.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Helpers for reading the loosely-typed product objects returned by the retailer search API.
 *
 * <p>The gateway is inconsistent about field names ({@code description} vs {@code name},
 * {@code size} vs {@code packageSize}) and sends prices as numbers or strings, sometimes as 0
 * when a price kind does not apply. A zero or unparseable price is treated as absent.
 */
public final class ProductFieldUtils {
    private ProductFieldUtils() {}

    /** First of the given keys present with a non-null value, as text; "" when none is. */
    public static String text(JsonNode node, String... keys) {
        if (node == null) return "";
        for (String key : keys) {
            JsonNode v = node.get(key);
            if (v != null && !v.isNull()) {
                return v.asText();
            }
        }
        return "";
    }

    /** Boolean or "true"/"false" text; anything else gives {@code defaultValue}. */
    public static boolean bool(JsonNode node, String key, boolean defaultValue) {
        JsonNode v = node == null ? null : node.get(key);
        if (v == null || v.isNull()) return defaultValue;
        if (v.isBoolean()) return v.booleanValue();
        String s = v.asText().trim();
        if ("true".equalsIgnoreCase(s)) return true;
        if ("false".equalsIgnoreCase(s)) return false;
        return defaultValue;
    }

    /** Price value of the field, or null if absent, zero, not a number or not finite. */
    public static Double price(JsonNode priceInfo, String key) {
        JsonNode v = priceInfo == null ? null : priceInfo.get(key);
        if (v == null || v.isNull()) return null;
        double d;
        if (v.isNumber()) {
            d = v.doubleValue();
        } else {
            String s = v.asText().trim();
            if (s.isEmpty()) return null;
            try {
                d = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return (d == 0d || !Double.isFinite(d)) ? null : d;
    }

    /** Effective shelf price: sale price, else base price, else the generic price field. */
    public static Double effectivePrice(JsonNode priceInfo) {
        Double sale = price(priceInfo, "salePrice");
        if (sale != null) return sale;
        return regularPrice(priceInfo);
    }

    public static Double regularPrice(JsonNode priceInfo) {
        Double base = price(priceInfo, "basePrice");
        return base != null ? base : price(priceInfo, "price");
    }

    public static boolean onSale(JsonNode priceInfo) {
        return price(priceInfo, "salePrice") != null;
    }

    /**
     * Shelf location as a single string. Structured {@code {aisle, side}} objects become
     * "Aisle &lt;n&gt; &lt;side&gt;"; free-text values are returned trimmed.
     */
    public static String aisle(JsonNode product) {
        if (product == null) return "";
        JsonNode info = product.get("aisleLocation");
        if (isBlank(info)) {
            info = product.get("aisle");
        }
        if (isBlank(info)) return "";
        if (info.isObject()) {
            String number = text(info, "aisle").trim();
            String side = text(info, "side").trim();
            if (number.isEmpty() && side.isEmpty()) return "";
            return ("Aisle " + number + " " + side).replaceAll("\\s+", " ").trim();
        }
        if (info.isValueNode()) {
            return info.asText().trim();
        }
        return "";
    }

    /** Storefront search link for a term, e.g. {@code ...?s=chicken+breast}. */
    public static String searchUrl(String searchPageUrl, String term) {
        return searchPageUrl + "?s=" + URLEncoder.encode(term == null ? "" : term, StandardCharsets.UTF_8);
    }

    public static double roundCurrency(double amount) {
        return BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static boolean isBlank(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return true;
        if (v.isTextual()) return v.asText().isBlank();
        if (v.isContainerNode()) return v.size() == 0;
        return false;
    }
}
