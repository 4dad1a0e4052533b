package com.butlergroceries.retailer.dto;

import com.butlergroceries.retailer.model.ProductMatch;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

public class RetailerDtos {

    /** Result of pushing items to the remote list, one request per item. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ListAddResult {
        private boolean success;
        private int added;
        private int total;
        private List<String> errors = new ArrayList<>();
        private String error; // set only when nothing was attempted

        public static ListAddResult notConfigured() {
            ListAddResult r = new ListAddResult();
            r.setSuccess(false);
            r.setError("not configured");
            return r;
        }

        public boolean isSuccess() { return success; }
        public void setSuccess(boolean success) { this.success = success; }
        public int getAdded() { return added; }
        public void setAdded(int added) { this.added = added; }
        public int getTotal() { return total; }
        public void setTotal(int total) { this.total = total; }
        public List<String> getErrors() { return errors; }
        public void setErrors(List<String> errors) { this.errors = errors; }
        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
    }

    /** Per-ingredient matches for one recipe plus cost aggregates */
    public static class MatchReport {
        private Long recipe_id;
        private String store_id;
        private int matched;
        private int total;
        private double estimated_cost;
        private List<ProductMatch> items;

        public Long getRecipe_id() { return recipe_id; }
        public void setRecipe_id(Long recipe_id) { this.recipe_id = recipe_id; }
        public String getStore_id() { return store_id; }
        public void setStore_id(String store_id) { this.store_id = store_id; }
        public int getMatched() { return matched; }
        public void setMatched(int matched) { this.matched = matched; }
        public int getTotal() { return total; }
        public void setTotal(int total) { this.total = total; }
        public double getEstimated_cost() { return estimated_cost; }
        public void setEstimated_cost(double estimated_cost) { this.estimated_cost = estimated_cost; }
        public List<ProductMatch> getItems() { return items; }
        public void setItems(List<ProductMatch> items) { this.items = items; }
    }

    /** Summary of one recipe sync; produced once per call and never stored */
    public static class SyncResult {
        private boolean success;
        private int added;
        private List<String> skipped;
        private int total; // items attempted
        private List<String> errors;
        private double estimated_cost;
        private String message;
        private List<ProductMatch> items;

        public boolean isSuccess() { return success; }
        public void setSuccess(boolean success) { this.success = success; }
        public int getAdded() { return added; }
        public void setAdded(int added) { this.added = added; }
        public List<String> getSkipped() { return skipped; }
        public void setSkipped(List<String> skipped) { this.skipped = skipped; }
        public int getTotal() { return total; }
        public void setTotal(int total) { this.total = total; }
        public List<String> getErrors() { return errors; }
        public void setErrors(List<String> errors) { this.errors = errors; }
        public double getEstimated_cost() { return estimated_cost; }
        public void setEstimated_cost(double estimated_cost) { this.estimated_cost = estimated_cost; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
        public List<ProductMatch> getItems() { return items; }
        public void setItems(List<ProductMatch> items) { this.items = items; }
    }

    public static class CredentialStatus {
        private boolean connected;
        private boolean expired;
        private String store_id;

        public CredentialStatus() {
        }

        public CredentialStatus(boolean connected, boolean expired, String store_id) {
            this.connected = connected;
            this.expired = expired;
            this.store_id = store_id;
        }

        public boolean isConnected() { return connected; }
        public void setConnected(boolean connected) { this.connected = connected; }
        public boolean isExpired() { return expired; }
        public void setExpired(boolean expired) { this.expired = expired; }
        public String getStore_id() { return store_id; }
        public void setStore_id(String store_id) { this.store_id = store_id; }
    }

    /** Compact view of a catalog hit for the free-text search endpoint */
    public static class ProductSummary {
        private String upc;
        private String description;
        private String brand;
        private String size;
        private Double price;
        private boolean on_sale;

        public String getUpc() { return upc; }
        public void setUpc(String upc) { this.upc = upc; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getBrand() { return brand; }
        public void setBrand(String brand) { this.brand = brand; }
        public String getSize() { return size; }
        public void setSize(String size) { this.size = size; }
        public Double getPrice() { return price; }
        public void setPrice(Double price) { this.price = price; }
        public boolean isOn_sale() { return on_sale; }
        public void setOn_sale(boolean on_sale) { this.on_sale = on_sale; }
    }
}
