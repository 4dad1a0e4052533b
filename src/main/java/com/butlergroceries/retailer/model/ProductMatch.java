package com.butlergroceries.retailer.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of looking up one recipe ingredient in the retailer catalog.
 *
 * <p>When {@code matched} is false every retailer-sourced field is null and omitted from JSON.
 * {@code needed_quantity} and {@code needed_unit} come from the recipe and are always written.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProductMatch {
    private String ingredient;
    private boolean matched;

    private String upc;
    private String description;
    private String brand;
    private String size;
    /** Effective price: sale, else base, else generic */
    private Double price;
    private Double price_regular;
    private Boolean on_sale;
    private Boolean in_stock;
    /** Free-text shelf location, e.g. "Aisle 12 L" */
    private String aisle;
    private String image_url;
    /** Storefront deep link; informational only */
    private String search_url;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Double needed_quantity;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String needed_unit;

    public static ProductMatch unmatched(String ingredient) {
        ProductMatch m = new ProductMatch();
        m.setIngredient(ingredient);
        m.setMatched(false);
        return m;
    }

    public String getIngredient() { return ingredient; }
    public void setIngredient(String ingredient) { this.ingredient = ingredient; }
    public boolean isMatched() { return matched; }
    public void setMatched(boolean matched) { this.matched = matched; }
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
    public Double getPrice_regular() { return price_regular; }
    public void setPrice_regular(Double price_regular) { this.price_regular = price_regular; }
    public Boolean getOn_sale() { return on_sale; }
    public void setOn_sale(Boolean on_sale) { this.on_sale = on_sale; }
    public Boolean getIn_stock() { return in_stock; }
    public void setIn_stock(Boolean in_stock) { this.in_stock = in_stock; }
    public String getAisle() { return aisle; }
    public void setAisle(String aisle) { this.aisle = aisle; }
    public String getImage_url() { return image_url; }
    public void setImage_url(String image_url) { this.image_url = image_url; }
    public String getSearch_url() { return search_url; }
    public void setSearch_url(String search_url) { this.search_url = search_url; }
    public Double getNeeded_quantity() { return needed_quantity; }
    public void setNeeded_quantity(Double needed_quantity) { this.needed_quantity = needed_quantity; }
    public String getNeeded_unit() { return needed_unit; }
    public void setNeeded_unit(String needed_unit) { this.needed_unit = needed_unit; }
}
