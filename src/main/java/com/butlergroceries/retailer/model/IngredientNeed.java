package com.butlergroceries.retailer.model;

/** Search term plus the amount the recipe calls for. */
public class IngredientNeed {
    private final String name;
    private final Double quantity;
    private final String unit;

    public IngredientNeed(String name, Double quantity, String unit) {
        this.name = name == null ? "" : name;
        this.quantity = quantity;
        this.unit = unit == null ? "" : unit;
    }

    public String getName() { return name; }
    public Double getQuantity() { return quantity; }
    public String getUnit() { return unit; }
}
