package com.butlergroceries.retailer.model;

/**
 * One parsed line of a recipe as held by the recipe store.
 * {@code ingredientId} links to the ingredient catalog and may be null for unrecognised lines.
 */
public class RecipeIngredient {
    private Long recipeId;
    private int sortOrder;
    private Double quantity;
    private String unit;
    private String rawText;
    private Long ingredientId;

    public RecipeIngredient() {
    }

    public RecipeIngredient(Long recipeId, int sortOrder, Double quantity, String unit, String rawText, Long ingredientId) {
        this.recipeId = recipeId;
        this.sortOrder = sortOrder;
        this.quantity = quantity;
        this.unit = unit;
        this.rawText = rawText;
        this.ingredientId = ingredientId;
    }

    public Long getRecipeId() { return recipeId; }
    public void setRecipeId(Long recipeId) { this.recipeId = recipeId; }
    public int getSortOrder() { return sortOrder; }
    public void setSortOrder(int sortOrder) { this.sortOrder = sortOrder; }
    public Double getQuantity() { return quantity; }
    public void setQuantity(Double quantity) { this.quantity = quantity; }
    public String getUnit() { return unit; }
    public void setUnit(String unit) { this.unit = unit; }
    public String getRawText() { return rawText; }
    public void setRawText(String rawText) { this.rawText = rawText; }
    public Long getIngredientId() { return ingredientId; }
    public void setIngredientId(Long ingredientId) { this.ingredientId = ingredientId; }
}
