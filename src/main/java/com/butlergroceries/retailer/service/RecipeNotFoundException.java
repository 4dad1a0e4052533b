package com.butlergroceries.retailer.service;

/** The recipe is unknown or has no ingredient lines. */
public class RecipeNotFoundException extends RuntimeException {
    private final long recipeId;

    public RecipeNotFoundException(long recipeId) {
        super("Recipe " + recipeId + " not found or has no ingredients");
        this.recipeId = recipeId;
    }

    public long getRecipeId() {
        return recipeId;
    }
}
