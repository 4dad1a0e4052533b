package com.butlergroceries.retailer.service;

import java.util.List;

/** The recipe has ingredients but none of them matched a retailer product. */
public class NoMatchesException extends RuntimeException {
    private final long recipeId;
    private final List<String> skipped;

    public NoMatchesException(long recipeId, List<String> skipped) {
        super("No products matched for recipe " + recipeId + "; nothing to add");
        this.recipeId = recipeId;
        this.skipped = List.copyOf(skipped);
    }

    public long getRecipeId() {
        return recipeId;
    }

    /** Every ingredient name of the recipe, in recipe order. */
    public List<String> getSkipped() {
        return skipped;
    }
}
