package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.model.RecipeIngredient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/** Read-only view of the recipe database needed for matching. */
public interface RecipeStore {
    /** Ingredient lines of a recipe in display order; empty for unknown recipes. */
    Flux<RecipeIngredient> findIngredients(long recipeId);

    /** Catalog ingredient names by id. Ids that do not exist are absent from the map. */
    Mono<Map<Long, String>> findIngredientNames(Collection<Long> ingredientIds);
}
