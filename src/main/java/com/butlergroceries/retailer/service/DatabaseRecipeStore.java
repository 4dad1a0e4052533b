package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.model.RecipeIngredient;
import io.r2dbc.spi.Readable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Reads the {@code recipe_ingredients} and {@code ingredients} tables owned by the recipe service.
 * This service never writes to them.
 */
@Repository
public class DatabaseRecipeStore implements RecipeStore {
    private final DatabaseClient db;

    public DatabaseRecipeStore(DatabaseClient db) {
        this.db = db;
    }

    @Override
    public Flux<RecipeIngredient> findIngredients(long recipeId) {
        return db.sql("SELECT recipe_id, sort_order, quantity, unit, raw_text, ingredient_id "
                        + "FROM recipe_ingredients WHERE recipe_id = :recipeId ORDER BY sort_order")
                .bind("recipeId", recipeId)
                .map(DatabaseRecipeStore::toRecipeIngredient)
                .all();
    }

    @Override
    public Mono<Map<Long, String>> findIngredientNames(Collection<Long> ingredientIds) {
        if (ingredientIds == null || ingredientIds.isEmpty()) {
            return Mono.just(Map.of());
        }
        return db.sql("SELECT id, name FROM ingredients WHERE id IN (:ids)")
                .bind("ids", ingredientIds)
                .fetch().all()
                .collectMap(row -> ((Number) row.get("id")).longValue(),
                        row -> row.get("name") == null ? "" : String.valueOf(row.get("name")));
    }

    private static RecipeIngredient toRecipeIngredient(Readable row) {
        Object qty = row.get("quantity");
        Object sort = row.get("sort_order");
        Object ingredientId = row.get("ingredient_id");
        return new RecipeIngredient(
                row.get("recipe_id", Long.class),
                sort instanceof Number ? ((Number) sort).intValue() : 0,
                qty instanceof Number ? ((Number) qty).doubleValue() : null,
                row.get("unit", String.class),
                row.get("raw_text", String.class),
                ingredientId instanceof Number ? ((Number) ingredientId).longValue() : null);
    }
}
