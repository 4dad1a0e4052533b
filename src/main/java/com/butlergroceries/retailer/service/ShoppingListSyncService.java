package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.dto.RetailerDtos.ListAddResult;
import com.butlergroceries.retailer.dto.RetailerDtos.MatchReport;
import com.butlergroceries.retailer.dto.RetailerDtos.SyncResult;
import com.butlergroceries.retailer.model.IngredientNeed;
import com.butlergroceries.retailer.model.ListItem;
import com.butlergroceries.retailer.model.ProductMatch;
import com.butlergroceries.retailer.model.RecipeIngredient;
import com.butlergroceries.retailer.util.ProductFieldUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matches a recipe's ingredients to retailer products and pushes the matched ones to the
 * retailer shopping list.
 *
 * <p>Two conditions reach the caller as errors: {@link RecipeNotFoundException} when the recipe
 * has no ingredient lines, and {@link NoMatchesException} when it has lines but none matched.
 * Everything else is reported inside the result.
 */
@Service
public class ShoppingListSyncService {
    private static final Logger log = LoggerFactory.getLogger(ShoppingListSyncService.class);

    /** List items are always added one at a time; recipe amounts are not converted to package counts. */
    static final int LIST_ITEM_QUANTITY = 1;

    private final RecipeStore recipeStore;
    private final ProductMatcher matcher;
    private final RetailerClientProvider clients;

    public ShoppingListSyncService(RecipeStore recipeStore, ProductMatcher matcher, RetailerClientProvider clients) {
        this.recipeStore = recipeStore;
        this.matcher = matcher;
        this.clients = clients;
    }

    public Mono<MatchReport> matchRecipe(long recipeId, long userId) {
        return clients.forUser(userId).flatMap(client -> matchRecipe(recipeId, client));
    }

    public Mono<MatchReport> matchRecipe(long recipeId, RetailerClient client) {
        String storeId = client.defaultStoreId();
        return resolveNeeds(recipeId)
                .flatMap(needs -> matcher.match(client, needs, storeId))
                .map(matches -> {
                    int matched = 0;
                    double total = 0d;
                    for (ProductMatch m : matches) {
                        if (m.isMatched()) {
                            matched++;
                            total += m.getPrice() == null ? 0d : m.getPrice();
                        }
                    }
                    MatchReport report = new MatchReport();
                    report.setRecipe_id(recipeId);
                    report.setStore_id(storeId);
                    report.setMatched(matched);
                    report.setTotal(matches.size());
                    report.setEstimated_cost(ProductFieldUtils.roundCurrency(total));
                    report.setItems(matches);
                    log.info("Recipe {}: matched {}/{} ingredients at store {}", recipeId, matched, matches.size(), storeId);
                    return report;
                });
    }

    public Mono<SyncResult> syncRecipe(long recipeId, long userId) {
        return clients.forUser(userId).flatMap(client -> syncRecipe(recipeId, client));
    }

    public Mono<SyncResult> syncRecipe(long recipeId, RetailerClient client) {
        return matchRecipe(recipeId, client).flatMap(report -> {
            List<ListItem> listItems = new ArrayList<>();
            List<String> skipped = new ArrayList<>();
            for (ProductMatch m : report.getItems()) {
                if (m.isMatched()) {
                    String name = (m.getDescription() == null || m.getDescription().isEmpty())
                            ? m.getIngredient()
                            : m.getDescription();
                    listItems.add(new ListItem(name, LIST_ITEM_QUANTITY));
                } else {
                    skipped.add(m.getIngredient());
                }
            }
            if (listItems.isEmpty()) {
                return Mono.error(new NoMatchesException(recipeId, skipped));
            }
            return client.addToShoppingList(listItems)
                    .map(added -> toSyncResult(added, listItems.size(), skipped, report));
        });
    }

    private static SyncResult toSyncResult(ListAddResult added, int attempted, List<String> skipped, MatchReport report) {
        List<String> errors = new ArrayList<>(added.getErrors() == null ? List.of() : added.getErrors());
        if (added.getError() != null) {
            errors.add(added.getError());
        }
        SyncResult result = new SyncResult();
        result.setSuccess(added.isSuccess());
        result.setAdded(added.getAdded());
        result.setSkipped(skipped);
        result.setTotal(attempted);
        result.setErrors(errors);
        result.setEstimated_cost(report.getEstimated_cost());
        result.setMessage("Added " + added.getAdded() + " items to retailer list");
        result.setItems(report.getItems());
        return result;
    }

    Mono<List<IngredientNeed>> resolveNeeds(long recipeId) {
        return recipeStore.findIngredients(recipeId)
                .collectList()
                .flatMap(lines -> {
                    if (lines.isEmpty()) {
                        return Mono.error(new RecipeNotFoundException(recipeId));
                    }
                    Set<Long> ids = new LinkedHashSet<>();
                    for (RecipeIngredient ri : lines) {
                        if (ri.getIngredientId() != null) ids.add(ri.getIngredientId());
                    }
                    Mono<Map<Long, String>> names = ids.isEmpty()
                            ? Mono.just(Map.of())
                            : recipeStore.findIngredientNames(ids).defaultIfEmpty(Map.of());
                    return names.map(nameById -> {
                        List<IngredientNeed> needs = new ArrayList<>(lines.size());
                        for (RecipeIngredient ri : lines) {
                            needs.add(new IngredientNeed(resolveDisplayName(ri, nameById), ri.getQuantity(), ri.getUnit()));
                        }
                        return needs;
                    });
                });
    }

    /**
     * Linked catalog name when it is non-blank, otherwise the raw recipe text, otherwise "".
     * A link whose name is empty still falls back to the raw text.
     */
    static String resolveDisplayName(RecipeIngredient ri, Map<Long, String> nameById) {
        String linked = ri.getIngredientId() == null ? null : nameById.get(ri.getIngredientId());
        if (linked != null && !linked.isBlank()) {
            return linked;
        }
        String raw = ri.getRawText();
        return raw == null ? "" : raw;
    }
}
