package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.model.IngredientNeed;
import com.butlergroceries.retailer.model.ProductMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Looks up one retailer product per ingredient.
 *
 * <p>Searches run one after another in input order and the result list is parallel to the
 * input: {@code result[i]} always describes {@code needs[i]}, carries its needed quantity and
 * unit, and is an unmatched record when the search found nothing or failed. Repeated names are
 * searched again rather than de-duplicated.
 */
@Service
public class ProductMatcher {
    private static final Logger log = LoggerFactory.getLogger(ProductMatcher.class);

    public Mono<List<ProductMatch>> match(RetailerClient client, List<IngredientNeed> needs, String storeId) {
        if (needs == null || needs.isEmpty()) {
            return Mono.just(List.of());
        }
        return Flux.fromIterable(needs)
                .concatMap(need -> client.searchBestMatch(need.getName(), storeId)
                        .onErrorResume(e -> {
                            log.warn("match failed for '{}': {}", need.getName(), e.toString());
                            return Mono.just(Optional.<ProductMatch>empty());
                        })
                        .defaultIfEmpty(Optional.<ProductMatch>empty())
                        .map(found -> withNeed(found.orElseGet(() -> ProductMatch.unmatched(need.getName())), need)))
                .collectList();
    }

    private static ProductMatch withNeed(ProductMatch match, IngredientNeed need) {
        match.setNeeded_quantity(need.getQuantity());
        match.setNeeded_unit(need.getUnit());
        return match;
    }
}
