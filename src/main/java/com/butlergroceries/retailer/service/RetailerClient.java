package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.config.RetailerProperties;
import com.butlergroceries.retailer.dto.RetailerDtos.ListAddResult;
import com.butlergroceries.retailer.model.Credential;
import com.butlergroceries.retailer.model.ListItem;
import com.butlergroceries.retailer.model.ProductMatch;
import com.butlergroceries.retailer.util.ProductFieldUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Client for the retailer catalog search and shopping-list gateway, bound to one {@link Credential}.
 *
 * <p>Calls are issued one at a time and each carries its own timeout. None of the returned
 * publishers signal an error: reads degrade to empty results, and the bulk add records a
 * per-item error string instead of aborting.
 */
public class RetailerClient {
    private static final Logger log = LoggerFactory.getLogger(RetailerClient.class);
    private static final Set<Integer> ADD_SUCCESS_STATUSES = Set.of(200, 201, 204);

    private final WebClient webClient;
    private final RetailerProperties properties;
    private final Credential credential;

    public RetailerClient(WebClient webClient, RetailerProperties properties, Credential credential) {
        this.webClient = webClient;
        this.properties = properties;
        this.credential = credential == null ? Credential.empty() : credential;
    }

    /** Same transport and settings, different credential. */
    public RetailerClient withCredential(Credential other) {
        return new RetailerClient(webClient, properties, other);
    }

    public boolean isConfigured() {
        return credential.hasAccessToken();
    }

    public Credential getCredential() {
        return credential;
    }

    /** The credential's preferred store, else the configured default. */
    public String defaultStoreId() {
        String sid = credential.getStoreId();
        return (sid == null || sid.isBlank()) ? properties.getStoreId() : sid;
    }

    // ── Product search ──

    public Mono<RetailerResult<List<JsonNode>>> fetchProducts(String term, String storeId, int limit) {
        if (!isConfigured()) {
            log.warn("Retailer not configured; skipping product search for '{}'", term);
            return Mono.just(RetailerResult.notConfigured(List.of()));
        }
        if (term == null || term.isBlank()) {
            return Mono.just(RetailerResult.ok(List.of()));
        }
        String sid = (storeId == null || storeId.isBlank()) ? defaultStoreId() : storeId;
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("query", term);
        vars.put("storeId", sid);
        vars.put("limit", clampLimit(limit));
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(properties.getSearchPath())
                        .queryParam("query", "{query}")
                        .queryParam("storeId", "{storeId}")
                        .queryParam("offset", "0")
                        .queryParam("limit", "{limit}")
                        .build(vars))
                .headers(this::applyAuth)
                .exchangeToMono(resp -> readArray(resp, "products", "product search"))
                .timeout(properties.getRequestTimeout())
                .onErrorResume(e -> {
                    log.error("Retailer product search failed for '{}': {}", term, e.toString());
                    return Mono.just(RetailerResult.transportFailure(List.of(), describe(e)));
                });
    }

    public Mono<List<JsonNode>> searchProducts(String term, String storeId, int limit) {
        return fetchProducts(term, storeId, limit).map(RetailerResult::getValue);
    }

    /** Top search hit for an ingredient mapped onto a {@link ProductMatch}; empty when nothing was found. */
    public Mono<Optional<ProductMatch>> searchBestMatch(String ingredientName, String storeId) {
        return searchProducts(ingredientName, storeId, 1)
                .map(products -> products.isEmpty()
                        ? Optional.<ProductMatch>empty()
                        : Optional.of(toProductMatch(ingredientName, products.get(0))));
    }

    ProductMatch toProductMatch(String ingredientName, JsonNode p) {
        JsonNode priceInfo = p.get("price");
        ProductMatch m = new ProductMatch();
        m.setIngredient(ingredientName);
        m.setMatched(true);
        m.setUpc(ProductFieldUtils.text(p, "upc"));
        m.setDescription(ProductFieldUtils.text(p, "description", "name"));
        m.setBrand(ProductFieldUtils.text(p, "brand"));
        m.setSize(ProductFieldUtils.text(p, "size", "packageSize"));
        m.setPrice(ProductFieldUtils.effectivePrice(priceInfo));
        m.setPrice_regular(ProductFieldUtils.regularPrice(priceInfo));
        m.setOn_sale(ProductFieldUtils.onSale(priceInfo));
        m.setIn_stock(ProductFieldUtils.bool(p, "inStock", true));
        m.setAisle(ProductFieldUtils.aisle(p));
        m.setImage_url(ProductFieldUtils.text(p, "imageUrl", "image"));
        m.setSearch_url(ProductFieldUtils.searchUrl(properties.getSearchPageUrl(), ingredientName));
        return m;
    }

    // ── Shopping list ──

    public Mono<RetailerResult<List<JsonNode>>> fetchShoppingList() {
        if (!isConfigured()) {
            return Mono.just(RetailerResult.notConfigured(List.of()));
        }
        return webClient.get()
                .uri(properties.getListPath())
                .headers(this::applyAuth)
                .exchangeToMono(resp -> readArray(resp, "items", "shopping list read"))
                .timeout(properties.getRequestTimeout())
                .onErrorResume(e -> {
                    log.error("Failed to get retailer shopping list: {}", e.toString());
                    return Mono.just(RetailerResult.transportFailure(List.of(), describe(e)));
                });
    }

    public Mono<List<JsonNode>> getShoppingList() {
        return fetchShoppingList().map(RetailerResult::getValue);
    }

    /**
     * Adds each item with its own request, in order. A failed item is recorded as
     * {@code "<name>: <detail>"} and the remaining items are still sent.
     */
    public Mono<ListAddResult> addToShoppingList(List<ListItem> items) {
        if (!isConfigured()) {
            return Mono.just(ListAddResult.notConfigured());
        }
        List<ListItem> batch = items == null ? List.of() : items;
        return Flux.fromIterable(batch)
                .concatMap(this::addOne)
                .collectList()
                .map(outcomes -> {
                    List<String> errors = new ArrayList<>();
                    int added = 0;
                    for (Optional<String> o : outcomes) {
                        if (o.isPresent()) {
                            errors.add(o.get());
                        } else {
                            added++;
                        }
                    }
                    log.info("Added {}/{} items to retailer shopping list", added, batch.size());
                    ListAddResult r = new ListAddResult();
                    r.setSuccess(added > 0);
                    r.setAdded(added);
                    r.setTotal(batch.size());
                    r.setErrors(errors);
                    return r;
                });
    }

    /** Empty on success, otherwise the error entry for this item. */
    private Mono<Optional<String>> addOne(ListItem item) {
        String name = item.getName() == null ? "" : item.getName();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("itemName", name);
        body.put("quantity", item.getQuantity());
        return webClient.post()
                .uri(properties.getListAddPath())
                .headers(this::applyAuth)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(resp -> {
                    int code = resp.statusCode().value();
                    if (code == 401) {
                        log.error("Retailer auth token expired while adding '{}'", name);
                    }
                    Optional<String> outcome = ADD_SUCCESS_STATUSES.contains(code)
                            ? Optional.empty()
                            : Optional.of(name + ": " + code);
                    return resp.releaseBody().thenReturn(outcome);
                })
                .timeout(properties.getRequestTimeout())
                .onErrorResume(e -> {
                    log.warn("Adding '{}' to retailer list failed: {}", name, e.toString());
                    return Mono.just(Optional.of(name + ": " + describe(e)));
                });
    }

    // ── internals ──

    private Mono<RetailerResult<List<JsonNode>>> readArray(ClientResponse resp, String field, String operation) {
        int code = resp.statusCode().value();
        if (code == 401) {
            log.error("Retailer auth token expired during {}; token needs to be recaptured", operation);
            return resp.releaseBody().thenReturn(RetailerResult.authExpired(List.<JsonNode>of()));
        }
        if (!resp.statusCode().is2xxSuccessful()) {
            log.error("Retailer {} returned HTTP {}", operation, code);
            return resp.releaseBody().thenReturn(RetailerResult.transportFailure(List.<JsonNode>of(), "HTTP " + code));
        }
        return resp.bodyToMono(JsonNode.class)
                .map(json -> {
                    JsonNode arr = json.get(field);
                    List<JsonNode> out = new ArrayList<>();
                    if (arr != null && arr.isArray()) {
                        arr.forEach(out::add);
                    }
                    return RetailerResult.ok(out);
                })
                .defaultIfEmpty(RetailerResult.ok(List.of()));
    }

    private void applyAuth(HttpHeaders headers) {
        headers.setBearerAuth(credential.getAccessToken());
        headers.set(HttpHeaders.USER_AGENT, properties.getUserAgent());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    }

    private int clampLimit(int limit) {
        int max = Math.max(1, properties.getMaxSearchLimit());
        return Math.max(1, Math.min(limit, max));
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }
}
