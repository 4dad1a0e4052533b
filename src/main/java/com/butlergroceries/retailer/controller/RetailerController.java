package com.butlergroceries.retailer.controller;

import com.butlergroceries.retailer.dto.RetailerDtos.CredentialStatus;
import com.butlergroceries.retailer.dto.RetailerDtos.MatchReport;
import com.butlergroceries.retailer.dto.RetailerDtos.ProductSummary;
import com.butlergroceries.retailer.dto.RetailerDtos.SyncResult;
import com.butlergroceries.retailer.service.CredentialService;
import com.butlergroceries.retailer.service.RetailerClientProvider;
import com.butlergroceries.retailer.service.RetailerNotConfiguredException;
import com.butlergroceries.retailer.service.ShoppingListSyncService;
import com.butlergroceries.retailer.util.ProductFieldUtils;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/retailer")
@Tag(name = "retailer")
public class RetailerController {
    private final CredentialService credentialService;
    private final RetailerClientProvider clients;
    private final ShoppingListSyncService syncService;

    public RetailerController(CredentialService credentialService, RetailerClientProvider clients, ShoppingListSyncService syncService) {
        this.credentialService = credentialService;
        this.clients = clients;
        this.syncService = syncService;
    }

    @GetMapping("/status")
    @Operation(summary = "Whether a retailer token is available and still valid")
    public Mono<CredentialStatus> status(@RequestParam(value = "user_id", defaultValue = "1") long userId) {
        return credentialService.status(userId);
    }

    @PostMapping("/token")
    @Operation(summary = "Save a bearer token captured from the retailer app")
    public Mono<ResponseEntity<Map<String, Object>>> saveToken(
            @RequestParam(value = "user_id", defaultValue = "1") long userId,
            @RequestParam("auth_token") @NotBlank String authToken,
            @RequestParam(value = "refresh_token", defaultValue = "") String refreshToken) {
        return credentialService.saveToken(userId, authToken, refreshToken)
                .map(c -> ResponseEntity.ok(Map.<String, Object>of("status", "ok", "message", "Retailer token saved")));
    }

    @GetMapping("/match/{recipeId}")
    @Operation(summary = "Match every ingredient of a recipe to a retailer product")
    public Mono<MatchReport> match(@PathVariable("recipeId") long recipeId,
                                   @RequestParam(value = "user_id", defaultValue = "1") long userId) {
        return syncService.matchRecipe(recipeId, userId);
    }

    @PostMapping("/list/add/{recipeId}")
    @Operation(summary = "Match a recipe and add the matched products to the retailer shopping list")
    public Mono<SyncResult> addRecipeToList(@PathVariable("recipeId") long recipeId,
                                            @RequestParam(value = "user_id", defaultValue = "1") long userId) {
        return clients.forUser(userId).flatMap(client -> {
            if (!client.isConfigured()) {
                return Mono.error(new RetailerNotConfiguredException());
            }
            return syncService.syncRecipe(recipeId, client);
        });
    }

    @GetMapping("/search")
    @Operation(summary = "Free-text product search at the default store")
    public Mono<List<ProductSummary>> search(@RequestParam("q") @NotBlank String q,
                                             @RequestParam(value = "limit", defaultValue = "5") @Min(1) @Max(50) int limit) {
        return clients.defaultClient().searchProducts(q, null, limit)
                .map(products -> products.stream().map(this::toSummary).collect(Collectors.toList()));
    }

    @GetMapping("/list")
    @Operation(summary = "Current contents of the retailer shopping list")
    public Mono<List<JsonNode>> shoppingList(@RequestParam(value = "user_id", defaultValue = "1") long userId) {
        return clients.forUser(userId).flatMap(client -> client.getShoppingList());
    }

    private ProductSummary toSummary(JsonNode p) {
        JsonNode priceInfo = p.get("price");
        ProductSummary s = new ProductSummary();
        s.setUpc(ProductFieldUtils.text(p, "upc"));
        s.setDescription(ProductFieldUtils.text(p, "description", "name"));
        s.setBrand(ProductFieldUtils.text(p, "brand"));
        s.setSize(ProductFieldUtils.text(p, "size", "packageSize"));
        s.setPrice(ProductFieldUtils.effectivePrice(priceInfo));
        s.setOn_sale(ProductFieldUtils.onSale(priceInfo));
        return s;
    }
}
