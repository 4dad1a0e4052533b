package com.butlergroceries.retailer.service;

import com.butlergroceries.retailer.config.RetailerProperties;
import com.butlergroceries.retailer.dto.RetailerDtos.MatchReport;
import com.butlergroceries.retailer.dto.RetailerDtos.SyncResult;
import com.butlergroceries.retailer.model.Credential;
import com.butlergroceries.retailer.model.ListItem;
import com.butlergroceries.retailer.model.RecipeIngredient;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ShoppingListSyncServiceTest {

    private final InMemoryStores.Recipes recipes = new InMemoryStores.Recipes();
    private final ShoppingListSyncService service = new ShoppingListSyncService(
            recipes,
            new ProductMatcher(),
            new RetailerClientProvider(WebClient.create(), new RetailerProperties(), new InMemoryStores.Credentials()));

    @Test
    public void recipeWithoutIngredientsIsNotFound() {
        ScriptedRetailerClient client = new ScriptedRetailerClient();
        RecipeNotFoundException ex = assertThrows(RecipeNotFoundException.class,
                () -> service.matchRecipe(404L, client).block());
        assertEquals(404L, ex.getRecipeId());
        assertThrows(RecipeNotFoundException.class, () -> service.syncRecipe(404L, client).block());
        assertTrue(client.searched.isEmpty());
    }

    @Test
    public void estimatedCostSumsMatchedPricesOnly() {
        recipes.line(1L, 1.0, "lb", "chicken", null)
                .line(1L, 1.0, "tsp", "saffron", null)
                .line(1L, 2.0, "cup", "rice", null)
                .line(1L, 1.0, "", "parsley", null);
        ScriptedRetailerClient client = new ScriptedRetailerClient()
                .product("chicken", 1.99)
                .product("rice", 3.50)
                .product("parsley", null);

        MatchReport report = service.matchRecipe(1L, client).block();

        assertEquals(1L, report.getRecipe_id());
        assertEquals("217", report.getStore_id());
        assertEquals(3, report.getMatched());
        assertEquals(4, report.getTotal());
        assertEquals(5.49, report.getEstimated_cost(), "missing price counts as zero");
        assertEquals(2.0, report.getItems().get(2).getNeeded_quantity());
    }

    @Test
    public void syncPushesMatchedItemsWithFixedQuantityAndReportsSkipped() {
        recipes.line(2L, 2.0, "cup", "flour", null)
                .line(2L, 1.0, "pinch", "saffron", null)
                .line(2L, 3.0, "", "eggs", null);
        ScriptedRetailerClient client = new ScriptedRetailerClient()
                .product("flour", 2.99)
                .product("eggs", 3.49);

        SyncResult result = service.syncRecipe(2L, client).block();

        assertTrue(result.isSuccess());
        assertEquals(2, result.getAdded());
        assertEquals(2, result.getTotal());
        assertEquals(List.of("saffron"), result.getSkipped());
        assertEquals(6.48, result.getEstimated_cost());
        assertEquals("Added 2 items to retailer list", result.getMessage());
        assertEquals(3, result.getItems().size());
        assertTrue(result.getErrors().isEmpty());

        assertEquals(List.of("Store flour", "Store eggs"),
                client.pushed.stream().map(ListItem::getName).collect(Collectors.toList()));
        assertTrue(client.pushed.stream().allMatch(i -> i.getQuantity() == 1));
    }

    @Test
    public void matchedItemWithoutDescriptionIsPushedUnderIngredientName() {
        recipes.line(3L, 1.0, "bunch", "kale", null)
                .line(3L, 1.0, "", "truffle", null);
        ScriptedRetailerClient client = new ScriptedRetailerClient().product("kale", 1.0);
        client.undescribed.add("kale");

        SyncResult result = service.syncRecipe(3L, client).block();

        assertEquals(1, client.pushed.size());
        assertEquals("kale", client.pushed.get(0).getName());
        assertEquals(List.of("truffle"), result.getSkipped());
    }

    @Test
    public void nothingMatchedIsDistinctFromNotFoundAndKeepsOrder() {
        recipes.line(4L, 1.0, "", "dragonfruit", null)
                .line(4L, 1.0, "", "yuzu", null)
                .line(4L, 1.0, "", "dragonfruit", null);
        ScriptedRetailerClient client = new ScriptedRetailerClient();

        NoMatchesException ex = assertThrows(NoMatchesException.class, () -> service.syncRecipe(4L, client).block());

        assertEquals(List.of("dragonfruit", "yuzu", "dragonfruit"), ex.getSkipped());
        assertTrue(client.pushed.isEmpty());
    }

    @Test
    public void linkedNameIsPreferredAndEmptyLinkedNameFallsBackToRawText() {
        recipes.ingredient(10L, "all-purpose flour")
                .ingredient(11L, "")
                .line(5L, 2.0, "cup", "2 cups AP flour", 10L)
                .line(5L, 2.0, "cup", "2 cups flour", 11L)
                .line(5L, 1.0, "", "1 onion", null)
                .line(5L, 1.0, "", "1 mystery", 99L);
        ScriptedRetailerClient client = new ScriptedRetailerClient();

        service.matchRecipe(5L, client).block();

        assertEquals(List.of("all-purpose flour", "2 cups flour", "1 onion", "1 mystery"), client.searched);
    }

    @Test
    public void resolveDisplayNameHandlesMissingText() {
        RecipeIngredient ri = new RecipeIngredient(1L, 0, null, null, null, 11L);
        assertEquals("", ShoppingListSyncService.resolveDisplayName(ri, Map.of(11L, " ")));
        RecipeIngredient linkedBlank = new RecipeIngredient(1L, 0, 2.0, "cups", "2 cups flour", 11L);
        assertEquals("2 cups flour", ShoppingListSyncService.resolveDisplayName(linkedBlank, Map.of(11L, "")));
    }

    private static RetailerClient gatewayClient(StubExchange stub) {
        return new RetailerClient(stub.webClient(), new RetailerProperties(), new Credential(1L, "tok", null, null, null));
    }

    /** Every search finds "Store &lt;query&gt;"; list adds answer with the statuses given, in order. */
    private static StubExchange catalogWithAddStatuses(int... addStatuses) {
        int[] adds = {0};
        return new StubExchange((req, i) -> {
            if (req.method() == HttpMethod.GET) {
                String query = req.url().getQuery().replaceAll("^.*query=([^&]*).*$", "$1");
                return StubExchange.json(200, "{\"products\": [{\"upc\": \"u" + i + "\", \"description\": \"Store " + query
                        + "\", \"price\": {\"basePrice\": 2.00}}]}");
            }
            return StubExchange.json(addStatuses[adds[0]++], "{}");
        });
    }

    @Test
    public void syncReportsFailedAddsAlongsideSuccessfulOnes() {
        recipes.line(6L, 2.0, "cup", "flour", null)
                .line(6L, 3.0, "", "eggs", null);
        StubExchange stub = catalogWithAddStatuses(201, 500);

        SyncResult result = service.syncRecipe(6L, gatewayClient(stub)).block();

        assertTrue(result.isSuccess(), "one item added is still a success");
        assertEquals(1, result.getAdded());
        assertEquals(2, result.getTotal());
        assertEquals(List.of("Store eggs: 500"), result.getErrors());
        assertTrue(result.getSkipped().isEmpty());
        assertEquals(4.0, result.getEstimated_cost());
        assertEquals("Added 1 items to retailer list", result.getMessage());
        assertEquals(4, stub.requests.size(), "two searches then one add per item");
    }

    @Test
    public void syncWithEveryAddRejectedIsNotSuccess() {
        recipes.line(7L, 1.0, "", "milk", null);
        ScriptedRetailerClient client = new ScriptedRetailerClient().product("milk", 1.0);
        client.failingAdds.add("Store milk");

        SyncResult result = service.syncRecipe(7L, client).block();

        assertFalse(result.isSuccess());
        assertEquals(0, result.getAdded());
        assertEquals(List.of("Store milk: 500"), result.getErrors());
    }

    @Test
    public void notConfiguredAddIsReportedAsError() {
        recipes.line(8L, 1.0, "", "milk", null);
        ScriptedRetailerClient client = new ScriptedRetailerClient().product("milk", 1.0);
        client.unconfiguredOnAdd = true;

        SyncResult result = service.syncRecipe(8L, client).block();

        assertFalse(result.isSuccess());
        assertEquals(List.of("not configured"), result.getErrors());
        assertEquals(1, result.getTotal());
    }

    @Test
    public void malformedPriceFromGatewayDoesNotBreakTheMatch() {
        recipes.line(9L, 1.0, "", "flour", null)
                .line(9L, 1.0, "", "sugar", null);
        StubExchange stub = new StubExchange((req, i) -> i == 0
                ? StubExchange.json(200, "{\"products\": [{\"upc\": \"1\", \"description\": \"Flour\", "
                        + "\"price\": {\"salePrice\": \"NaN\", \"basePrice\": \"1e400\"}}]}")
                : StubExchange.json(200, "{\"products\": [{\"upc\": \"2\", \"description\": \"Sugar\", "
                        + "\"price\": {\"basePrice\": 1.50}}]}"));

        MatchReport report = service.matchRecipe(9L, gatewayClient(stub)).block();

        assertEquals(2, report.getMatched());
        assertNull(report.getItems().get(0).getPrice());
        assertFalse(report.getItems().get(0).getOn_sale());
        assertEquals(1.5, report.getEstimated_cost());
    }
}
