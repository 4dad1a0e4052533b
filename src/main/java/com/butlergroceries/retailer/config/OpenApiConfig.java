package com.butlergroceries.retailer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI(AppProperties appProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title(appProperties.getName() + " Retailer API")
                        .version("0.1.0")
                        .description("Matches recipe ingredients to retailer products and pushes them to the retailer shopping list."))
                .addTagsItem(new Tag().name("retailer").description("Product matching, search and shopping list sync"));
    }
}
