package com.butlergroceries.retailer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    /**
     * Shared transport for the retailer gateway. Auth headers are per-credential, so they are
     * attached by {@link com.butlergroceries.retailer.service.RetailerClient}, not here.
     * Built from Boot's builder so it decodes with the auto-configured {@code ObjectMapper}.
     */
    @Bean(name = "retailerWebClient")
    public WebClient retailerWebClient(WebClient.Builder builder, RetailerProperties retailerProperties) {
        return builder
                .baseUrl(retailerProperties.getBaseUrl())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")))
                .build();
    }
}
