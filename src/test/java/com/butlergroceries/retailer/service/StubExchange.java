package com.butlergroceries.retailer.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * In-process stand-in for the retailer gateway. Records every request and answers with whatever
 * the responder returns for (request, zero-based call index).
 */
class StubExchange implements ExchangeFunction {
    final List<ClientRequest> requests = new ArrayList<>();
    private final BiFunction<ClientRequest, Integer, Mono<ClientResponse>> responder;

    StubExchange(BiFunction<ClientRequest, Integer, Mono<ClientResponse>> responder) {
        this.responder = responder;
    }

    static StubExchange always(int status, String body) {
        return new StubExchange((req, i) -> json(status, body));
    }

    static Mono<ClientResponse> json(int status, String body) {
        return Mono.just(ClientResponse.create(HttpStatus.valueOf(status))
                .header("Content-Type", "application/json")
                .body(body)
                .build());
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        int index = requests.size();
        requests.add(request);
        return responder.apply(request, index);
    }

    WebClient webClient() {
        return WebClient.builder()
                .baseUrl("https://retailer.test")
                .exchangeFunction(this)
                .build();
    }
}
