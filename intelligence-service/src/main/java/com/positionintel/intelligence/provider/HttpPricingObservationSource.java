package com.positionintel.intelligence.provider;

import org.springframework.web.reactive.function.client.WebClient;

public class HttpPricingObservationSource extends HttpObservationSource implements PricingObservationSource {

    public static final String PROVIDER_ID = "pricing";

    public HttpPricingObservationSource(WebClient client) {
        super(client, PROVIDER_ID, "/api/v1/observations/pricing");
    }
}
