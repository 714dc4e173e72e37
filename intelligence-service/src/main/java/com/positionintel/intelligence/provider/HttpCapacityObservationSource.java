package com.positionintel.intelligence.provider;

import org.springframework.web.reactive.function.client.WebClient;

public class HttpCapacityObservationSource extends HttpObservationSource implements CapacityObservationSource {

    public static final String PROVIDER_ID = "capacity";

    public HttpCapacityObservationSource(WebClient client) {
        super(client, PROVIDER_ID, "/api/v1/observations/capacity");
    }
}
