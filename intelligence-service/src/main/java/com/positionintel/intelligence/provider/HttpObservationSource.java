package com.positionintel.intelligence.provider;

import com.positionintel.common.model.ObservationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * WebClient-backed observation source. Issues
 * {@code GET <path>?subjectId=..&from=yyyy-MM-dd&to=yyyy-MM-dd} and expects a JSON
 * array of {@link ObservationRecord}.
 *
 * <p>Errors are propagated; the cascade decides what a failure means.
 */
public abstract class HttpObservationSource implements ObservationSource {

    private static final Logger log = LoggerFactory.getLogger(HttpObservationSource.class);

    private final WebClient client;
    private final String    providerId;
    private final String    path;

    protected HttpObservationSource(WebClient client, String providerId, String path) {
        this.client     = client;
        this.providerId = providerId;
        this.path       = path;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public Mono<List<ObservationRecord>> query(String subjectId, LocalDate from, LocalDate to) {
        return client.get()
            .uri(uriBuilder -> uriBuilder
                .path(path)
                .queryParam("subjectId", subjectId)
                .queryParam("from", from)
                .queryParam("to", to)
                .build())
            .retrieve()
            .bodyToFlux(ObservationRecord.class)
            .collectList()
            .doOnSuccess(records -> log.debug("Observations fetched. provider={} subject={} from={} to={} count={}",
                providerId, subjectId, from, to, records == null ? 0 : records.size()));
    }
}
