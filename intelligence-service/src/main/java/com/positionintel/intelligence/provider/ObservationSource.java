package com.positionintel.intelligence.provider;

import com.positionintel.common.model.ObservationRecord;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Upstream source of observations for a subject's market: the subject's own
 * records plus those of every competitor reporting in the same market.
 */
public interface ObservationSource {

    String providerId();

    /**
     * @param subjectId normalized subject id
     * @param from      first day of the window, inclusive
     * @param to        last day of the window, inclusive
     */
    Mono<List<ObservationRecord>> query(String subjectId, LocalDate from, LocalDate to);
}
