package com.positionintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Price statistics for one subject on one day. {@code avgPrice} is rounded to 4 dp. */
public record PriceTrendPoint(
    @JsonProperty("subjectId")   String     subjectId,
    @JsonProperty("day")         LocalDate  day,
    @JsonProperty("avgPrice")    BigDecimal avgPrice,
    @JsonProperty("minPrice")    BigDecimal minPrice,
    @JsonProperty("maxPrice")    BigDecimal maxPrice,
    @JsonProperty("recordCount") int        recordCount
) {}
