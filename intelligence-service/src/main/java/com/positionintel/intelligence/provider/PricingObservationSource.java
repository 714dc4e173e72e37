package com.positionintel.intelligence.provider;

/** Observations whose value is a price. */
public interface PricingObservationSource extends ObservationSource {}
