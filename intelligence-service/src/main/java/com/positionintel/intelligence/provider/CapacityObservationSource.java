package com.positionintel.intelligence.provider;

/** Observations whose value is a unit count (seats, capacity). */
public interface CapacityObservationSource extends ObservationSource {}
