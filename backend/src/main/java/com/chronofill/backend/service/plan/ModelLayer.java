package com.chronofill.backend.service.plan;

/**
 * Pipeline layers in execution order.
 */
public enum ModelLayer {
    RAW,
    STAGING,
    CANONICAL,
    ATTRIBUTION,
    SEMANTIC,
    METRICS,
    MARTS
}
