package com.acme.cievidence.model;

/**
 * Score produced by the static test-infrastructure inspection. Only the number is
 * needed here; how it was derived is up to the producer.
 */
public interface StaticInfrastructureScore {
    int calculatedScore();
}
