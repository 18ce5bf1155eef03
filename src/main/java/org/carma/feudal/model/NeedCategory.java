package org.carma.feudal.model;

/**
 * How strongly a population depends on a good.
 * Shortfall of a BASIC good lowers county satisfaction; COMFORT shortfall is recorded
 * as unmet need only; NONE goods are never consumed by the population.
 */
public enum NeedCategory {
    BASIC,
    COMFORT,
    NONE
}
