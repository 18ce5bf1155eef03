package org.carma.feudal.mechanism;

import org.carma.feudal.model.CountyEconomy;
import org.carma.feudal.model.GoodType;

/**
 * Daily demand of a county for a good.
 * Implementations must return a non-negative value and must not mutate the county.
 */
@FunctionalInterface
public interface ConsumptionModel {

    double demand(CountyEconomy county, GoodType good);
}
