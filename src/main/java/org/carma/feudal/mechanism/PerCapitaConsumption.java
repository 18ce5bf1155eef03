package org.carma.feudal.mechanism;

import org.carma.feudal.model.CountyEconomy;
import org.carma.feudal.model.GoodType;

/**
 * Demand equal to population times the good's per-capita consumption rate.
 */
public class PerCapitaConsumption implements ConsumptionModel {

    @Override
    public double demand(CountyEconomy county, GoodType good) {
        return county.dailyNeed(good);
    }
}
