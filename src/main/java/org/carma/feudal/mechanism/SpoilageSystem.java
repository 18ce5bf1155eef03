package org.carma.feudal.mechanism;

import org.carma.feudal.model.*;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationState;
import org.carma.feudal.simulation.TickIntervals;
import org.carma.feudal.simulation.TickSystem;

/**
 * Monthly decay of perishable goods held at every tier and in facility buffers.
 */
public class SpoilageSystem implements TickSystem {

    @Override
    public String name() {
        return "spoilage";
    }

    @Override
    public int tickInterval() {
        return TickIntervals.MONTHLY;
    }

    @Override
    public void tick(SimulationState state, WorldTopology topology) {
        EconomyState economy = state.getEconomy();
        double[] retention = new double[GoodType.COUNT];
        for (GoodType good : GoodType.values()) {
            retention[good.ordinal()] = good.getMonthlyRetention();
        }

        for (CountyEconomy county : economy.counties()) spoil(county.stock, retention);
        for (ProvinceEconomy province : economy.provinces()) spoil(province.stockpile, retention);
        for (RealmEconomy realm : economy.realms()) spoil(realm.stockpile, retention);
        for (Facility facility : economy.facilities()) {
            spoil(facility.inputBuffer, retention);
            spoil(facility.outputBuffer, retention);
        }
    }

    static void spoil(double[] stock, double[] retention) {
        for (int g = 0; g < GoodType.COUNT; g++) {
            if (retention[g] < 1.0) stock[g] *= retention[g];
        }
    }
}
