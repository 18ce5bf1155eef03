package org.carma.feudal.mechanism;

import org.carma.feudal.model.*;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationState;
import org.carma.feudal.simulation.TickIntervals;
import org.carma.feudal.simulation.TickSystem;

import java.util.Arrays;

/**
 * Realm production targets for facility outputs, daily.
 *
 * A realm needs enough of each facility-made good to cover its population's consumption
 * and admin use plus its current trade deficit. That need is split across the counties
 * hosting a facility for the good, by population share. Counties without such a
 * facility get no quota, which leaves their output unplanned.
 */
public class FacilityQuotaSystem implements TickSystem {

    @Override
    public String name() {
        return "facility-quota";
    }

    @Override
    public int tickInterval() {
        return TickIntervals.DAILY;
    }

    @Override
    public void tick(SimulationState state, WorldTopology topology) {
        EconomyState economy = state.getEconomy();
        CountyEconomy[] counties = economy.counties();

        for (CountyEconomy county : counties) {
            Arrays.fill(county.facilityQuota, 0.0);
        }

        // hosts[good][county]: county runs a facility producing the good
        boolean[][] hosts = new boolean[GoodType.COUNT][counties.length];
        for (Facility facility : economy.facilities()) {
            if (!facility.active) continue;
            hosts[facility.getDef().getOutputGood().ordinal()][facility.getCountyId()] = true;
        }

        for (int r = 0; r < topology.realmCount(); r++) {
            RealmEconomy realm = economy.realm(r);
            int[] members = topology.countiesOfRealm(r);
            double realmPop = topology.realmPopulation(r, counties);

            for (GoodType good : GoodType.values()) {
                int g = good.ordinal();
                double hostPop = 0.0;
                for (int c : members) {
                    if (hosts[g][c]) hostPop += counties[c].population;
                }
                if (hostPop <= 0) continue;

                double perPop = good.getConsumptionPerPop() + good.getCountyAdminPerPop() + good.getRealmAdminPerPop();
                double need = realmPop * perPop + realm.deficit[g];
                if (need <= 0) continue;

                for (int c : members) {
                    if (hosts[g][c]) {
                        counties[c].facilityQuota[g] = need * counties[c].population / hostPop;
                    }
                }
            }
        }
    }
}
