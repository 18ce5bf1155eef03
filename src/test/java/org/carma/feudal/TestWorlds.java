package org.carma.feudal;

import org.carma.feudal.model.FacilityRegistry;
import org.carma.feudal.model.GoodCatalog;
import org.carma.feudal.model.WorldTopology;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationSettings;
import org.carma.feudal.simulation.SimulationState;

/**
 * Small hand-built worlds shared by the mechanism and simulation tests.
 */
public final class TestWorlds {

    private TestWorlds() {}

    /**
     * One realm, one province, {@code counties} counties.
     */
    public static WorldTopology singleProvince(int counties) {
        WorldTopology.Builder b = WorldTopology.builder();
        int realm = b.addRealm();
        int province = b.addProvince(realm);
        for (int i = 0; i < counties; i++) b.addCounty(province);
        return b.build();
    }

    /**
     * One realm with two provinces of one county each.
     */
    public static WorldTopology twoProvinces() {
        WorldTopology.Builder b = WorldTopology.builder();
        int realm = b.addRealm();
        b.addCounty(b.addProvince(realm));
        b.addCounty(b.addProvince(realm));
        return b.build();
    }

    /**
     * Two realms of one province and one county each. County, province and realm ids coincide.
     */
    public static WorldTopology twoRealms() {
        WorldTopology.Builder b = WorldTopology.builder();
        int r0 = b.addRealm();
        int r1 = b.addRealm();
        b.addCounty(b.addProvince(r0));
        b.addCounty(b.addProvince(r1));
        return b.build();
    }

    public static SimulationState state(WorldTopology topology) {
        return state(topology, SimulationSettings.defaults());
    }

    public static SimulationState state(WorldTopology topology, SimulationSettings settings) {
        GoodCatalog catalog = GoodCatalog.standard();
        return new SimulationState(EconomyState.create(topology, catalog), catalog,
            FacilityRegistry.standard(), settings);
    }
}
