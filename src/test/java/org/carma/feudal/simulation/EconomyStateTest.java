package org.carma.feudal.simulation;

import org.carma.feudal.TestWorlds;
import org.carma.feudal.model.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EconomyStateTest {

    @Test
    void createSizesArenaAndStartsAtBasePrices() {
        WorldTopology topology = TestWorlds.twoProvinces();
        EconomyState economy = EconomyState.create(topology, GoodCatalog.standard());

        assertEquals(2, economy.counties().length);
        assertEquals(2, economy.provinces().length);
        assertEquals(1, economy.realms().length);
        assertArrayEquals(GoodCatalog.standard().basePrices(), economy.marketPrices, 1e-12);
    }

    @Test
    void facilityIdsStartAtOneAndAscend() {
        EconomyState economy = new EconomyState(2, 1, 1);
        FacilityDef kiln = FacilityRegistry.standard().get("kiln");

        Facility a = economy.addFacility(kiln, 0, 5);
        Facility b = economy.addFacility(kiln, 1, 9);

        assertEquals(1, a.getId());
        assertEquals(2, b.getId());
        assertEquals(9, b.getCellId());
        assertThrows(IllegalArgumentException.class, () -> economy.addFacility(kiln, 2, 0));
        assertThrows(UnsupportedOperationException.class, () -> economy.facilities().clear());
    }

    @Test
    void copyIsDeep() {
        EconomyState economy = new EconomyState(1, 1, 1);
        economy.county(0).stock[GoodType.FOOD.ordinal()] = 10;
        economy.realm(0).treasury = 5;
        Facility f = economy.addFacility(FacilityRegistry.standard().get("kiln"), 0, -1);
        f.inputBuffer[GoodType.CLAY.ordinal()] = 3;

        EconomyState copy = economy.copy();
        copy.county(0).stock[GoodType.FOOD.ordinal()] = 99;
        copy.realm(0).treasury = 0;
        copy.facilities().get(0).inputBuffer[GoodType.CLAY.ordinal()] = 0;
        copy.marketPrices[0] = 42;
        Facility next = copy.addFacility(FacilityRegistry.standard().get("kiln"), 0, -1);

        assertEquals(10.0, economy.county(0).stock[GoodType.FOOD.ordinal()], 1e-9);
        assertEquals(5.0, economy.realm(0).treasury, 1e-9);
        assertEquals(3.0, f.inputBuffer[GoodType.CLAY.ordinal()], 1e-9);
        assertEquals(0.0, economy.marketPrices[0], 1e-9);
        assertEquals(2, next.getId());
        assertEquals(1, economy.facilities().size());
    }
}
