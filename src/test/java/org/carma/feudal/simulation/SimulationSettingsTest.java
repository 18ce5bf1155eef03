package org.carma.feudal.simulation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationSettingsTest {

    @Test
    void mintYieldsCombineSmeltingAndCoinage() {
        SimulationSettings s = SimulationSettings.defaults();

        assertEquals(10.0, s.crownsPerGoldOre(), 1e-9);
        assertEquals(5.0, s.crownsPerSilverOre(), 1e-9);
    }

    @Test
    void settersChain() {
        SimulationSettings s = SimulationSettings.defaults()
            .setDucalTaxRate(0.3)
            .setCrossRealmTariffRate(0.05)
            .setStrictInvariants(false);

        assertEquals(0.3, s.getDucalTaxRate(), 1e-9);
        assertEquals(0.05, s.getCrossRealmTariffRate(), 1e-9);
        assertFalse(s.isStrictInvariants());
    }

    @Test
    void ratesOutsideUnitIntervalAreRejected() {
        SimulationSettings s = SimulationSettings.defaults();

        assertThrows(IllegalArgumentException.class, () -> s.setRoyalTaxRate(1.5));
        assertThrows(IllegalArgumentException.class, () -> s.setGranaryDiscount(-0.1));
        assertThrows(IllegalArgumentException.class, () -> s.setSatisfactionWindow(0));
        assertThrows(IllegalArgumentException.class, () -> s.setEfficiencyAlpha(0));
        assertThrows(IllegalArgumentException.class, () -> s.setCrownsPerKgGold(-1));
    }
}
