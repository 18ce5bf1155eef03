package org.carma.feudal.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FacilityTest {

    private final FacilityDef kiln = FacilityRegistry.standard().get("kiln");

    @Test
    void kilnRecipe() {
        assertEquals(GoodType.CLAY, kiln.getInputGood());
        assertEquals(2.0, kiln.getInputAmount(), 1e-9);
        assertEquals(GoodType.POTTERY, kiln.getOutputGood());
        assertEquals(30.0, kiln.getLaborRequired(), 1e-9);
        assertEquals(10.0, kiln.getBaseThroughput(), 1e-9);
    }

    @Test
    void efficiencyFollowsStaffingCurve() {
        Facility f = new Facility(1, kiln, -1, 0);

        f.assignedWorkers = 0;
        assertEquals(0.0, f.efficiency(), 1e-9);

        f.assignedWorkers = 15;
        assertEquals(Math.pow(0.5, 0.7), f.efficiency(), 1e-9);
        assertEquals(0.5, f.efficiency(1.0), 1e-9);

        f.assignedWorkers = 30;
        assertEquals(1.0, f.efficiency(), 1e-9);

        f.assignedWorkers = 45;
        assertEquals(1.0, f.efficiency(), 1e-9);
    }

    @Test
    void facilityNeedingNoLaborRunsAtFullEfficiency() {
        FacilityDef brewery = FacilityDef.builder("brewery")
            .input(GoodType.FOOD, 2)
            .output(GoodType.ALE, 1)
            .build();
        Facility f = new Facility(1, brewery, -1, 0);

        assertEquals(1.0, f.efficiency(), 1e-9);
        assertEquals(10.0, f.throughput(), 1e-9);
    }

    @Test
    void inactiveFacilityHasNoThroughput() {
        Facility f = new Facility(1, kiln, -1, 0);
        f.assignedWorkers = 30;
        f.active = false;

        assertEquals(0.0, f.throughput(), 1e-9);
    }

    @Test
    void facilityIdMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new Facility(0, kiln, -1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Facility(1, kiln, -1, -1));
    }

    @Test
    void placementNeedsInputProductivityAboveThreshold() {
        CountyEconomy county = new CountyEconomy(0);
        assertFalse(kiln.canPlace(county));

        county.productivity[GoodType.CLAY.ordinal()] = 0.01;
        assertFalse(kiln.canPlace(county));

        county.productivity[GoodType.CLAY.ordinal()] = 0.05;
        assertTrue(kiln.canPlace(county));
    }

    @Test
    void malformedRecipesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> FacilityDef.builder("loop")
            .input(GoodType.CLAY, 1).output(GoodType.CLAY, 1).build());
        assertThrows(IllegalArgumentException.class, () -> FacilityDef.builder("free")
            .input(GoodType.CLAY, 0).output(GoodType.POTTERY, 1).build());
        assertThrows(IllegalArgumentException.class, () -> FacilityDef.builder("crowded")
            .input(GoodType.CLAY, 1).output(GoodType.POTTERY, 1).maxLaborFraction(1.5).build());
        assertThrows(NullPointerException.class, () -> FacilityDef.builder("half")
            .input(GoodType.CLAY, 1).build());
    }

    @Test
    void registryRejectsDuplicateIds() {
        FacilityRegistry registry = FacilityRegistry.standard();

        assertThrows(IllegalArgumentException.class, () -> registry.register(kiln));
        assertThrows(IllegalArgumentException.class, () -> registry.get("forge"));
        assertTrue(registry.find("forge").isEmpty());
        assertTrue(registry.outputGoods().contains(GoodType.POTTERY));
        assertEquals(1, registry.size());
    }

    @Test
    void copyCarriesBuffersIndependently() {
        Facility f = new Facility(3, kiln, 7, 0);
        f.inputBuffer[GoodType.CLAY.ordinal()] = 4;
        f.assignedWorkers = 12;

        Facility copy = f.copy();
        copy.inputBuffer[GoodType.CLAY.ordinal()] = 0;

        assertEquals(4.0, f.inputBuffer[GoodType.CLAY.ordinal()], 1e-9);
        assertEquals(12.0, copy.assignedWorkers, 1e-9);
        assertEquals(3, copy.getId());
        assertEquals(7, copy.getCellId());
    }
}
