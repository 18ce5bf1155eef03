package org.carma.feudal.safety;

import org.carma.feudal.TestWorlds;
import org.carma.feudal.event.Event;
import org.carma.feudal.model.GoodType;
import org.carma.feudal.safety.InvariantMonitor.CheckResult;
import org.carma.feudal.safety.InvariantMonitor.InvariantViolationException;
import org.carma.feudal.simulation.SimulationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InvariantMonitorTest {

    private static final int FOOD = GoodType.FOOD.ordinal();

    private SimulationState state;

    @BeforeEach
    void setUp() {
        state = TestWorlds.state(TestWorlds.twoProvinces());
        state.getEconomy().county(0).stock[FOOD] = 100;
        state.getEconomy().realm(0).treasury = 50;
    }

    @Test
    void soundStatePassesEveryCheck() {
        InvariantMonitor monitor = new InvariantMonitor(true);

        assertTrue(monitor.checkDay(state).isEmpty());
        assertEquals(3, monitor.getChecksRun());
        assertTrue(monitor.getFailures().isEmpty());
    }

    @Test
    void floatNoiseBelowZeroIsTolerated() {
        state.getEconomy().province(1).stockpile[FOOD] = -1e-12;

        assertTrue(new InvariantMonitor(true).checkNonNegativeStock(state.getEconomy()).isPassed());
    }

    @Test
    void negativeStockIsReportedAtEveryTier() {
        state.getEconomy().county(1).stock[FOOD] = -2;
        state.getEconomy().realm(0).stockpile[GoodType.SALT.ordinal()] = -1;

        CheckResult result = new InvariantMonitor(false).checkNonNegativeStock(state.getEconomy());

        assertFalse(result.isPassed());
        assertEquals(2, result.getViolations().size());
        assertTrue(result.getViolations().get(0).startsWith("county 1 stock food"));
    }

    @Test
    void negativeTreasuryIsReported() {
        state.getEconomy().province(0).treasury = -0.5;

        CheckResult result = new InvariantMonitor(false).checkNonNegativeTreasury(state.getEconomy());

        assertEquals("non-negative treasury", result.getCheckName());
        assertEquals(1, result.getViolations().size());
    }

    @Test
    void priceOutsideCatalogBandIsReported() {
        state.getEconomy().marketPrices[FOOD] = 50.0;

        CheckResult result = new InvariantMonitor(false).checkPriceBounds(state.getEconomy(), state.getCatalog());

        assertFalse(result.isPassed());
        assertTrue(result.getViolations().get(0).startsWith("food price"));
    }

    @Test
    void strictModeThrowsOnFirstFailure() {
        state.getEconomy().county(0).treasury = -3;
        state.getEconomy().marketPrices[FOOD] = 50.0;

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> new InvariantMonitor(true).checkDay(state));

        assertEquals("non-negative treasury", e.getCheckName());
        assertEquals(0, e.getDay());
        assertEquals(1, e.getViolations().size());
        assertEquals(1, state.getEventBus().getEventCount(Event.InvariantViolationEvent.class));
    }

    @Test
    void lenientModeRecordsAndPublishes() {
        state.getEconomy().county(0).stock[FOOD] = -3;
        state.getEconomy().marketPrices[FOOD] = 50.0;
        InvariantMonitor monitor = new InvariantMonitor(false);

        List<CheckResult> failed = monitor.checkDay(state);

        assertEquals(2, failed.size());
        assertEquals(2, monitor.getFailures().size());
        List<Event.InvariantViolationEvent> events =
            state.getEventBus().getHistory(Event.InvariantViolationEvent.class);
        assertEquals("non-negative stock", events.get(0).checkName());
        assertEquals("price bounds", events.get(1).checkName());
    }

    @Test
    void strictnessCanBeRelaxed() {
        state.getEconomy().county(0).stock[FOOD] = -3;
        InvariantMonitor monitor = new InvariantMonitor(true).setStrictMode(false);

        assertFalse(monitor.isStrictMode());
        assertEquals(1, monitor.checkDay(state).size());
    }
}
