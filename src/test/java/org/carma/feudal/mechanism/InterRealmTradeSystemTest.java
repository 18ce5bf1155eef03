package org.carma.feudal.mechanism;

import org.carma.feudal.TestWorlds;
import org.carma.feudal.event.Event;
import org.carma.feudal.model.GoodType;
import org.carma.feudal.model.WorldTopology;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InterRealmTradeSystemTest {

    private static final int FOOD = GoodType.FOOD.ordinal();

    @Test
    void countyShortfallBecomesRealmDeficit() {
        WorldTopology topology = TestWorlds.singleProvince(2);
        SimulationState state = TestWorlds.state(topology);
        EconomyState economy = state.getEconomy();
        economy.county(0).population = 10;
        economy.county(0).stock[FOOD] = 4;
        economy.county(1).population = 10;
        economy.county(1).stock[FOOD] = 50;

        InterRealmTradeSystem.scanDeficits(economy, topology, state.getCatalog());

        assertEquals(6.0, economy.realm(0).deficit[FOOD], 1e-9);
        assertEquals(0.0, economy.realm(0).deficit[GoodType.GOLD_ORE.ordinal()], 1e-9);
    }

    @Test
    void hungryRealmImportsFromFoodRichRealm() {
        WorldTopology topology = TestWorlds.twoRealms();
        SimulationState state = TestWorlds.state(topology);
        EconomyState economy = state.getEconomy();
        economy.realm(0).stockpile[FOOD] = 500;
        economy.county(1).population = 100;
        economy.realm(1).treasury = 1000;

        InterRealmTradeSystem system = new InterRealmTradeSystem();
        system.initialize(state, topology);
        system.tick(state, topology);

        // 1 crown base × 100 / 500, above the 0.1 floor
        assertEquals(0.2, economy.marketPrices[FOOD], 1e-9);
        assertEquals(100.0, economy.realm(1).stockpile[FOOD], 1e-9);
        assertEquals(980.0, economy.realm(1).treasury, 1e-9);
        assertEquals(400.0, economy.realm(0).stockpile[FOOD], 1e-9);
        assertEquals(20.0, economy.realm(0).treasury, 1e-9);

        List<Event.MarketClearedEvent> events = state.getEventBus().getHistory(Event.MarketClearedEvent.class);
        assertEquals(1, events.size());
        assertEquals(GoodType.FOOD, events.get(0).good());
        assertEquals(100.0, events.get(0).volume(), 1e-9);
    }

    @Test
    void realmWithoutTradingPartnerKeepsItsReserve() {
        WorldTopology topology = TestWorlds.singleProvince(1);
        SimulationState state = TestWorlds.state(topology);
        EconomyState economy = state.getEconomy();
        economy.county(0).population = 30;
        economy.realm(0).stockpile[FOOD] = 100;

        new InterRealmTradeSystem().tick(state, topology);

        assertEquals(30.0, economy.realm(0).deficit[FOOD], 1e-9);
        assertEquals(100.0, economy.realm(0).stockpile[FOOD], 1e-9);
        assertEquals(0, state.getEventBus().getEventCount(Event.MarketClearedEvent.class));
    }

    @Test
    void untradedGoodsKeepTheirPrice() {
        WorldTopology topology = TestWorlds.twoRealms();
        SimulationState state = TestWorlds.state(topology);
        EconomyState economy = state.getEconomy();
        economy.marketPrices[GoodType.SALT.ordinal()] = 7.0;

        new InterRealmTradeSystem().tick(state, topology);

        assertEquals(7.0, economy.marketPrices[GoodType.SALT.ordinal()], 1e-9);
        assertEquals(0, state.getEventBus().getEventCount());
    }
}
