package org.carma.feudal.mechanism;

import org.carma.feudal.event.Event;
import org.carma.feudal.model.*;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationState;
import org.carma.feudal.simulation.TickIntervals;
import org.carma.feudal.simulation.TickSystem;

/**
 * Daily inter-realm trade: adds county shortfalls to each realm's deficit, then runs
 * {@link MarketClearing} and publishes the resulting prices.
 */
public class InterRealmTradeSystem implements TickSystem {

    private MarketClearing clearing;

    @Override
    public String name() {
        return "inter-realm-trade";
    }

    @Override
    public int tickInterval() {
        return TickIntervals.DAILY;
    }

    @Override
    public void initialize(SimulationState state, WorldTopology topology) {
        this.clearing = new MarketClearing(state.getCatalog(), state.getSettings().getCrossRealmTariffRate());
    }

    @Override
    public void tick(SimulationState state, WorldTopology topology) {
        if (clearing == null) initialize(state, topology);
        EconomyState economy = state.getEconomy();

        scanDeficits(economy, topology, state.getCatalog());

        MarketClearing.ClearingResult result = clearing.clear(economy.realms(), economy.marketPrices);
        System.arraycopy(result.getPrices(), 0, economy.marketPrices, 0, GoodType.COUNT);

        for (MarketClearing.GoodClearing c : result.getGoods()) {
            if (!c.traded()) continue;
            state.getEventBus().publish(new Event.MarketClearedEvent(
                state.getDay(), c.good(), c.price(), c.volume(), c.fillRatio(), c.sellRatio()));
        }
    }

    /**
     * Each realm's deficit grows by its counties' remaining shortfall of tradeable goods.
     */
    static void scanDeficits(EconomyState economy, WorldTopology topology, GoodCatalog catalog) {
        CountyEconomy[] counties = economy.counties();
        for (int r = 0; r < topology.realmCount(); r++) {
            RealmEconomy realm = economy.realm(r);
            int[] members = topology.countiesOfRealm(r);
            for (GoodType good : catalog.buyPriority()) {
                int g = good.ordinal();
                double shortfall = 0.0;
                for (int c : members) {
                    shortfall += Math.max(0.0, counties[c].dailyNeed(good) - counties[c].stock[g]);
                }
                realm.deficit[g] += shortfall;
            }
        }
    }
}
