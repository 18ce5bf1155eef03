package org.carma.feudal.mechanism;

import org.carma.feudal.model.*;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationState;
import org.carma.feudal.simulation.TickIntervals;
import org.carma.feudal.simulation.TickSystem;

/**
 * County-to-county trade inside a realm, daily, at the current market price.
 *
 * Runs two cascading passes so that local surplus is used before wider trade:
 * 1. Intra-province, without toll
 * 2. Cross-province within each realm; buyers pay a toll to their own province
 *
 * Counties keep {@code surplusDays} of need and offer the rest. Buyers want up to the
 * same reserve, limited by treasury. Rationing follows the inter-realm market: the
 * short side fills completely and the long side pro-rata.
 */
public class DomesticTradeSystem implements TickSystem {

    @Override
    public String name() {
        return "domestic-trade";
    }

    @Override
    public int tickInterval() {
        return TickIntervals.DAILY;
    }

    @Override
    public void tick(SimulationState state, WorldTopology topology) {
        EconomyState economy = state.getEconomy();
        double surplusDays = state.getSettings().getSurplusDays();
        double toll = state.getSettings().getCrossProvinceTollRate();
        int day = state.getDay();

        for (GoodType good : state.getCatalog().buyPriority()) {
            for (int p = 0; p < topology.provinceCount(); p++) {
                int[] members = topology.countiesOfProvince(p);
                if (members.length > 1) {
                    tradePass(economy, topology, members, good, surplusDays, 0.0, day);
                }
            }
            for (int r = 0; r < topology.realmCount(); r++) {
                if (topology.provincesOfRealm(r).length > 1) {
                    tradePass(economy, topology, topology.countiesOfRealm(r), good, surplusDays, toll, day);
                }
            }
        }
    }

    static void tradePass(EconomyState economy, WorldTopology topology, int[] members, GoodType good,
                          double surplusDays, double tollRate, int day) {
        int g = good.ordinal();
        double price = economy.marketPrices[g];
        if (price <= 0) return;
        double unitCost = price * (1.0 + tollRate);

        double[] supply = new double[members.length];
        double[] demand = new double[members.length];
        double totalSupply = 0.0;
        double totalDemand = 0.0;

        for (int i = 0; i < members.length; i++) {
            CountyEconomy county = economy.county(members[i]);
            double retain = county.dailyNeed(good) * surplusDays;
            double excess = county.stock[g] - retain;
            if (excess > 0) {
                supply[i] = excess;
                totalSupply += excess;
            } else if (excess < 0) {
                double affordable = Math.max(0.0, county.treasury) / unitCost;
                demand[i] = Math.min(-excess, affordable);
                totalDemand += demand[i];
                if (demand[i] > 0) {
                    economy.ledger().post(new BuyOrder(
                        new MarketParticipant.PopulationBuyer(county.getCountyId()), good,
                        demand[i], demand[i] * unitCost, price * tollRate, day));
                }
            }
        }
        if (totalSupply <= 0 || totalDemand <= 0) return;

        double fillRatio = Math.min(1.0, totalSupply / totalDemand);
        double sellRatio = Math.min(1.0, totalDemand / totalSupply);

        for (int i = 0; i < members.length; i++) {
            CountyEconomy county = economy.county(members[i]);
            if (supply[i] > 0) {
                double sold = supply[i] * sellRatio;
                double revenue = sold * price;
                county.stock[g] -= sold;
                county.treasury += revenue;
                county.tradeSold[g] += sold;
                county.tradeCrownsEarned += revenue;
            } else if (demand[i] > 0) {
                double bought = demand[i] * fillRatio;
                double spent = bought * price;
                double toll = spent * tollRate;
                county.stock[g] += bought;
                county.treasury -= spent + toll;
                county.tradeBought[g] += bought;
                county.tradeCrownsSpent += spent;
                county.tradeTollsPaid += toll;
                if (toll > 0) {
                    ProvinceEconomy province = economy.province(topology.provinceOf(county.getCountyId()));
                    province.treasury += toll;
                    province.tradeTollsCollected += toll;
                }
            }
        }
    }
}
