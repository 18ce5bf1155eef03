package org.carma.feudal.mechanism;

import org.carma.feudal.model.*;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationState;

/**
 * Reduces every tier record into one {@link EconomySnapshot}. Reads only.
 *
 * County classification by food:
 * - starving: unmet food need today
 * - deficit: ate more food than it produced
 * - surplus: everything else
 */
public class SnapshotAggregator {

    private final double distressThreshold;

    public SnapshotAggregator() {
        this(0.5);
    }

    public SnapshotAggregator(double distressThreshold) {
        this.distressThreshold = distressThreshold;
    }

    public EconomySnapshot capture(SimulationState state, int day) {
        return capture(state.getEconomy(), day);
    }

    public EconomySnapshot capture(EconomyState economy, int day) {
        EconomySnapshot.Builder snap = EconomySnapshot.builder(day);
        int food = GoodType.FOOD.ordinal();

        CountyEconomy[] counties = economy.counties();
        double weightedSatisfaction = 0.0;
        double minSatisfaction = Double.MAX_VALUE;
        double maxSatisfaction = -Double.MAX_VALUE;

        for (CountyEconomy c : counties) {
            addInto(snap.countyStock, c.stock);
            addInto(snap.countyProduction, c.production);
            addInto(snap.countyConsumption, c.consumption);
            addInto(snap.countyUnmetNeed, c.unmetNeed);
            addInto(snap.countyTaxPaid, c.taxPaid);
            addInto(snap.countyRelief, c.relief);
            addInto(snap.tradeBought, c.tradeBought);

            if (c.unmetNeed[food] > 0) snap.starvingCounties++;
            else if (c.production[food] < c.consumption[food]) snap.deficitCounties++;
            else snap.surplusCounties++;

            snap.population += c.population;
            snap.births += c.birthsThisMonth;
            snap.deaths += c.deathsThisMonth;
            snap.facilityWorkers += c.facilityWorkers;
            weightedSatisfaction += c.population * c.basicSatisfaction;
            minSatisfaction = Math.min(minSatisfaction, c.basicSatisfaction);
            maxSatisfaction = Math.max(maxSatisfaction, c.basicSatisfaction);
            if (c.basicSatisfaction < distressThreshold) snap.distressedCounties++;

            snap.countyTreasury += c.treasury;
            snap.monetaryTaxToProvince += c.monetaryTaxPaid;
            snap.tradeTolls += c.tradeTollsPaid;
        }

        if (counties.length == 0) {
            minSatisfaction = 0.0;
            maxSatisfaction = 0.0;
        }
        snap.minSatisfaction = minSatisfaction;
        snap.maxSatisfaction = maxSatisfaction;
        snap.meanSatisfaction = snap.population > 0 ? weightedSatisfaction / snap.population : 0.0;

        for (ProvinceEconomy p : economy.provinces()) {
            addInto(snap.provincialStockpile, p.stockpile);
            snap.provinceTreasury += p.treasury;
            snap.monetaryTaxToRealm += p.monetaryTaxPaidToRealm;
            snap.adminCrownsCost += p.adminCrownsCost;
        }

        for (RealmEconomy r : economy.realms()) {
            addInto(snap.royalStockpile, r.stockpile);
            addInto(snap.realmDeficit, r.deficit);
            addInto(snap.realmImports, r.tradeImports);
            addInto(snap.realmExports, r.tradeExports);
            snap.realmTreasury += r.treasury;
            snap.goldMinted += r.goldMinted;
            snap.silverMinted += r.silverMinted;
            snap.crownsMinted += r.crownsMinted;
            snap.adminCrownsCost += r.adminCrownsCost;
            snap.tradeSpending += r.tradeSpending;
            snap.tradeRevenue += r.tradeRevenue;
            snap.tradeTariffs += r.tradeTariffsCollected;
        }

        System.arraycopy(economy.marketPrices, 0, snap.marketPrices, 0, GoodType.COUNT);
        snap.buyOrderCount = economy.ledger().getBuyOrders().size();
        snap.lotCount = economy.ledger().getLots().size();

        return snap.build();
    }

    private static void addInto(double[] total, double[] values) {
        for (int g = 0; g < GoodType.COUNT; g++) total[g] += values[g];
    }
}
