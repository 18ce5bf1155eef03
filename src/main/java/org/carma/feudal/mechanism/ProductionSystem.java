package org.carma.feudal.mechanism;

import org.carma.feudal.model.CountyEconomy;
import org.carma.feudal.model.GoodType;
import org.carma.feudal.model.NeedCategory;
import org.carma.feudal.model.WorldTopology;
import org.carma.feudal.simulation.SimulationState;
import org.carma.feudal.simulation.TickIntervals;
import org.carma.feudal.simulation.TickSystem;

import java.util.Objects;

/**
 * Local production and consumption, per county, daily.
 *
 * Production is {@code population × productivity} and lands in stock before demand is
 * drawn. Consumption is clamped to stock; the remainder is recorded as unmet need.
 * Basic satisfaction moves toward today's met fraction of basic demand as an
 * exponential moving average over the configured window.
 */
public class ProductionSystem implements TickSystem {

    private final ConsumptionModel consumptionModel;

    public ProductionSystem() {
        this(new PerCapitaConsumption());
    }

    public ProductionSystem(ConsumptionModel consumptionModel) {
        this.consumptionModel = Objects.requireNonNull(consumptionModel, "Consumption model cannot be null");
    }

    @Override
    public String name() {
        return "production";
    }

    @Override
    public int tickInterval() {
        return TickIntervals.DAILY;
    }

    @Override
    public void tick(SimulationState state, WorldTopology topology) {
        int window = state.getSettings().getSatisfactionWindow();
        for (CountyEconomy county : state.getEconomy().counties()) {
            produceAndConsume(county);
            updateSatisfaction(county, window);
        }
    }

    void produceAndConsume(CountyEconomy county) {
        for (GoodType good : GoodType.values()) {
            int g = good.ordinal();

            double produced = county.population * county.productivity[g];
            county.production[g] = produced;
            county.stock[g] += produced;

            double demand = Math.max(0.0, consumptionModel.demand(county, good));
            double consumed = Math.min(county.stock[g], demand);
            county.stock[g] -= consumed;
            county.consumption[g] = consumed;
            county.unmetNeed[g] = demand - consumed;
        }
    }

    /**
     * Weighted met fraction of basic goods, weights proportional to per-capita rates.
     * No update when the county had no basic demand today.
     */
    void updateSatisfaction(CountyEconomy county, int window) {
        double weightedMet = 0.0;
        double totalWeight = 0.0;
        for (GoodType good : GoodType.values()) {
            if (good.getNeed() != NeedCategory.BASIC) continue;
            int g = good.ordinal();
            double demand = county.consumption[g] + county.unmetNeed[g];
            if (demand <= 0) continue;

            double weight = good.getConsumptionPerPop();
            weightedMet += weight * (1.0 - county.unmetNeed[g] / demand);
            totalWeight += weight;
        }
        if (totalWeight <= 0) return;

        double today = weightedMet / totalWeight;
        county.basicSatisfaction += (today - county.basicSatisfaction) / window;
        county.basicSatisfaction = Math.max(0.0, Math.min(1.0, county.basicSatisfaction));
    }
}
