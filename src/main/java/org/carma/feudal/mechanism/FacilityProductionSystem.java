package org.carma.feudal.mechanism;

import org.carma.feudal.model.*;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationState;
import org.carma.feudal.simulation.TickIntervals;
import org.carma.feudal.simulation.TickSystem;

import java.util.HashMap;
import java.util.Map;

/**
 * Facility throughput, daily, in facility id order.
 *
 * For each facility:
 * 1. Staff it from the county labor pool for its type ({@code population × maxLaborFraction})
 * 2. Target the staffed throughput, capped by the county's remaining quota when one is set
 * 3. Draw missing input from county stock into the input buffer
 * 4. Run as many recipe units as the buffer allows
 * 5. Deliver the output buffer to county stock, credited as production
 */
public class FacilityProductionSystem implements TickSystem {

    @Override
    public String name() {
        return "facility-production";
    }

    @Override
    public int tickInterval() {
        return TickIntervals.DAILY;
    }

    @Override
    public void tick(SimulationState state, WorldTopology topology) {
        EconomyState economy = state.getEconomy();
        double alpha = state.getSettings().getEfficiencyAlpha();
        int day = state.getDay();

        for (CountyEconomy county : economy.counties()) {
            county.facilityWorkers = 0.0;
        }

        // Remaining labor per facility type, per county
        Map<String, double[]> laborPools = new HashMap<>();
        // Remaining quota per county, per output good
        double[][] quotaLeft = new double[economy.counties().length][];

        for (Facility facility : economy.facilities()) {
            FacilityDef def = facility.getDef();
            CountyEconomy county = economy.county(facility.getCountyId());
            int c = county.getCountyId();

            double[] pool = laborPools.computeIfAbsent(def.getId(), k -> initialPool(economy, def));
            double workers = facility.active ? Math.min(def.getLaborRequired(), pool[c]) : 0.0;
            pool[c] -= workers;
            facility.assignedWorkers = workers;
            county.facilityWorkers += workers;

            if (quotaLeft[c] == null) quotaLeft[c] = county.facilityQuota.clone();
            double units = targetUnits(facility, alpha, county.facilityQuota, quotaLeft[c]);

            procureInput(facility, county, units, economy, day);
            double executed = execute(facility, units);
            quotaLeft[c][def.getOutputGood().ordinal()] -= executed * def.getOutputAmount();

            deliverOutput(facility, county, economy.ledger(), day);
        }
    }

    private static double[] initialPool(EconomyState economy, FacilityDef def) {
        CountyEconomy[] counties = economy.counties();
        double[] pool = new double[counties.length];
        for (int i = 0; i < counties.length; i++) {
            pool[i] = counties[i].population * def.getMaxLaborFraction();
        }
        return pool;
    }

    /**
     * Staffed throughput, capped by what is left of the county quota.
     * A county without a quota for the output good leaves output uncapped.
     */
    static double targetUnits(Facility facility, double alpha, double[] quota, double[] quotaLeft) {
        FacilityDef def = facility.getDef();
        int out = def.getOutputGood().ordinal();
        double units = facility.throughput(alpha);
        if (quota[out] > 0) {
            units = Math.min(units, Math.max(0.0, quotaLeft[out]) / def.getOutputAmount());
        }
        return Math.max(0.0, units);
    }

    private static void procureInput(Facility facility, CountyEconomy county, double units,
                                     EconomyState economy, int day) {
        FacilityDef def = facility.getDef();
        GoodType input = def.getInputGood();
        int in = input.ordinal();

        double wanted = def.getInputAmount() * units - facility.inputBuffer[in];
        if (wanted <= 0) return;

        double drawn = county.withdraw(input, wanted);
        facility.inputBuffer[in] += drawn;
        economy.ledger().post(new BuyOrder(
            new MarketParticipant.Facility(facility.getId()), input,
            wanted, wanted * economy.marketPrices[in], 0.0, day));
    }

    /**
     * Run up to {@code units} recipe units, limited by the input buffer.
     * @return units executed
     */
    static double execute(Facility facility, double units) {
        FacilityDef def = facility.getDef();
        int in = def.getInputGood().ordinal();
        int out = def.getOutputGood().ordinal();

        double executed = Math.min(units, facility.inputBuffer[in] / def.getInputAmount());
        if (executed <= 0) {
            facility.lastUnits = 0.0;
            return 0.0;
        }
        facility.inputBuffer[in] = Math.max(0.0, facility.inputBuffer[in] - def.getInputAmount() * executed);
        facility.outputBuffer[out] += def.getOutputAmount() * executed;
        facility.lastUnits = executed;
        return executed;
    }

    private static void deliverOutput(Facility facility, CountyEconomy county, MarketLedger ledger, int day) {
        GoodType output = facility.getDef().getOutputGood();
        int out = output.ordinal();
        double amount = facility.outputBuffer[out];
        if (amount <= 0) return;

        facility.outputBuffer[out] = 0.0;
        county.stock[out] += amount;
        county.production[out] += amount;
        ledger.list(new ConsignmentLot(new MarketParticipant.Facility(facility.getId()), output, amount, day));
    }
}
