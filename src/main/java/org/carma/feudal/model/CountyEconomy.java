package org.carma.feudal.model;

import java.util.Arrays;

/**
 * Per-county runtime economic state.
 *
 * All per-good arrays are indexed by {@link GoodType#ordinal()} and have length
 * {@link GoodType#COUNT} for the lifetime of the record. Daily fields are overwritten
 * or reset by the systems that own them:
 * - production, consumption, unmetNeed: ProductionSystem
 * - taxPaid, relief, granaryRequisitioned, trade fields: FiscalSystem / DomesticTradeSystem
 * - facilityWorkers: FacilityProductionSystem
 * - facilityQuota: FacilityQuotaSystem
 */
public class CountyEconomy {

    private final int countyId;

    /** Goods on hand. */
    public final double[] stock = new double[GoodType.COUNT];

    /** Goods produced per person per day, fixed at world init. */
    public final double[] productivity = new double[GoodType.COUNT];

    public final double[] production = new double[GoodType.COUNT];
    public final double[] consumption = new double[GoodType.COUNT];

    /** Shortfall when stock hit zero. */
    public final double[] unmetNeed = new double[GoodType.COUNT];

    /** Goods paid to the province (or the crown, for precious metals) this tick. */
    public final double[] taxPaid = new double[GoodType.COUNT];

    /** Goods received from the provincial stockpile this tick. */
    public final double[] relief = new double[GoodType.COUNT];

    /** Realm-distributed production target for facility outputs. */
    public final double[] facilityQuota = new double[GoodType.COUNT];

    public final double[] granaryRequisitioned = new double[GoodType.COUNT];
    public final double[] tradeBought = new double[GoodType.COUNT];
    public final double[] tradeSold = new double[GoodType.COUNT];

    public double population;

    /**
     * Moving average of the fraction of basic-goods demand met, in [0, 1].
     * Read by the demographic model.
     */
    public double basicSatisfaction = 1.0;

    // Reset monthly by the demographic model
    public double birthsThisMonth;
    public double deathsThisMonth;
    public double netMigrationThisMonth;

    public double facilityWorkers;

    public double treasury;
    public double monetaryTaxPaid;
    public double granaryRequisitionCrownsReceived;
    public double tradeCrownsSpent;
    public double tradeCrownsEarned;
    public double tradeTollsPaid;

    public CountyEconomy(int countyId) {
        if (countyId < 0) throw new IllegalArgumentException("County ID cannot be negative");
        this.countyId = countyId;
    }

    public int getCountyId() {
        return countyId;
    }

    /**
     * Daily need of a good for the current population.
     */
    public double dailyNeed(GoodType good) {
        return population * good.getConsumptionPerPop();
    }

    /**
     * Remove up to {@code amount} of a good from stock.
     * @return the amount actually removed
     */
    public double withdraw(GoodType good, double amount) {
        int g = good.ordinal();
        double taken = Math.max(0.0, Math.min(stock[g], amount));
        stock[g] -= taken;
        return taken;
    }

    // ========================================================================
    // Resets
    // ========================================================================

    /**
     * Clear the fiscal and trade accumulators. Called once per tick before redistribution.
     */
    public void resetFiscalAccumulators() {
        Arrays.fill(taxPaid, 0.0);
        Arrays.fill(relief, 0.0);
        Arrays.fill(granaryRequisitioned, 0.0);
        Arrays.fill(tradeBought, 0.0);
        Arrays.fill(tradeSold, 0.0);
        monetaryTaxPaid = 0.0;
        granaryRequisitionCrownsReceived = 0.0;
        tradeCrownsSpent = 0.0;
        tradeCrownsEarned = 0.0;
        tradeTollsPaid = 0.0;
    }

    public void resetMonthlyDemographics() {
        birthsThisMonth = 0.0;
        deathsThisMonth = 0.0;
        netMigrationThisMonth = 0.0;
    }

    /**
     * Deep copy for save/replay.
     */
    public CountyEconomy copy() {
        CountyEconomy c = new CountyEconomy(countyId);
        copyArrays(this, c);
        c.population = population;
        c.basicSatisfaction = basicSatisfaction;
        c.birthsThisMonth = birthsThisMonth;
        c.deathsThisMonth = deathsThisMonth;
        c.netMigrationThisMonth = netMigrationThisMonth;
        c.facilityWorkers = facilityWorkers;
        c.treasury = treasury;
        c.monetaryTaxPaid = monetaryTaxPaid;
        c.granaryRequisitionCrownsReceived = granaryRequisitionCrownsReceived;
        c.tradeCrownsSpent = tradeCrownsSpent;
        c.tradeCrownsEarned = tradeCrownsEarned;
        c.tradeTollsPaid = tradeTollsPaid;
        return c;
    }

    private static void copyArrays(CountyEconomy from, CountyEconomy to) {
        System.arraycopy(from.stock, 0, to.stock, 0, GoodType.COUNT);
        System.arraycopy(from.productivity, 0, to.productivity, 0, GoodType.COUNT);
        System.arraycopy(from.production, 0, to.production, 0, GoodType.COUNT);
        System.arraycopy(from.consumption, 0, to.consumption, 0, GoodType.COUNT);
        System.arraycopy(from.unmetNeed, 0, to.unmetNeed, 0, GoodType.COUNT);
        System.arraycopy(from.taxPaid, 0, to.taxPaid, 0, GoodType.COUNT);
        System.arraycopy(from.relief, 0, to.relief, 0, GoodType.COUNT);
        System.arraycopy(from.facilityQuota, 0, to.facilityQuota, 0, GoodType.COUNT);
        System.arraycopy(from.granaryRequisitioned, 0, to.granaryRequisitioned, 0, GoodType.COUNT);
        System.arraycopy(from.tradeBought, 0, to.tradeBought, 0, GoodType.COUNT);
        System.arraycopy(from.tradeSold, 0, to.tradeSold, 0, GoodType.COUNT);
    }

    @Override
    public String toString() {
        return String.format("CountyEconomy[%d: pop=%.0f, food=%.1f, satisfaction=%.3f, treasury=%.2f]",
            countyId, population, stock[GoodType.FOOD.ordinal()], basicSatisfaction, treasury);
    }
}
