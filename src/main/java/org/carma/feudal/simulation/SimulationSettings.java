package org.carma.feudal.simulation;

/**
 * Tunable rates and windows for the tick systems.
 *
 * Defaults reproduce the standard economy; {@code simulation.yaml} overrides any subset.
 */
public class SimulationSettings {

    // Production & consumption
    private int satisfactionWindow = 30;
    private double distressThreshold = 0.5;

    // Facilities
    private double efficiencyAlpha = 0.7;

    // Goods tax and relief
    private double surplusDays = 7.0;
    private double ducalTaxRate = 0.20;
    private double royalTaxRate = 0.20;

    // Monetary tax
    private double productionTaxRate = 0.013;
    private double royalRevenueShare = 0.40;

    // Ducal granary
    private double granaryDaysBuffer = 7.0;
    private double granaryDiscount = 0.60;
    private double granaryFillRate = 0.05;

    // Trade
    private double crossProvinceTollRate = 0.05;
    private double crossRealmTariffRate = 0.0;

    // Minting
    private double goldSmeltingYield = 0.01;
    private double silverSmeltingYield = 0.05;
    private double crownsPerKgGold = 1000.0;
    private double crownsPerKgSilver = 100.0;

    // Runtime
    private int snapshotCapacity = 3650;
    private boolean strictInvariants = true;

    public static SimulationSettings defaults() {
        return new SimulationSettings();
    }

    // ========================================================================
    // Builder-style setters
    // ========================================================================

    public SimulationSettings setSatisfactionWindow(int days) {
        if (days <= 0) throw new IllegalArgumentException("Satisfaction window must be positive");
        this.satisfactionWindow = days;
        return this;
    }

    public SimulationSettings setDistressThreshold(double threshold) {
        this.distressThreshold = requireFraction("distressThreshold", threshold);
        return this;
    }

    public SimulationSettings setEfficiencyAlpha(double alpha) {
        if (alpha <= 0) throw new IllegalArgumentException("Efficiency alpha must be positive");
        this.efficiencyAlpha = alpha;
        return this;
    }

    public SimulationSettings setSurplusDays(double days) {
        this.surplusDays = requireNonNegative("surplusDays", days);
        return this;
    }

    public SimulationSettings setDucalTaxRate(double rate) {
        this.ducalTaxRate = requireFraction("ducalTaxRate", rate);
        return this;
    }

    public SimulationSettings setRoyalTaxRate(double rate) {
        this.royalTaxRate = requireFraction("royalTaxRate", rate);
        return this;
    }

    public SimulationSettings setProductionTaxRate(double rate) {
        this.productionTaxRate = requireFraction("productionTaxRate", rate);
        return this;
    }

    public SimulationSettings setRoyalRevenueShare(double share) {
        this.royalRevenueShare = requireFraction("royalRevenueShare", share);
        return this;
    }

    public SimulationSettings setGranaryDaysBuffer(double days) {
        this.granaryDaysBuffer = requireNonNegative("granaryDaysBuffer", days);
        return this;
    }

    public SimulationSettings setGranaryDiscount(double discount) {
        this.granaryDiscount = requireFraction("granaryDiscount", discount);
        return this;
    }

    public SimulationSettings setGranaryFillRate(double rate) {
        this.granaryFillRate = requireFraction("granaryFillRate", rate);
        return this;
    }

    public SimulationSettings setCrossProvinceTollRate(double rate) {
        this.crossProvinceTollRate = requireFraction("crossProvinceTollRate", rate);
        return this;
    }

    public SimulationSettings setCrossRealmTariffRate(double rate) {
        this.crossRealmTariffRate = requireFraction("crossRealmTariffRate", rate);
        return this;
    }

    public SimulationSettings setGoldSmeltingYield(double yield) {
        this.goldSmeltingYield = requireFraction("goldSmeltingYield", yield);
        return this;
    }

    public SimulationSettings setSilverSmeltingYield(double yield) {
        this.silverSmeltingYield = requireFraction("silverSmeltingYield", yield);
        return this;
    }

    public SimulationSettings setCrownsPerKgGold(double crowns) {
        this.crownsPerKgGold = requireNonNegative("crownsPerKgGold", crowns);
        return this;
    }

    public SimulationSettings setCrownsPerKgSilver(double crowns) {
        this.crownsPerKgSilver = requireNonNegative("crownsPerKgSilver", crowns);
        return this;
    }

    public SimulationSettings setSnapshotCapacity(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("Snapshot capacity must be positive");
        this.snapshotCapacity = capacity;
        return this;
    }

    public SimulationSettings setStrictInvariants(boolean strict) {
        this.strictInvariants = strict;
        return this;
    }

    private static double requireFraction(String name, double value) {
        if (value < 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be in [0, 1]: " + value);
        }
        return value;
    }

    private static double requireNonNegative(String name, double value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + value);
        }
        return value;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int getSatisfactionWindow() { return satisfactionWindow; }
    public double getDistressThreshold() { return distressThreshold; }
    public double getEfficiencyAlpha() { return efficiencyAlpha; }
    public double getSurplusDays() { return surplusDays; }
    public double getDucalTaxRate() { return ducalTaxRate; }
    public double getRoyalTaxRate() { return royalTaxRate; }
    public double getProductionTaxRate() { return productionTaxRate; }
    public double getRoyalRevenueShare() { return royalRevenueShare; }
    public double getGranaryDaysBuffer() { return granaryDaysBuffer; }
    public double getGranaryDiscount() { return granaryDiscount; }
    public double getGranaryFillRate() { return granaryFillRate; }
    public double getCrossProvinceTollRate() { return crossProvinceTollRate; }
    public double getCrossRealmTariffRate() { return crossRealmTariffRate; }
    public double getGoldSmeltingYield() { return goldSmeltingYield; }
    public double getSilverSmeltingYield() { return silverSmeltingYield; }
    public double getCrownsPerKgGold() { return crownsPerKgGold; }
    public double getCrownsPerKgSilver() { return crownsPerKgSilver; }
    public int getSnapshotCapacity() { return snapshotCapacity; }
    public boolean isStrictInvariants() { return strictInvariants; }

    /**
     * Crowns produced by one kg of gold ore.
     */
    public double crownsPerGoldOre() {
        return goldSmeltingYield * crownsPerKgGold;
    }

    /**
     * Crowns produced by one kg of silver ore.
     */
    public double crownsPerSilverOre() {
        return silverSmeltingYield * crownsPerKgSilver;
    }

    @Override
    public String toString() {
        return String.format("SimulationSettings[window=%d, alpha=%.2f, ducalTax=%.2f, royalTax=%.2f, toll=%.2f]",
            satisfactionWindow, efficiencyAlpha, ducalTaxRate, royalTaxRate, crossProvinceTollRate);
    }
}
