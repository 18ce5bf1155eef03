package org.carma.feudal.model;

/**
 * One day's aggregate view of the whole economy. Immutable once built.
 *
 * Per-good arrays are indexed by {@link GoodType#ordinal()}; accessors return copies.
 */
public final class EconomySnapshot {

    private final int day;

    // Per-good totals
    private final double[] countyStock;
    private final double[] countyProduction;
    private final double[] countyConsumption;
    private final double[] countyUnmetNeed;
    private final double[] countyTaxPaid;
    private final double[] countyRelief;
    private final double[] tradeBought;
    private final double[] provincialStockpile;
    private final double[] royalStockpile;
    private final double[] realmDeficit;
    private final double[] realmImports;
    private final double[] realmExports;
    private final double[] marketPrices;

    // County classification
    private final int surplusCounties;
    private final int deficitCounties;
    private final int starvingCounties;
    private final int distressedCounties;

    // Currency
    private final double countyTreasury;
    private final double provinceTreasury;
    private final double realmTreasury;
    private final double goldMinted;
    private final double silverMinted;
    private final double crownsMinted;
    private final double monetaryTaxToProvince;
    private final double monetaryTaxToRealm;
    private final double adminCrownsCost;
    private final double tradeSpending;
    private final double tradeRevenue;
    private final double tradeTolls;
    private final double tradeTariffs;

    // Population
    private final double population;
    private final double meanSatisfaction;
    private final double minSatisfaction;
    private final double maxSatisfaction;
    private final double births;
    private final double deaths;
    private final double facilityWorkers;

    // Order flow
    private final int buyOrderCount;
    private final int lotCount;

    private EconomySnapshot(Builder b) {
        this.day = b.day;
        this.countyStock = b.countyStock.clone();
        this.countyProduction = b.countyProduction.clone();
        this.countyConsumption = b.countyConsumption.clone();
        this.countyUnmetNeed = b.countyUnmetNeed.clone();
        this.countyTaxPaid = b.countyTaxPaid.clone();
        this.countyRelief = b.countyRelief.clone();
        this.tradeBought = b.tradeBought.clone();
        this.provincialStockpile = b.provincialStockpile.clone();
        this.royalStockpile = b.royalStockpile.clone();
        this.realmDeficit = b.realmDeficit.clone();
        this.realmImports = b.realmImports.clone();
        this.realmExports = b.realmExports.clone();
        this.marketPrices = b.marketPrices.clone();
        this.surplusCounties = b.surplusCounties;
        this.deficitCounties = b.deficitCounties;
        this.starvingCounties = b.starvingCounties;
        this.distressedCounties = b.distressedCounties;
        this.countyTreasury = b.countyTreasury;
        this.provinceTreasury = b.provinceTreasury;
        this.realmTreasury = b.realmTreasury;
        this.goldMinted = b.goldMinted;
        this.silverMinted = b.silverMinted;
        this.crownsMinted = b.crownsMinted;
        this.monetaryTaxToProvince = b.monetaryTaxToProvince;
        this.monetaryTaxToRealm = b.monetaryTaxToRealm;
        this.adminCrownsCost = b.adminCrownsCost;
        this.tradeSpending = b.tradeSpending;
        this.tradeRevenue = b.tradeRevenue;
        this.tradeTolls = b.tradeTolls;
        this.tradeTariffs = b.tradeTariffs;
        this.population = b.population;
        this.meanSatisfaction = b.meanSatisfaction;
        this.minSatisfaction = b.minSatisfaction;
        this.maxSatisfaction = b.maxSatisfaction;
        this.births = b.births;
        this.deaths = b.deaths;
        this.facilityWorkers = b.facilityWorkers;
        this.buyOrderCount = b.buyOrderCount;
        this.lotCount = b.lotCount;
    }

    public static Builder builder(int day) {
        return new Builder(day);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int getDay() { return day; }

    public double[] getCountyStock() { return countyStock.clone(); }
    public double[] getCountyProduction() { return countyProduction.clone(); }
    public double[] getCountyConsumption() { return countyConsumption.clone(); }
    public double[] getCountyUnmetNeed() { return countyUnmetNeed.clone(); }
    public double[] getCountyTaxPaid() { return countyTaxPaid.clone(); }
    public double[] getCountyRelief() { return countyRelief.clone(); }
    public double[] getTradeBought() { return tradeBought.clone(); }
    public double[] getProvincialStockpile() { return provincialStockpile.clone(); }
    public double[] getRoyalStockpile() { return royalStockpile.clone(); }
    public double[] getRealmDeficit() { return realmDeficit.clone(); }
    public double[] getRealmImports() { return realmImports.clone(); }
    public double[] getRealmExports() { return realmExports.clone(); }
    public double[] getMarketPrices() { return marketPrices.clone(); }

    public double countyStock(GoodType good) { return countyStock[good.ordinal()]; }
    public double countyProduction(GoodType good) { return countyProduction[good.ordinal()]; }
    public double countyConsumption(GoodType good) { return countyConsumption[good.ordinal()]; }
    public double countyUnmetNeed(GoodType good) { return countyUnmetNeed[good.ordinal()]; }
    public double marketPrice(GoodType good) { return marketPrices[good.ordinal()]; }

    /**
     * Stock of a good held across all three tiers.
     */
    public double totalStock(GoodType good) {
        int g = good.ordinal();
        return countyStock[g] + provincialStockpile[g] + royalStockpile[g];
    }

    public int getSurplusCounties() { return surplusCounties; }
    public int getDeficitCounties() { return deficitCounties; }
    public int getStarvingCounties() { return starvingCounties; }
    public int getDistressedCounties() { return distressedCounties; }

    public double getCountyTreasury() { return countyTreasury; }
    public double getProvinceTreasury() { return provinceTreasury; }
    public double getRealmTreasury() { return realmTreasury; }
    public double getTotalTreasury() { return countyTreasury + provinceTreasury + realmTreasury; }
    public double getGoldMinted() { return goldMinted; }
    public double getSilverMinted() { return silverMinted; }
    public double getCrownsMinted() { return crownsMinted; }
    public double getMonetaryTaxToProvince() { return monetaryTaxToProvince; }
    public double getMonetaryTaxToRealm() { return monetaryTaxToRealm; }
    public double getAdminCrownsCost() { return adminCrownsCost; }
    public double getTradeSpending() { return tradeSpending; }
    public double getTradeRevenue() { return tradeRevenue; }
    public double getTradeTolls() { return tradeTolls; }
    public double getTradeTariffs() { return tradeTariffs; }

    public double getPopulation() { return population; }
    public double getMeanSatisfaction() { return meanSatisfaction; }
    public double getMinSatisfaction() { return minSatisfaction; }
    public double getMaxSatisfaction() { return maxSatisfaction; }
    public double getBirths() { return births; }
    public double getDeaths() { return deaths; }
    public double getFacilityWorkers() { return facilityWorkers; }

    public int getBuyOrderCount() { return buyOrderCount; }
    public int getLotCount() { return lotCount; }

    @Override
    public String toString() {
        return String.format(
            "Day %d: pop=%.0f food=%.1f unmet=%.2f satisfaction=%.3f starving=%d treasury=%.1f minted=%.2f",
            day, population, totalStock(GoodType.FOOD), countyUnmetNeed(GoodType.FOOD),
            meanSatisfaction, starvingCounties, getTotalTreasury(), crownsMinted);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Mutable accumulator filled by the aggregator. Array fields are summed into directly.
     */
    public static class Builder {
        private final int day;

        public final double[] countyStock = new double[GoodType.COUNT];
        public final double[] countyProduction = new double[GoodType.COUNT];
        public final double[] countyConsumption = new double[GoodType.COUNT];
        public final double[] countyUnmetNeed = new double[GoodType.COUNT];
        public final double[] countyTaxPaid = new double[GoodType.COUNT];
        public final double[] countyRelief = new double[GoodType.COUNT];
        public final double[] tradeBought = new double[GoodType.COUNT];
        public final double[] provincialStockpile = new double[GoodType.COUNT];
        public final double[] royalStockpile = new double[GoodType.COUNT];
        public final double[] realmDeficit = new double[GoodType.COUNT];
        public final double[] realmImports = new double[GoodType.COUNT];
        public final double[] realmExports = new double[GoodType.COUNT];
        public final double[] marketPrices = new double[GoodType.COUNT];

        public int surplusCounties;
        public int deficitCounties;
        public int starvingCounties;
        public int distressedCounties;

        public double countyTreasury;
        public double provinceTreasury;
        public double realmTreasury;
        public double goldMinted;
        public double silverMinted;
        public double crownsMinted;
        public double monetaryTaxToProvince;
        public double monetaryTaxToRealm;
        public double adminCrownsCost;
        public double tradeSpending;
        public double tradeRevenue;
        public double tradeTolls;
        public double tradeTariffs;

        public double population;
        public double meanSatisfaction;
        public double minSatisfaction;
        public double maxSatisfaction;
        public double births;
        public double deaths;
        public double facilityWorkers;

        public int buyOrderCount;
        public int lotCount;

        private Builder(int day) {
            this.day = day;
        }

        public EconomySnapshot build() {
            return new EconomySnapshot(this);
        }
    }
}
