package org.carma.feudal.model;

import java.util.Arrays;

/**
 * Per-realm runtime economic state. The king's reserve and treasury.
 *
 * The trade working set (deficit, imports, exports, spending, revenue) is reset
 * daily by the fiscal pipeline and filled by the deficit scan and market clearing.
 */
public class RealmEconomy {

    private final int realmId;

    /** Royal reserve: precious metals awaiting the mint plus staple overflow. */
    public final double[] stockpile = new double[GoodType.COUNT];

    /** Unmet demand after internal redistribution. The market's buy signal. */
    public final double[] deficit = new double[GoodType.COUNT];

    public final double[] tradeImports = new double[GoodType.COUNT];
    public final double[] tradeExports = new double[GoodType.COUNT];
    public final double[] taxCollected = new double[GoodType.COUNT];
    public final double[] reliefGiven = new double[GoodType.COUNT];

    public double treasury;

    /** Kg of ore minted this tick. */
    public double goldMinted;
    public double silverMinted;

    /** Crowns created this tick. */
    public double crownsMinted;

    public double monetaryTaxCollected;
    public double adminCrownsCost;

    public double tradeSpending;
    public double tradeRevenue;
    public double tradeTariffsCollected;

    public RealmEconomy(int realmId) {
        if (realmId < 0) throw new IllegalArgumentException("Realm ID cannot be negative");
        this.realmId = realmId;
    }

    public int getRealmId() {
        return realmId;
    }

    public void resetDailyAccumulators() {
        Arrays.fill(deficit, 0.0);
        Arrays.fill(tradeImports, 0.0);
        Arrays.fill(tradeExports, 0.0);
        Arrays.fill(taxCollected, 0.0);
        Arrays.fill(reliefGiven, 0.0);
        goldMinted = 0.0;
        silverMinted = 0.0;
        crownsMinted = 0.0;
        monetaryTaxCollected = 0.0;
        adminCrownsCost = 0.0;
        tradeSpending = 0.0;
        tradeRevenue = 0.0;
        tradeTariffsCollected = 0.0;
    }

    public RealmEconomy copy() {
        RealmEconomy r = new RealmEconomy(realmId);
        System.arraycopy(stockpile, 0, r.stockpile, 0, GoodType.COUNT);
        System.arraycopy(deficit, 0, r.deficit, 0, GoodType.COUNT);
        System.arraycopy(tradeImports, 0, r.tradeImports, 0, GoodType.COUNT);
        System.arraycopy(tradeExports, 0, r.tradeExports, 0, GoodType.COUNT);
        System.arraycopy(taxCollected, 0, r.taxCollected, 0, GoodType.COUNT);
        System.arraycopy(reliefGiven, 0, r.reliefGiven, 0, GoodType.COUNT);
        r.treasury = treasury;
        r.goldMinted = goldMinted;
        r.silverMinted = silverMinted;
        r.crownsMinted = crownsMinted;
        r.monetaryTaxCollected = monetaryTaxCollected;
        r.adminCrownsCost = adminCrownsCost;
        r.tradeSpending = tradeSpending;
        r.tradeRevenue = tradeRevenue;
        r.tradeTariffsCollected = tradeTariffsCollected;
        return r;
    }

    @Override
    public String toString() {
        return String.format("RealmEconomy[%d: treasury=%.2f, minted=%.2f, spending=%.2f, revenue=%.2f]",
            realmId, treasury, crownsMinted, tradeSpending, tradeRevenue);
    }
}
