package org.carma.feudal.model;

import java.util.Arrays;

/**
 * Per-province runtime economic state. The duke's granary and purse.
 */
public class ProvinceEconomy {

    private final int provinceId;

    /** Goods held in the provincial granary. */
    public final double[] stockpile = new double[GoodType.COUNT];

    public final double[] taxCollected = new double[GoodType.COUNT];
    public final double[] reliefGiven = new double[GoodType.COUNT];
    public final double[] granaryRequisitioned = new double[GoodType.COUNT];

    public double treasury;
    public double monetaryTaxCollected;
    public double monetaryTaxPaidToRealm;
    public double adminCrownsCost;
    public double granaryRequisitionCrownsSpent;
    public double tradeTollsCollected;

    public ProvinceEconomy(int provinceId) {
        if (provinceId < 0) throw new IllegalArgumentException("Province ID cannot be negative");
        this.provinceId = provinceId;
    }

    public int getProvinceId() {
        return provinceId;
    }

    public void resetDailyAccumulators() {
        Arrays.fill(taxCollected, 0.0);
        Arrays.fill(reliefGiven, 0.0);
        Arrays.fill(granaryRequisitioned, 0.0);
        monetaryTaxCollected = 0.0;
        monetaryTaxPaidToRealm = 0.0;
        adminCrownsCost = 0.0;
        granaryRequisitionCrownsSpent = 0.0;
        tradeTollsCollected = 0.0;
    }

    public ProvinceEconomy copy() {
        ProvinceEconomy p = new ProvinceEconomy(provinceId);
        System.arraycopy(stockpile, 0, p.stockpile, 0, GoodType.COUNT);
        System.arraycopy(taxCollected, 0, p.taxCollected, 0, GoodType.COUNT);
        System.arraycopy(reliefGiven, 0, p.reliefGiven, 0, GoodType.COUNT);
        System.arraycopy(granaryRequisitioned, 0, p.granaryRequisitioned, 0, GoodType.COUNT);
        p.treasury = treasury;
        p.monetaryTaxCollected = monetaryTaxCollected;
        p.monetaryTaxPaidToRealm = monetaryTaxPaidToRealm;
        p.adminCrownsCost = adminCrownsCost;
        p.granaryRequisitionCrownsSpent = granaryRequisitionCrownsSpent;
        p.tradeTollsCollected = tradeTollsCollected;
        return p;
    }

    @Override
    public String toString() {
        return String.format("ProvinceEconomy[%d: food=%.1f, treasury=%.2f]",
            provinceId, stockpile[GoodType.FOOD.ordinal()], treasury);
    }
}
