package org.carma.feudal.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only feudal hierarchy: county → province → realm membership.
 *
 * Ids are dense indices: counties 0..countyCount-1, and likewise for provinces and
 * realms. Tier records live in separate arrays addressed by the same indices, so the
 * topology never aliases economic state.
 *
 * Membership lists are in ascending id order; a realm's counties are listed province
 * by province. This fixes iteration order for every system that walks the hierarchy.
 */
public final class WorldTopology {

    private final int[] countyProvince;
    private final int[] countySeatCell;
    private final int[] provinceRealm;
    private final int[][] provinceCounties;
    private final int[][] realmProvinces;
    private final int[][] realmCounties;

    private WorldTopology(Builder builder) {
        int realmCount = builder.realmCount;
        int provinceCount = builder.provinceRealm.size();
        int countyCount = builder.countyProvince.size();

        this.countyProvince = new int[countyCount];
        this.countySeatCell = new int[countyCount];
        for (int c = 0; c < countyCount; c++) {
            countyProvince[c] = builder.countyProvince.get(c);
            countySeatCell[c] = builder.countySeatCell.get(c);
        }

        this.provinceRealm = new int[provinceCount];
        for (int p = 0; p < provinceCount; p++) {
            provinceRealm[p] = builder.provinceRealm.get(p);
        }

        List<List<Integer>> provLists = new ArrayList<>();
        for (int p = 0; p < provinceCount; p++) provLists.add(new ArrayList<>());
        for (int c = 0; c < countyCount; c++) provLists.get(countyProvince[c]).add(c);

        List<List<Integer>> realmProvLists = new ArrayList<>();
        List<List<Integer>> realmCountyLists = new ArrayList<>();
        for (int r = 0; r < realmCount; r++) {
            realmProvLists.add(new ArrayList<>());
            realmCountyLists.add(new ArrayList<>());
        }
        for (int p = 0; p < provinceCount; p++) {
            realmProvLists.get(provinceRealm[p]).add(p);
            realmCountyLists.get(provinceRealm[p]).addAll(provLists.get(p));
        }

        this.provinceCounties = toArrays(provLists);
        this.realmProvinces = toArrays(realmProvLists);
        this.realmCounties = toArrays(realmCountyLists);
    }

    private static int[][] toArrays(List<List<Integer>> lists) {
        int[][] result = new int[lists.size()][];
        for (int i = 0; i < lists.size(); i++) {
            result[i] = lists.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Sizes
    // ========================================================================

    public int countyCount() { return countyProvince.length; }
    public int provinceCount() { return provinceRealm.length; }
    public int realmCount() { return realmProvinces.length; }

    // ========================================================================
    // Membership
    // ========================================================================

    public int provinceOf(int countyId) { return countyProvince[countyId]; }
    public int realmOfProvince(int provinceId) { return provinceRealm[provinceId]; }
    public int realmOfCounty(int countyId) { return provinceRealm[countyProvince[countyId]]; }

    /** Seat cell of a county, or -1 if the map supplied none. */
    public int seatCellOf(int countyId) { return countySeatCell[countyId]; }

    public int[] countiesOfProvince(int provinceId) { return provinceCounties[provinceId].clone(); }
    public int[] provincesOfRealm(int realmId) { return realmProvinces[realmId].clone(); }
    public int[] countiesOfRealm(int realmId) { return realmCounties[realmId].clone(); }

    // ========================================================================
    // Population aggregates
    // ========================================================================

    public double provincePopulation(int provinceId, CountyEconomy[] counties) {
        double total = 0.0;
        for (int c : provinceCounties[provinceId]) total += counties[c].population;
        return total;
    }

    public double realmPopulation(int realmId, CountyEconomy[] counties) {
        double total = 0.0;
        for (int c : realmCounties[realmId]) total += counties[c].population;
        return total;
    }

    @Override
    public String toString() {
        return String.format("WorldTopology[realms=%d, provinces=%d, counties=%d]",
            realmCount(), provinceCount(), countyCount());
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Builds a topology from dense, in-order id declarations.
     * Realms first, then provinces, then counties.
     */
    public static class Builder {
        private int realmCount;
        private final List<Integer> provinceRealm = new ArrayList<>();
        private final List<Integer> countyProvince = new ArrayList<>();
        private final List<Integer> countySeatCell = new ArrayList<>();

        /**
         * Declare a realm.
         * @return its id
         */
        public int addRealm() {
            return realmCount++;
        }

        /**
         * Declare a province belonging to an existing realm.
         * @return its id
         */
        public int addProvince(int realmId) {
            if (realmId < 0 || realmId >= realmCount) {
                throw new IllegalArgumentException("Province refers to unknown realm: " + realmId);
            }
            provinceRealm.add(realmId);
            return provinceRealm.size() - 1;
        }

        public int addCounty(int provinceId) {
            return addCounty(provinceId, -1);
        }

        /**
         * Declare a county belonging to an existing province.
         * @return its id
         */
        public int addCounty(int provinceId, int seatCellId) {
            if (provinceId < 0 || provinceId >= provinceRealm.size()) {
                throw new IllegalArgumentException("County refers to unknown province: " + provinceId);
            }
            countyProvince.add(provinceId);
            countySeatCell.add(seatCellId);
            return countyProvince.size() - 1;
        }

        public WorldTopology build() {
            return new WorldTopology(this);
        }
    }
}
