package org.carma.feudal.simulation;

import org.carma.feudal.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dense arena of tier records plus the facilities, market prices and order log.
 *
 * County, province and realm records are addressed by the ids in {@link WorldTopology}.
 * Facilities are kept in ascending id order.
 */
public class EconomyState {

    private final CountyEconomy[] counties;
    private final ProvinceEconomy[] provinces;
    private final RealmEconomy[] realms;
    private final List<Facility> facilities = new ArrayList<>();

    /** Last published inter-realm clearing price per good. */
    public final double[] marketPrices = new double[GoodType.COUNT];

    private final MarketLedger ledger;
    private int nextFacilityId = 1;

    public EconomyState(int countyCount, int provinceCount, int realmCount) {
        this.counties = new CountyEconomy[countyCount];
        this.provinces = new ProvinceEconomy[provinceCount];
        this.realms = new RealmEconomy[realmCount];
        for (int i = 0; i < countyCount; i++) counties[i] = new CountyEconomy(i);
        for (int i = 0; i < provinceCount; i++) provinces[i] = new ProvinceEconomy(i);
        for (int i = 0; i < realmCount; i++) realms[i] = new RealmEconomy(i);
        this.ledger = new MarketLedger();
    }

    /**
     * Fresh state sized for a topology, with market prices at catalog base prices.
     */
    public static EconomyState create(WorldTopology topology, GoodCatalog catalog) {
        EconomyState state = new EconomyState(
            topology.countyCount(), topology.provinceCount(), topology.realmCount());
        System.arraycopy(catalog.basePrices(), 0, state.marketPrices, 0, GoodType.COUNT);
        return state;
    }

    private EconomyState(EconomyState other) {
        this.counties = new CountyEconomy[other.counties.length];
        this.provinces = new ProvinceEconomy[other.provinces.length];
        this.realms = new RealmEconomy[other.realms.length];
        for (int i = 0; i < counties.length; i++) counties[i] = other.counties[i].copy();
        for (int i = 0; i < provinces.length; i++) provinces[i] = other.provinces[i].copy();
        for (int i = 0; i < realms.length; i++) realms[i] = other.realms[i].copy();
        for (Facility f : other.facilities) facilities.add(f.copy());
        System.arraycopy(other.marketPrices, 0, marketPrices, 0, GoodType.COUNT);
        this.ledger = other.ledger.copy();
        this.nextFacilityId = other.nextFacilityId;
    }

    // ========================================================================
    // Tier access
    // ========================================================================

    public CountyEconomy county(int id) { return counties[id]; }
    public ProvinceEconomy province(int id) { return provinces[id]; }
    public RealmEconomy realm(int id) { return realms[id]; }

    /**
     * The backing array. Systems index it directly; do not replace elements.
     */
    public CountyEconomy[] counties() { return counties; }
    public ProvinceEconomy[] provinces() { return provinces; }
    public RealmEconomy[] realms() { return realms; }

    // ========================================================================
    // Facilities
    // ========================================================================

    /**
     * Place a facility in a county and assign it the next id.
     */
    public Facility addFacility(FacilityDef def, int countyId, int cellId) {
        if (countyId < 0 || countyId >= counties.length) {
            throw new IllegalArgumentException("Unknown county: " + countyId);
        }
        Facility facility = new Facility(nextFacilityId++, def, cellId, countyId);
        facilities.add(facility);
        return facility;
    }

    public List<Facility> facilities() {
        return Collections.unmodifiableList(facilities);
    }

    public MarketLedger ledger() {
        return ledger;
    }

    /**
     * Deep copy of every record, facility and price.
     */
    public EconomyState copy() {
        return new EconomyState(this);
    }

    @Override
    public String toString() {
        return String.format("EconomyState[counties=%d, provinces=%d, realms=%d, facilities=%d]",
            counties.length, provinces.length, realms.length, facilities.size());
    }
}
