package org.carma.feudal.mechanism;

import org.carma.feudal.event.Event;
import org.carma.feudal.model.*;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationSettings;
import org.carma.feudal.simulation.SimulationState;
import org.carma.feudal.simulation.TickIntervals;
import org.carma.feudal.simulation.TickSystem;

/**
 * Feudal redistribution, daily: goods flow up as tax and down as relief, crowns flow
 * up as monetary tax and down as admin wages, and the crown mints its precious ore.
 *
 * Phases, in order:
 * 1. County admin consumption (shortfall raises the realm deficit)
 * 2. Precious ore moves from counties to the realm
 * 3. Ducal goods tax on county surplus above {@code surplusDays} of need
 * 4. Royal goods tax on provincial stockpiles
 * 5. Royal relief to provinces in deficit
 * 6. Ducal relief to counties in deficit
 * 7. Monetary tax: counties to province, provinces to realm
 * 8. Admin wages paid back to counties by population share
 * 9. Realm admin consumption (shortfall raises the realm deficit)
 * 10. Ducal granary requisition of food
 * 11. Minting
 *
 * Every transfer is clamped to the payer's balance.
 */
public class FiscalSystem implements TickSystem {

    @Override
    public String name() {
        return "fiscal";
    }

    @Override
    public int tickInterval() {
        return TickIntervals.DAILY;
    }

    @Override
    public void tick(SimulationState state, WorldTopology topology) {
        EconomyState economy = state.getEconomy();
        SimulationSettings settings = state.getSettings();

        resetAccumulators(economy);

        countyAdminConsumption(economy, topology);
        collectPreciousMetals(economy, topology);
        ducalGoodsTax(economy, topology, settings);
        royalGoodsTax(economy, topology, settings);
        royalRelief(economy, topology);
        ducalRelief(economy, topology);
        monetaryTax(economy, topology, settings);
        adminWages(economy, topology, state.getCatalog());
        realmAdminConsumption(economy, topology);
        granaryRequisition(economy, topology, settings);
        mint(state);
    }

    private static void resetAccumulators(EconomyState economy) {
        for (CountyEconomy c : economy.counties()) c.resetFiscalAccumulators();
        for (ProvinceEconomy p : economy.provinces()) p.resetDailyAccumulators();
        for (RealmEconomy r : economy.realms()) r.resetDailyAccumulators();
    }

    // ========================================================================
    // Goods: admin, metals, tax
    // ========================================================================

    static void countyAdminConsumption(EconomyState economy, WorldTopology topology) {
        for (GoodType good : GoodType.values()) {
            double perPop = good.getCountyAdminPerPop();
            if (perPop <= 0) continue;
            int g = good.ordinal();
            for (CountyEconomy county : economy.counties()) {
                double need = county.population * perPop;
                double consumed = county.withdraw(good, need);
                if (consumed < need) {
                    economy.realm(topology.realmOfCounty(county.getCountyId())).deficit[g] += need - consumed;
                }
            }
        }
    }

    static void collectPreciousMetals(EconomyState economy, WorldTopology topology) {
        for (CountyEconomy county : economy.counties()) {
            RealmEconomy realm = economy.realm(topology.realmOfCounty(county.getCountyId()));
            for (GoodType good : GoodType.values()) {
                if (!good.isPreciousMetal()) continue;
                int g = good.ordinal();
                double amount = county.stock[g];
                if (amount <= 0) continue;
                county.stock[g] = 0.0;
                county.taxPaid[g] += amount;
                realm.stockpile[g] += amount;
                realm.taxCollected[g] += amount;
            }
        }
    }

    static void ducalGoodsTax(EconomyState economy, WorldTopology topology, SimulationSettings settings) {
        double rate = settings.getDucalTaxRate();
        double days = settings.getSurplusDays();
        for (CountyEconomy county : economy.counties()) {
            ProvinceEconomy province = economy.province(topology.provinceOf(county.getCountyId()));
            for (GoodType good : GoodType.values()) {
                if (good.isPreciousMetal()) continue;
                int g = good.ordinal();
                double surplus = county.stock[g] - county.dailyNeed(good) * days;
                if (surplus <= 0) continue;
                double tax = rate * surplus;
                county.stock[g] -= tax;
                county.taxPaid[g] += tax;
                province.stockpile[g] += tax;
                province.taxCollected[g] += tax;
            }
        }
    }

    static void royalGoodsTax(EconomyState economy, WorldTopology topology, SimulationSettings settings) {
        double rate = settings.getRoyalTaxRate();
        for (ProvinceEconomy province : economy.provinces()) {
            RealmEconomy realm = economy.realm(topology.realmOfProvince(province.getProvinceId()));
            for (GoodType good : GoodType.values()) {
                int g = good.ordinal();
                double tax = rate * province.stockpile[g];
                if (tax <= 0) continue;
                province.stockpile[g] -= tax;
                realm.stockpile[g] += tax;
                realm.taxCollected[g] += tax;
            }
        }
    }

    // ========================================================================
    // Goods: relief
    // ========================================================================

    /**
     * Realm stockpile to provinces, pro-rata to each province's uncovered county shortfall.
     */
    static void royalRelief(EconomyState economy, WorldTopology topology) {
        CountyEconomy[] counties = economy.counties();
        double[] provinceDeficit = new double[topology.provinceCount()];

        for (GoodType good : GoodType.values()) {
            if (good.getConsumptionPerPop() <= 0) continue;
            int g = good.ordinal();

            for (int r = 0; r < topology.realmCount(); r++) {
                RealmEconomy realm = economy.realm(r);
                double available = realm.stockpile[g];
                if (available <= 0) continue;

                double total = 0.0;
                for (int p : topology.provincesOfRealm(r)) {
                    double shortfall = 0.0;
                    for (int c : topology.countiesOfProvince(p)) {
                        shortfall += countyShortfall(counties[c], good);
                    }
                    provinceDeficit[p] = Math.max(0.0, shortfall - economy.province(p).stockpile[g]);
                    total += provinceDeficit[p];
                }
                if (total <= 0) continue;

                double ratio = Math.min(1.0, available / total);
                for (int p : topology.provincesOfRealm(r)) {
                    double relief = Math.min(provinceDeficit[p] * ratio, realm.stockpile[g]);
                    if (relief <= 0) continue;
                    realm.stockpile[g] -= relief;
                    realm.reliefGiven[g] += relief;
                    economy.province(p).stockpile[g] += relief;
                }
            }
        }
    }

    /**
     * Provincial stockpile to counties, pro-rata to each county's shortfall.
     */
    static void ducalRelief(EconomyState economy, WorldTopology topology) {
        CountyEconomy[] counties = economy.counties();

        for (GoodType good : GoodType.values()) {
            if (good.getConsumptionPerPop() <= 0) continue;
            int g = good.ordinal();

            for (int p = 0; p < topology.provinceCount(); p++) {
                ProvinceEconomy province = economy.province(p);
                double available = province.stockpile[g];
                if (available <= 0) continue;

                int[] members = topology.countiesOfProvince(p);
                double total = 0.0;
                for (int c : members) total += countyShortfall(counties[c], good);
                if (total <= 0) continue;

                double ratio = Math.min(1.0, available / total);
                for (int c : members) {
                    double relief = Math.min(countyShortfall(counties[c], good) * ratio, province.stockpile[g]);
                    if (relief <= 0) continue;
                    province.stockpile[g] -= relief;
                    province.reliefGiven[g] += relief;
                    counties[c].stock[g] += relief;
                    counties[c].relief[g] += relief;
                }
            }
        }
    }

    static double countyShortfall(CountyEconomy county, GoodType good) {
        return Math.max(0.0, county.dailyNeed(good) - county.stock[good.ordinal()]);
    }

    // ========================================================================
    // Crowns: tax and wages
    // ========================================================================

    static void monetaryTax(EconomyState economy, WorldTopology topology, SimulationSettings settings) {
        double[] prices = economy.marketPrices;

        for (CountyEconomy county : economy.counties()) {
            ProvinceEconomy province = economy.province(topology.provinceOf(county.getCountyId()));
            double productionValue = 0.0;
            for (int g = 0; g < GoodType.COUNT; g++) {
                productionValue += county.production[g] * prices[g];
            }
            double tax = Math.min(productionValue * settings.getProductionTaxRate(), county.treasury);
            if (tax <= 0) continue;
            county.treasury -= tax;
            county.monetaryTaxPaid += tax;
            province.treasury += tax;
            province.monetaryTaxCollected += tax;
        }

        for (ProvinceEconomy province : economy.provinces()) {
            RealmEconomy realm = economy.realm(topology.realmOfProvince(province.getProvinceId()));
            double tax = Math.min(province.monetaryTaxCollected * settings.getRoyalRevenueShare(), province.treasury);
            if (tax <= 0) continue;
            province.treasury -= tax;
            province.monetaryTaxPaidToRealm += tax;
            realm.treasury += tax;
            realm.monetaryTaxCollected += tax;
        }
    }

    /**
     * Provinces and realms pay administrators, who live in the counties.
     * Wage per head is the base-price value of the admin goods basket.
     */
    static void adminWages(EconomyState economy, WorldTopology topology, GoodCatalog catalog) {
        double provincePerPop = 0.0;
        double realmPerPop = 0.0;
        for (GoodType good : GoodType.values()) {
            provincePerPop += good.getCountyAdminPerPop() * catalog.basePrice(good);
            realmPerPop += good.getRealmAdminPerPop() * catalog.basePrice(good);
        }
        CountyEconomy[] counties = economy.counties();

        for (ProvinceEconomy province : economy.provinces()) {
            int p = province.getProvinceId();
            double pop = topology.provincePopulation(p, counties);
            double cost = Math.min(pop * provincePerPop, province.treasury);
            if (cost <= 0 || pop <= 0) continue;
            province.treasury -= cost;
            province.adminCrownsCost += cost;
            for (int c : topology.countiesOfProvince(p)) {
                counties[c].treasury += cost * counties[c].population / pop;
            }
        }

        for (RealmEconomy realm : economy.realms()) {
            int r = realm.getRealmId();
            double pop = topology.realmPopulation(r, counties);
            double cost = Math.min(pop * realmPerPop, realm.treasury);
            if (cost <= 0 || pop <= 0) continue;
            realm.treasury -= cost;
            realm.adminCrownsCost += cost;
            for (int c : topology.countiesOfRealm(r)) {
                counties[c].treasury += cost * counties[c].population / pop;
            }
        }
    }

    static void realmAdminConsumption(EconomyState economy, WorldTopology topology) {
        CountyEconomy[] counties = economy.counties();
        for (RealmEconomy realm : economy.realms()) {
            double pop = topology.realmPopulation(realm.getRealmId(), counties);
            for (GoodType good : GoodType.values()) {
                double perPop = good.getRealmAdminPerPop();
                if (perPop <= 0) continue;
                int g = good.ordinal();
                double need = pop * perPop;
                double consumed = Math.min(realm.stockpile[g], need);
                realm.stockpile[g] -= consumed;
                if (consumed < need) realm.deficit[g] += need - consumed;
            }
        }
    }

    // ========================================================================
    // Granary
    // ========================================================================

    /**
     * The duke buys food from counties holding more than a day's need, at a discount,
     * closing a fraction of the gap to the granary target each day.
     */
    static void granaryRequisition(EconomyState economy, WorldTopology topology, SimulationSettings settings) {
        GoodType food = GoodType.FOOD;
        int g = food.ordinal();
        CountyEconomy[] counties = economy.counties();
        double unitCost = economy.marketPrices[g] * settings.getGranaryDiscount();

        for (ProvinceEconomy province : economy.provinces()) {
            int p = province.getProvinceId();
            double pop = topology.provincePopulation(p, counties);
            double target = settings.getGranaryDaysBuffer() * pop * food.getConsumptionPerPop();
            double gap = target - province.stockpile[g];
            if (gap <= 0) continue;

            double fill = gap * settings.getGranaryFillRate();
            if (unitCost > 0) fill = Math.min(fill, province.treasury / unitCost);
            if (fill <= 0) continue;

            int[] members = topology.countiesOfProvince(p);
            double totalSurplus = 0.0;
            for (int c : members) {
                totalSurplus += Math.max(0.0, counties[c].stock[g] - counties[c].dailyNeed(food));
            }
            if (totalSurplus <= 0) continue;

            double ratio = Math.min(1.0, fill / totalSurplus);
            double collected = 0.0;
            for (int c : members) {
                CountyEconomy county = counties[c];
                double surplus = county.stock[g] - county.dailyNeed(food);
                if (surplus <= 0) continue;
                double take = surplus * ratio;
                double payment = take * unitCost;
                county.stock[g] -= take;
                county.granaryRequisitioned[g] += take;
                county.treasury += payment;
                county.granaryRequisitionCrownsReceived += payment;
                collected += take;
            }

            double cost = Math.min(collected * unitCost, province.treasury);
            province.treasury -= cost;
            province.granaryRequisitionCrownsSpent += cost;
            province.stockpile[g] += collected;
            province.granaryRequisitioned[g] += collected;
        }
    }

    // ========================================================================
    // Minting
    // ========================================================================

    static void mint(SimulationState state) {
        SimulationSettings settings = state.getSettings();
        int gold = GoodType.GOLD_ORE.ordinal();
        int silver = GoodType.SILVER_ORE.ordinal();

        for (RealmEconomy realm : state.getEconomy().realms()) {
            double goldKg = realm.stockpile[gold];
            double silverKg = realm.stockpile[silver];
            realm.stockpile[gold] = 0.0;
            realm.stockpile[silver] = 0.0;

            double crowns = goldKg * settings.crownsPerGoldOre() + silverKg * settings.crownsPerSilverOre();
            realm.treasury += crowns;
            realm.goldMinted = goldKg;
            realm.silverMinted = silverKg;
            realm.crownsMinted = crowns;

            if (crowns > 0) {
                state.getEventBus().publish(new Event.CurrencyMintedEvent(
                    state.getDay(), realm.getRealmId(), goldKg, silverKg, crowns));
            }
        }
    }
}
