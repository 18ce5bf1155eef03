package org.carma.feudal.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TierRecordTest {

    private static final int FOOD = GoodType.FOOD.ordinal();

    @Test
    void everyPerGoodArrayCoversAllGoods() {
        CountyEconomy c = new CountyEconomy(0);
        assertEquals(GoodType.COUNT, c.stock.length);
        assertEquals(GoodType.COUNT, c.facilityQuota.length);
        assertEquals(GoodType.COUNT, new ProvinceEconomy(0).granaryRequisitioned.length);
        assertEquals(GoodType.COUNT, new RealmEconomy(0).deficit.length);
    }

    @Test
    void withdrawNeverTakesMoreThanStock() {
        CountyEconomy c = new CountyEconomy(0);
        c.stock[FOOD] = 5;

        assertEquals(5.0, c.withdraw(GoodType.FOOD, 8), 1e-9);
        assertEquals(0.0, c.stock[FOOD], 1e-9);
        assertEquals(0.0, c.withdraw(GoodType.FOOD, -3), 1e-9);
    }

    @Test
    void fiscalResetKeepsStocksAndTreasury() {
        CountyEconomy c = new CountyEconomy(0);
        c.stock[FOOD] = 10;
        c.treasury = 4;
        c.taxPaid[FOOD] = 2;
        c.tradeBought[FOOD] = 3;
        c.tradeTollsPaid = 1;

        c.resetFiscalAccumulators();

        assertEquals(10.0, c.stock[FOOD], 1e-9);
        assertEquals(4.0, c.treasury, 1e-9);
        assertEquals(0.0, c.taxPaid[FOOD], 1e-9);
        assertEquals(0.0, c.tradeBought[FOOD], 1e-9);
        assertEquals(0.0, c.tradeTollsPaid, 1e-9);
    }

    @Test
    void monthlyResetClearsDemographics() {
        CountyEconomy c = new CountyEconomy(0);
        c.birthsThisMonth = 3;
        c.deathsThisMonth = 2;
        c.netMigrationThisMonth = -1;

        c.resetMonthlyDemographics();

        assertEquals(0.0, c.birthsThisMonth + c.deathsThisMonth + c.netMigrationThisMonth, 1e-9);
    }

    @Test
    void realmResetClearsTradeWorkingSetButNotReserve() {
        RealmEconomy r = new RealmEconomy(0);
        r.stockpile[FOOD] = 50;
        r.treasury = 20;
        r.deficit[FOOD] = 5;
        r.crownsMinted = 7;
        r.tradeSpending = 3;

        r.resetDailyAccumulators();

        assertEquals(50.0, r.stockpile[FOOD], 1e-9);
        assertEquals(20.0, r.treasury, 1e-9);
        assertEquals(0.0, r.deficit[FOOD], 1e-9);
        assertEquals(0.0, r.crownsMinted, 1e-9);
        assertEquals(0.0, r.tradeSpending, 1e-9);
    }

    @Test
    void copiesAreIndependent() {
        CountyEconomy c = new CountyEconomy(2);
        c.stock[FOOD] = 10;
        c.basicSatisfaction = 0.4;
        CountyEconomy cc = c.copy();
        cc.stock[FOOD] = 0;

        ProvinceEconomy p = new ProvinceEconomy(1);
        p.stockpile[FOOD] = 6;
        ProvinceEconomy pc = p.copy();
        pc.stockpile[FOOD] = 0;

        assertEquals(10.0, c.stock[FOOD], 1e-9);
        assertEquals(0.4, cc.basicSatisfaction, 1e-9);
        assertEquals(2, cc.getCountyId());
        assertEquals(6.0, p.stockpile[FOOD], 1e-9);
    }

    @Test
    void negativeIdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CountyEconomy(-1));
        assertThrows(IllegalArgumentException.class, () -> new ProvinceEconomy(-1));
        assertThrows(IllegalArgumentException.class, () -> new RealmEconomy(-1));
    }
}
