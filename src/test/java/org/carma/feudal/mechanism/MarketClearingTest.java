package org.carma.feudal.mechanism;

import org.carma.feudal.model.GoodCatalog;
import org.carma.feudal.model.GoodType;
import org.carma.feudal.model.RealmEconomy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarketClearingTest {

    private static final int FOOD = GoodType.FOOD.ordinal();

    private final GoodCatalog catalog = GoodCatalog.standard().toBuilder()
        .price(GoodType.FOOD, 10, 5, 20)
        .build();

    private static RealmEconomy realm(int id, double foodStock, double foodDeficit, double treasury) {
        RealmEconomy r = new RealmEconomy(id);
        r.stockpile[FOOD] = foodStock;
        r.deficit[FOOD] = foodDeficit;
        r.treasury = treasury;
        return r;
    }

    @Test
    void surplusSellerAndDeficitBuyerTradeAtClampedPrice() {
        RealmEconomy a = realm(0, 100, 0, 1000);
        RealmEconomy b = realm(1, 0, 50, 1000);

        MarketClearing.GoodClearing c = new MarketClearing(catalog)
            .clearGood(GoodType.FOOD, new RealmEconomy[]{a, b}, 10);

        assertTrue(c.traded());
        // 10 × 50 / 100 = 5, exactly the floor
        assertEquals(5.0, c.price(), 1e-9);
        assertEquals(1.0, c.fillRatio(), 1e-9);
        assertEquals(0.5, c.sellRatio(), 1e-9);
        assertEquals(50.0, c.volume(), 1e-9);

        assertEquals(50.0, a.stockpile[FOOD], 1e-9);
        assertEquals(1250.0, a.treasury, 1e-9);
        assertEquals(50.0, a.tradeExports[FOOD], 1e-9);
        assertEquals(250.0, a.tradeRevenue, 1e-9);

        assertEquals(50.0, b.stockpile[FOOD], 1e-9);
        assertEquals(750.0, b.treasury, 1e-9);
        assertEquals(50.0, b.tradeImports[FOOD], 1e-9);
        assertEquals(250.0, b.tradeSpending, 1e-9);
    }

    @Test
    void priceIsClampedToCeilingWhenDemandFarExceedsSupply() {
        RealmEconomy a = realm(0, 10, 0, 0);
        RealmEconomy b = realm(1, 0, 1000, 1_000_000);

        MarketClearing.GoodClearing c = new MarketClearing(catalog)
            .clearGood(GoodType.FOOD, new RealmEconomy[]{a, b}, 10);

        assertEquals(20.0, c.price(), 1e-9);
        assertEquals(0.01, c.fillRatio(), 1e-9);
        assertEquals(1.0, c.sellRatio(), 1e-9);
        assertEquals(10.0, b.stockpile[FOOD], 1e-9);
        assertEquals(0.0, a.stockpile[FOOD], 1e-9);
    }

    @Test
    void treasuryLimitsEffectiveDemand() {
        RealmEconomy a = realm(0, 100, 0, 0);
        RealmEconomy b = realm(1, 0, 50, 100);

        MarketClearing.GoodClearing c = new MarketClearing(catalog)
            .clearGood(GoodType.FOOD, new RealmEconomy[]{a, b}, 10);

        // price 5, so 100 crowns buys 20
        assertEquals(20.0, c.totalEffectiveDemand(), 1e-9);
        assertEquals(20.0, b.stockpile[FOOD], 1e-9);
        assertEquals(0.0, b.treasury, 1e-9);
        assertEquals(80.0, a.stockpile[FOOD], 1e-9);
    }

    @Test
    void realmCoversOwnDeficitBeforeTrading() {
        RealmEconomy a = realm(0, 100, 0, 1000);
        RealmEconomy b = realm(1, 30, 50, 1000);

        MarketClearing.GoodClearing c = new MarketClearing(catalog)
            .clearGood(GoodType.FOOD, new RealmEconomy[]{a, b}, 10);

        assertEquals(20.0, c.totalDemand(), 1e-9);
        assertEquals(50.0, b.deficit[FOOD], 1e-9);
        assertEquals(30.0 + 20.0, b.stockpile[FOOD], 1e-9);
        assertEquals(20.0, b.tradeImports[FOOD], 1e-9);
    }

    @Test
    void coveringOwnDeficitLeavesStockpileUntouched() {
        RealmEconomy a = realm(0, 100, 30, 1000);
        RealmEconomy b = realm(1, 0, 0, 1000);

        MarketClearing.GoodClearing c = new MarketClearing(catalog)
            .clearGood(GoodType.FOOD, new RealmEconomy[]{a, b}, 10);

        assertFalse(c.traded());
        assertEquals(70.0, c.totalSupply(), 1e-9);
        assertEquals(100.0, a.stockpile[FOOD], 1e-9);
        assertEquals(30.0, a.deficit[FOOD], 1e-9);
    }

    @Test
    void goodWithoutDemandKeepsPreviousPrice() {
        RealmEconomy a = realm(0, 100, 0, 1000);
        RealmEconomy b = realm(1, 40, 0, 1000);

        MarketClearing.GoodClearing c = new MarketClearing(catalog)
            .clearGood(GoodType.FOOD, new RealmEconomy[]{a, b}, 12.5);

        assertFalse(c.traded());
        assertEquals(12.5, c.price(), 1e-9);
        assertEquals(100.0, a.stockpile[FOOD], 1e-9);
        assertEquals(1000.0, b.treasury, 1e-9);
    }

    @Test
    void brokeBuyersStillPublishTheClearingPrice() {
        RealmEconomy a = realm(0, 100, 0, 0);
        RealmEconomy b = realm(1, 0, 50, 0);

        MarketClearing.GoodClearing c = new MarketClearing(catalog)
            .clearGood(GoodType.FOOD, new RealmEconomy[]{a, b}, 8);

        assertFalse(c.traded());
        // 10 × 50 / 100 = 5, published even though nobody can pay
        assertEquals(5.0, c.price(), 1e-9);
        assertEquals(0.0, c.volume(), 1e-9);
        assertEquals(100.0, a.stockpile[FOOD], 1e-9);
        assertEquals(50.0, b.deficit[FOOD], 1e-9);
    }

    @Test
    void goodsAndCrownsAreConservedAcrossManyRealms() {
        RealmEconomy[] realms = {
            realm(0, 300, 0, 50),
            realm(1, 0, 120, 400),
            realm(2, 80, 10, 0),
            realm(3, 0, 200, 90)
        };
        double stockBefore = 0, treasuryBefore = 0;
        for (RealmEconomy r : realms) {
            stockBefore += r.stockpile[FOOD];
            treasuryBefore += r.treasury;
        }

        MarketClearing.GoodClearing c = new MarketClearing(catalog)
            .clearGood(GoodType.FOOD, realms, 10);

        double stockAfter = 0, treasuryAfter = 0, sold = 0, bought = 0;
        for (RealmEconomy r : realms) {
            stockAfter += r.stockpile[FOOD];
            treasuryAfter += r.treasury;
            sold += r.tradeExports[FOOD];
            bought += r.tradeImports[FOOD];
            assertTrue(r.treasury >= -1e-9, "treasury went negative: " + r);
            assertTrue(r.stockpile[FOOD] >= -1e-9, "stock went negative: " + r);
        }
        assertEquals(stockBefore, stockAfter, 1e-9);
        assertEquals(treasuryBefore, treasuryAfter, 1e-9);
        assertEquals(sold, bought, 1e-9);
        assertEquals(sold, c.volume(), 1e-9);
        assertTrue(c.fillRatio() <= 1.0);
        assertTrue(c.sellRatio() <= 1.0);
        assertTrue(c.price() >= 5.0 && c.price() <= 20.0);
    }

    @Test
    void tariffIsPaidByBuyerAndKeptBySeller() {
        RealmEconomy a = realm(0, 100, 0, 1000);
        RealmEconomy b = realm(1, 0, 50, 1000);

        new MarketClearing(catalog, 0.1).clearGood(GoodType.FOOD, new RealmEconomy[]{a, b}, 10);

        assertEquals(50.0, b.stockpile[FOOD], 1e-9);
        assertEquals(1000.0 - 275.0, b.treasury, 1e-9);
        assertEquals(1275.0, a.treasury, 1e-9);
        assertEquals(25.0, a.tradeTariffsCollected, 1e-9);
        assertEquals(250.0, a.tradeRevenue, 1e-9);
    }

    @Test
    void earlierGoodsInBuyPriorityConsumeTreasuryFirst() {
        int ale = GoodType.ALE.ordinal();
        RealmEconomy a = realm(0, 100, 0, 0);
        a.stockpile[ale] = 100;
        RealmEconomy b = realm(1, 0, 50, 250);
        b.deficit[ale] = 50;

        MarketClearing.ClearingResult result = new MarketClearing(catalog)
            .clear(new RealmEconomy[]{a, b}, catalog.basePrices());

        assertTrue(result.get(GoodType.FOOD).traded());
        assertFalse(result.get(GoodType.ALE).traded());
        assertEquals(0.0, b.treasury, 1e-9);
        assertEquals(0.0, b.stockpile[ale], 1e-9);
        // ale: 0.8 × 50 / 100, published although the buyer is out of crowns
        assertEquals(0.4, result.getPrices()[ale], 1e-9);
        assertEquals(5.0, result.getPrices()[FOOD], 1e-9);
    }

    @Test
    void clearingWalksGoodsInBuyPriorityOrder() {
        MarketClearing.ClearingResult result = new MarketClearing(catalog)
            .clear(new RealmEconomy[]{realm(0, 0, 0, 0)}, catalog.basePrices());

        assertEquals(catalog.buyPriority().size(), result.getGoods().size());
        for (int i = 0; i < result.getGoods().size(); i++) {
            assertEquals(catalog.buyPriority().get(i), result.getGoods().get(i).good());
        }
        assertEquals(0.0, result.totalVolume(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> result.get(GoodType.GOLD_ORE));
    }

    @Test
    void negativeTariffIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MarketClearing(catalog, -0.01));
    }
}
