package org.carma.feudal.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarketParticipantTest {

    @Test
    void wireIdsFollowTheSignedLayout() {
        assertEquals(12, new MarketParticipant.Facility(12).toWireId());
        assertEquals(-4, new MarketParticipant.PopulationBuyer(4).toWireId());
        assertEquals(0, new MarketParticipant.PopulationBuyer(0).toWireId());
        assertEquals(-100_003, new MarketParticipant.SeedSeller(3).toWireId());
        assertEquals(-200_007, new MarketParticipant.OffMapSeller(7).toWireId());
    }

    @Test
    void wireIdsDecodeToTheSameParticipant() {
        MarketParticipant[] participants = {
            new MarketParticipant.Facility(1),
            new MarketParticipant.PopulationBuyer(0),
            new MarketParticipant.PopulationBuyer(99_999),
            new MarketParticipant.SeedSeller(0),
            new MarketParticipant.SeedSeller(99_999),
            new MarketParticipant.OffMapSeller(0),
            new MarketParticipant.OffMapSeller(12)
        };
        for (MarketParticipant p : participants) {
            assertEquals(p, MarketParticipant.fromWireId(p.toWireId()), p.toString());
        }
    }

    @Test
    void onlySeedAndOffMapSellersAreSynthetic() {
        assertFalse(new MarketParticipant.Facility(1).isSynthetic());
        assertFalse(new MarketParticipant.PopulationBuyer(1).isSynthetic());
        assertTrue(new MarketParticipant.SeedSeller(1).isSynthetic());
        assertTrue(new MarketParticipant.OffMapSeller(1).isSynthetic());
    }

    @Test
    void idsOutsideTheirBandAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MarketParticipant.Facility(0));
        assertThrows(IllegalArgumentException.class, () -> new MarketParticipant.PopulationBuyer(-1));
        assertThrows(IllegalArgumentException.class, () -> new MarketParticipant.PopulationBuyer(100_000));
        assertThrows(IllegalArgumentException.class, () -> new MarketParticipant.SeedSeller(100_000));
        assertThrows(IllegalArgumentException.class, () -> new MarketParticipant.OffMapSeller(-1));
    }

    @Test
    void populationCannotListAndSeedersCannotBuy() {
        assertThrows(IllegalArgumentException.class, () -> new ConsignmentLot(
            new MarketParticipant.PopulationBuyer(1), GoodType.FOOD, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new BuyOrder(
            new MarketParticipant.SeedSeller(1), GoodType.FOOD, 1, 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new BuyOrder(
            new MarketParticipant.Facility(1), GoodType.FOOD, -1, 1, 0, 0));
    }

    @Test
    void ledgerTotalsByGoodAndClears() {
        MarketLedger ledger = new MarketLedger();
        ledger.post(new BuyOrder(new MarketParticipant.Facility(1), GoodType.CLAY, 20, 4, 0, 1));
        ledger.post(new BuyOrder(new MarketParticipant.PopulationBuyer(2), GoodType.CLAY, 5, 1, 0, 1));
        ledger.post(new BuyOrder(new MarketParticipant.PopulationBuyer(2), GoodType.FOOD, 7, 7, 0, 1));
        ledger.list(new ConsignmentLot(new MarketParticipant.Facility(1), GoodType.POTTERY, 10, 1));

        assertEquals(25.0, ledger.orderedQuantity(GoodType.CLAY), 1e-9);
        assertEquals(10.0, ledger.listedQuantity(GoodType.POTTERY), 1e-9);

        MarketLedger copy = ledger.copy();
        ledger.clear();

        assertTrue(ledger.getBuyOrders().isEmpty());
        assertEquals(3, copy.getBuyOrders().size());
        assertEquals(1, copy.getLots().size());
    }
}
