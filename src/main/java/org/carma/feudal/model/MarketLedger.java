package org.carma.feudal.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The day's order log: every buy order and consignment lot posted since the last reset,
 * in posting order.
 */
public class MarketLedger {

    private final List<BuyOrder> buyOrders = new ArrayList<>();
    private final List<ConsignmentLot> lots = new ArrayList<>();

    public void post(BuyOrder order) {
        buyOrders.add(order);
    }

    public void list(ConsignmentLot lot) {
        lots.add(lot);
    }

    public List<BuyOrder> getBuyOrders() {
        return Collections.unmodifiableList(buyOrders);
    }

    public List<ConsignmentLot> getLots() {
        return Collections.unmodifiableList(lots);
    }

    /**
     * Quantity of a good requested across all buy orders.
     */
    public double orderedQuantity(GoodType good) {
        double total = 0.0;
        for (BuyOrder order : buyOrders) {
            if (order.good() == good) total += order.quantity();
        }
        return total;
    }

    /**
     * Quantity of a good listed across all lots.
     */
    public double listedQuantity(GoodType good) {
        double total = 0.0;
        for (ConsignmentLot lot : lots) {
            if (lot.good() == good) total += lot.quantity();
        }
        return total;
    }

    public void clear() {
        buyOrders.clear();
        lots.clear();
    }

    public MarketLedger copy() {
        MarketLedger ledger = new MarketLedger();
        ledger.buyOrders.addAll(buyOrders);
        ledger.lots.addAll(lots);
        return ledger;
    }

    @Override
    public String toString() {
        return String.format("MarketLedger[orders=%d, lots=%d]", buyOrders.size(), lots.size());
    }
}
