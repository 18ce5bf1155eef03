package org.carma.feudal.model;

import java.util.Objects;

/**
 * A request to buy a good, limited by quantity and by spend.
 *
 * @param transportCost opaque per-unit cost the buyer pays on top of the price
 */
public record BuyOrder(
        MarketParticipant buyer,
        GoodType good,
        double quantity,
        double maxSpend,
        double transportCost,
        int dayPosted
) {
    public BuyOrder {
        Objects.requireNonNull(buyer, "Buyer cannot be null");
        Objects.requireNonNull(good, "Good cannot be null");
        if (!(buyer instanceof MarketParticipant.Facility) && !(buyer instanceof MarketParticipant.PopulationBuyer)) {
            throw new IllegalArgumentException("Only facilities and population buyers can post buy orders: " + buyer);
        }
        if (quantity < 0 || maxSpend < 0 || transportCost < 0) {
            throw new IllegalArgumentException("Buy order amounts cannot be negative");
        }
    }
}
