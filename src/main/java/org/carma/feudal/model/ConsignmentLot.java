package org.carma.feudal.model;

import java.util.Objects;

/**
 * Goods listed for sale by a facility or a synthetic seller.
 */
public record ConsignmentLot(
        MarketParticipant seller,
        GoodType good,
        double quantity,
        int dayListed
) {
    public ConsignmentLot {
        Objects.requireNonNull(seller, "Seller cannot be null");
        Objects.requireNonNull(good, "Good cannot be null");
        if (seller instanceof MarketParticipant.PopulationBuyer) {
            throw new IllegalArgumentException("Population buyers cannot list consignments: " + seller);
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Lot quantity cannot be negative");
        }
    }
}
