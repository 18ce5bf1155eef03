package org.carma.feudal.model;

/**
 * Who posted a market order.
 *
 * Saves written by older builds identify participants by a single signed integer.
 * {@link #toWireId()} and {@link #fromWireId(int)} convert to and from that form:
 * <pre>
 *   facility            id                      (positive)
 *   population buyer    -countyId               (0 .. -99_999)
 *   seed seller         -100_000 - marketId     (-100_000 .. -199_999)
 *   off-map seller      -200_000 - marketId     (-200_000 and below)
 * </pre>
 */
public sealed interface MarketParticipant permits
        MarketParticipant.Facility,
        MarketParticipant.PopulationBuyer,
        MarketParticipant.SeedSeller,
        MarketParticipant.OffMapSeller {

    int SEED_SELLER_BASE = -100_000;
    int OFF_MAP_SELLER_BASE = -200_000;

    int toWireId();

    /**
     * True for market-bootstrapping sellers that have no owner in the world.
     */
    default boolean isSynthetic() {
        return false;
    }

    /**
     * Decode a legacy signed participant id.
     */
    static MarketParticipant fromWireId(int wireId) {
        if (wireId > 0) return new Facility(wireId);
        if (wireId > SEED_SELLER_BASE) return new PopulationBuyer(-wireId);
        if (wireId > OFF_MAP_SELLER_BASE) return new SeedSeller(SEED_SELLER_BASE - wireId);
        return new OffMapSeller(OFF_MAP_SELLER_BASE - wireId);
    }

    // ========================================================================
    // Variants
    // ========================================================================

    record Facility(int facilityId) implements MarketParticipant {
        public Facility {
            if (facilityId <= 0) throw new IllegalArgumentException("Facility ID must be positive: " + facilityId);
        }

        public int toWireId() { return facilityId; }
    }

    /** A county's population buying as one aggregate. */
    record PopulationBuyer(int countyId) implements MarketParticipant {
        public PopulationBuyer {
            if (countyId < 0 || countyId >= -SEED_SELLER_BASE) {
                throw new IllegalArgumentException("County ID out of encodable range: " + countyId);
            }
        }

        public int toWireId() { return -countyId; }
    }

    record SeedSeller(int marketId) implements MarketParticipant {
        public SeedSeller {
            if (marketId < 0 || marketId >= SEED_SELLER_BASE - OFF_MAP_SELLER_BASE) {
                throw new IllegalArgumentException("Market ID out of encodable range: " + marketId);
            }
        }

        public int toWireId() { return SEED_SELLER_BASE - marketId; }
        public boolean isSynthetic() { return true; }
    }

    record OffMapSeller(int marketId) implements MarketParticipant {
        public OffMapSeller {
            if (marketId < 0) throw new IllegalArgumentException("Market ID cannot be negative: " + marketId);
        }

        public int toWireId() { return OFF_MAP_SELLER_BASE - marketId; }
        public boolean isSynthetic() { return true; }
    }
}
