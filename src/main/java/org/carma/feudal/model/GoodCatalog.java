package org.carma.feudal.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable price table and trade ordering for the goods in {@link GoodType}.
 *
 * The catalog owns:
 * - Base, minimum and maximum price per good (defaults from {@link GoodType}, overridable)
 * - The tradeable goods
 * - The fixed buy-priority order used by every market pass
 *
 * Buy priority matters: treasury spent on an earlier good is unavailable for later
 * goods within the same tick. Staples come first, building materials last.
 */
public final class GoodCatalog {

    private static final List<GoodType> STANDARD_BUY_PRIORITY = List.of(
        GoodType.FOOD,
        GoodType.ALE,
        GoodType.IRON_ORE,
        GoodType.SALT,
        GoodType.WOOL,
        GoodType.POTTERY,
        GoodType.TIMBER,
        GoodType.STONE,
        GoodType.CLAY
    );

    private static final GoodCatalog STANDARD = builder().build();

    private final double[] basePrice;
    private final double[] minPrice;
    private final double[] maxPrice;
    private final List<GoodType> buyPriority;

    private GoodCatalog(Builder builder) {
        this.basePrice = builder.basePrice.clone();
        this.minPrice = builder.minPrice.clone();
        this.maxPrice = builder.maxPrice.clone();
        this.buyPriority = Collections.unmodifiableList(new ArrayList<>(builder.buyPriority));
    }

    /**
     * Catalog with the default prices of every good.
     */
    public static GoodCatalog standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this catalog's values.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        System.arraycopy(basePrice, 0, b.basePrice, 0, GoodType.COUNT);
        System.arraycopy(minPrice, 0, b.minPrice, 0, GoodType.COUNT);
        System.arraycopy(maxPrice, 0, b.maxPrice, 0, GoodType.COUNT);
        b.buyPriority = new ArrayList<>(buyPriority);
        return b;
    }

    // ========================================================================
    // Prices
    // ========================================================================

    public double basePrice(GoodType good) { return basePrice[good.ordinal()]; }
    public double minPrice(GoodType good) { return minPrice[good.ordinal()]; }
    public double maxPrice(GoodType good) { return maxPrice[good.ordinal()]; }

    /**
     * Clamp a raw price into [min, max] for the good.
     */
    public double clampPrice(GoodType good, double rawPrice) {
        return Math.max(minPrice(good), Math.min(rawPrice, maxPrice(good)));
    }

    /**
     * Fresh array of base prices indexed by good ordinal.
     */
    public double[] basePrices() {
        return basePrice.clone();
    }

    // ========================================================================
    // Trade ordering
    // ========================================================================

    /**
     * Goods in the order markets process them. Only tradeable goods appear.
     */
    public List<GoodType> buyPriority() {
        return buyPriority;
    }

    public boolean isTradeable(GoodType good) {
        return buyPriority.contains(good);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("GoodCatalog[\n");
        for (GoodType good : GoodType.values()) {
            sb.append(String.format("  %-10s base=%.3f min=%.3f max=%.3f%n",
                good.getKey(), basePrice(good), minPrice(good), maxPrice(good)));
        }
        sb.append("  buyPriority=").append(buyPriority).append("\n]");
        return sb.toString();
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final double[] basePrice = new double[GoodType.COUNT];
        private final double[] minPrice = new double[GoodType.COUNT];
        private final double[] maxPrice = new double[GoodType.COUNT];
        private List<GoodType> buyPriority = new ArrayList<>(STANDARD_BUY_PRIORITY);

        private Builder() {
            for (GoodType good : GoodType.values()) {
                basePrice[good.ordinal()] = good.getDefaultBasePrice();
                minPrice[good.ordinal()] = good.getDefaultMinPrice();
                maxPrice[good.ordinal()] = good.getDefaultMaxPrice();
            }
        }

        /**
         * Override the price band of a good.
         * @throws IllegalArgumentException unless 0 ≤ min ≤ base ≤ max
         */
        public Builder price(GoodType good, double base, double min, double max) {
            if (min < 0 || min > base || base > max) {
                throw new IllegalArgumentException(String.format(
                    "Invalid price band for %s: min=%.4f base=%.4f max=%.4f", good, min, base, max));
            }
            basePrice[good.ordinal()] = base;
            minPrice[good.ordinal()] = min;
            maxPrice[good.ordinal()] = max;
            return this;
        }

        /**
         * Replace the buy-priority order.
         * @throws IllegalArgumentException on duplicates or non-tradeable goods
         */
        public Builder buyPriority(List<GoodType> order) {
            if (order.size() != order.stream().distinct().count()) {
                throw new IllegalArgumentException("Buy priority contains duplicates: " + order);
            }
            for (GoodType good : order) {
                if (!good.isTradeable()) {
                    throw new IllegalArgumentException("Good is not tradeable: " + good);
                }
            }
            this.buyPriority = new ArrayList<>(order);
            return this;
        }

        public GoodCatalog build() {
            return new GoodCatalog(this);
        }
    }
}
