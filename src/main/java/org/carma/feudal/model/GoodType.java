package org.carma.feudal.model;

/**
 * Closed enumeration of the goods in the economy.
 *
 * The ordinal is the index used by every per-good array in every tier record, and
 * {@link #COUNT} is the length of all of those arrays. Constants must never be
 * reordered: saved state depends on the indices.
 *
 * Per-good data (kg per person per day, crowns per kg):
 * <pre>
 *   good        need     cons   cAdmin rAdmin spoil  base  min    max   trade precious
 * </pre>
 */
public enum GoodType {
    FOOD      ("food",      NeedCategory.BASIC,   1.0,   0.0,   0.02,  0.03,  1.0, 0.1,  10.0, true,  false),
    TIMBER    ("timber",    NeedCategory.COMFORT, 0.2,   0.02,  0.01,  0.001, 0.5, 0.05, 5.0,  true,  false),
    IRON_ORE  ("ironOre",   NeedCategory.COMFORT, 0.005, 0.0,   0.003, 0.0,   5.0, 0.5,  50.0, true,  false),
    GOLD_ORE  ("goldOre",   NeedCategory.NONE,    0.0,   0.0,   0.0,   0.0,   0.0, 0.0,  0.0,  false, true),
    SILVER_ORE("silverOre", NeedCategory.NONE,    0.0,   0.0,   0.0,   0.0,   0.0, 0.0,  0.0,  false, true),
    SALT      ("salt",      NeedCategory.BASIC,   0.05,  0.0,   0.0,   0.0,   3.0, 0.3,  30.0, true,  false),
    WOOL      ("wool",      NeedCategory.COMFORT, 0.1,   0.0,   0.005, 0.001, 2.0, 0.2,  20.0, true,  false),
    STONE     ("stone",     NeedCategory.NONE,    0.0,   0.005, 0.012, 0.0,   0.3, 0.03, 3.0,  true,  false),
    ALE       ("ale",       NeedCategory.BASIC,   0.5,   0.0,   0.0,   0.05,  0.8, 0.08, 8.0,  true,  false),
    CLAY      ("clay",      NeedCategory.NONE,    0.0,   0.0,   0.0,   0.0,   0.2, 0.02, 2.0,  true,  false),
    POTTERY   ("pottery",   NeedCategory.COMFORT, 0.01,  0.002, 0.001, 0.0,   2.0, 0.2,  20.0, true,  false);

    /** Length of every per-good array. */
    public static final int COUNT = values().length;

    private final String key;
    private final NeedCategory need;
    private final double consumptionPerPop;
    private final double countyAdminPerPop;
    private final double realmAdminPerPop;
    private final double spoilageRate;
    private final double defaultBasePrice;
    private final double defaultMinPrice;
    private final double defaultMaxPrice;
    private final boolean tradeable;
    private final boolean preciousMetal;

    GoodType(String key, NeedCategory need, double consumptionPerPop,
             double countyAdminPerPop, double realmAdminPerPop, double spoilageRate,
             double basePrice, double minPrice, double maxPrice,
             boolean tradeable, boolean preciousMetal) {
        this.key = key;
        this.need = need;
        this.consumptionPerPop = consumptionPerPop;
        this.countyAdminPerPop = countyAdminPerPop;
        this.realmAdminPerPop = realmAdminPerPop;
        this.spoilageRate = spoilageRate;
        this.defaultBasePrice = basePrice;
        this.defaultMinPrice = minPrice;
        this.defaultMaxPrice = maxPrice;
        this.tradeable = tradeable;
        this.preciousMetal = preciousMetal;
    }

    /**
     * Look up a good by its serialization key ("food", "ironOre", ...) or enum name.
     * @throws IllegalArgumentException if no good matches
     */
    public static GoodType fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Good key cannot be null");
        }
        for (GoodType good : values()) {
            if (good.key.equalsIgnoreCase(key) || good.name().equalsIgnoreCase(key)) {
                return good;
            }
        }
        throw new IllegalArgumentException("Unknown good: " + key);
    }

    public String getKey() { return key; }
    public NeedCategory getNeed() { return need; }
    public boolean isBasic() { return need == NeedCategory.BASIC; }

    /** Daily consumption per person. */
    public double getConsumptionPerPop() { return consumptionPerPop; }

    /** County building upkeep per person per day. */
    public double getCountyAdminPerPop() { return countyAdminPerPop; }

    /** Realm military upkeep per person per day. */
    public double getRealmAdminPerPop() { return realmAdminPerPop; }

    /** Fraction lost per day. */
    public double getSpoilageRate() { return spoilageRate; }

    /** Fraction kept after a 30-day month of spoilage. */
    public double getMonthlyRetention() {
        return Math.pow(1.0 - spoilageRate, 30);
    }

    public double getDefaultBasePrice() { return defaultBasePrice; }
    public double getDefaultMinPrice() { return defaultMinPrice; }
    public double getDefaultMaxPrice() { return defaultMaxPrice; }
    public boolean isTradeable() { return tradeable; }

    /** Precious metals are crown property and are minted rather than traded. */
    public boolean isPreciousMetal() { return preciousMetal; }

    @Override
    public String toString() {
        return key;
    }
}
