package org.carma.feudal.mechanism;

import org.carma.feudal.model.GoodCatalog;
import org.carma.feudal.model.GoodType;
import org.carma.feudal.model.RealmEconomy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inter-realm market clearing over realm stockpiles, deficits and treasuries.
 *
 * Goods clear one at a time in catalog buy-priority order, so crowns spent on an
 * earlier good are gone for later ones. For each good:
 *
 * 1. Self-satisfaction: each realm's own stock offsets its own deficit; the realm
 *    record is not touched, only the net position below
 * 2. Net position: {@code stock - deficit}; positive sells, negative buys
 * 3. Price: {@code base × demand / supply}, clamped into the catalog band
 * 4. Effective demand: each buyer's want, limited by what its treasury affords
 * 5. Rationing: the short side is served in full, the long side pro-rata
 * 6. Execution: goods and crowns change hands at the single clearing price
 *
 * A good with no supply or no demand does not trade and keeps its previous price.
 * When buyers exist but none can afford anything, the clamped clearing price is still
 * published although nothing trades.
 */
public class MarketClearing {

    /**
     * Outcome for one good.
     */
    public record GoodClearing(
            GoodType good,
            boolean traded,
            double price,
            double totalSupply,
            double totalDemand,
            double totalEffectiveDemand,
            double fillRatio,
            double sellRatio,
            double volume
    ) {
        static GoodClearing skipped(GoodType good, double price, double supply, double demand, double effective) {
            return new GoodClearing(good, false, price, supply, demand, effective, 0.0, 0.0, 0.0);
        }
    }

    /**
     * Outcome for every good in one clearing pass, in processing order.
     */
    public static class ClearingResult {
        private final List<GoodClearing> goods = new ArrayList<>();
        private final double[] prices;

        ClearingResult(double[] prices) {
            this.prices = prices;
        }

        ClearingResult add(GoodClearing clearing) {
            goods.add(clearing);
            return this;
        }

        public List<GoodClearing> getGoods() {
            return Collections.unmodifiableList(goods);
        }

        public GoodClearing get(GoodType good) {
            for (GoodClearing c : goods) {
                if (c.good() == good) return c;
            }
            throw new IllegalArgumentException("Good was not cleared: " + good);
        }

        /**
         * Published price per good after the pass, indexed by ordinal.
         */
        public double[] getPrices() {
            return prices.clone();
        }

        public double totalVolume() {
            return goods.stream().mapToDouble(GoodClearing::volume).sum();
        }

        @Override
        public String toString() {
            long traded = goods.stream().filter(GoodClearing::traded).count();
            return String.format("ClearingResult[%d goods, %d traded, volume=%.2f]",
                goods.size(), traded, totalVolume());
        }
    }

    private final GoodCatalog catalog;
    private final double tariffRate;

    public MarketClearing(GoodCatalog catalog) {
        this(catalog, 0.0);
    }

    /**
     * @param tariffRate export duty added to the price paid by buyers, kept by the selling realm
     */
    public MarketClearing(GoodCatalog catalog, double tariffRate) {
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        if (tariffRate < 0) throw new IllegalArgumentException("Tariff rate cannot be negative");
        this.tariffRate = tariffRate;
    }

    /**
     * Clear every tradeable good across the realms.
     *
     * @param realms realm records, mutated in place
     * @param previousPrices last published prices, indexed by ordinal; not mutated
     */
    public ClearingResult clear(RealmEconomy[] realms, double[] previousPrices) {
        double[] prices = previousPrices.clone();
        ClearingResult result = new ClearingResult(prices);
        double[] net = new double[realms.length];
        double[] effective = new double[realms.length];

        for (GoodType good : catalog.buyPriority()) {
            GoodClearing clearing = clearGood(good, realms, prices[good.ordinal()], net, effective);
            prices[good.ordinal()] = clearing.price();
            result.add(clearing);
        }
        return result;
    }

    /**
     * Clear a single good.
     */
    public GoodClearing clearGood(GoodType good, RealmEconomy[] realms, double previousPrice) {
        return clearGood(good, realms, previousPrice, new double[realms.length], new double[realms.length]);
    }

    private GoodClearing clearGood(GoodType good, RealmEconomy[] realms, double previousPrice,
                                   double[] net, double[] effective) {
        int g = good.ordinal();

        // Self-satisfaction and net positions, on locals only
        double totalSupply = 0.0;
        double totalDemand = 0.0;
        for (int i = 0; i < realms.length; i++) {
            double stock = realms[i].stockpile[g];
            double deficit = realms[i].deficit[g];
            double self = Math.max(0.0, Math.min(stock, deficit));
            net[i] = (stock - self) - (deficit - self);
            if (net[i] > 0) totalSupply += net[i];
            else if (net[i] < 0) totalDemand += -net[i];
        }
        if (totalSupply <= 0 || totalDemand <= 0) {
            return GoodClearing.skipped(good, previousPrice, totalSupply, totalDemand, 0.0);
        }

        double price = catalog.clampPrice(good, catalog.basePrice(good) * totalDemand / totalSupply);
        double unitCost = price * (1.0 + tariffRate);

        // Treasury-limited demand
        double totalEffective = 0.0;
        for (int i = 0; i < realms.length; i++) {
            effective[i] = 0.0;
            if (net[i] >= 0) continue;
            double canAfford = unitCost > 0 ? Math.max(0.0, realms[i].treasury) / unitCost : -net[i];
            effective[i] = Math.min(-net[i], canAfford);
            totalEffective += effective[i];
        }
        if (totalEffective <= 0) {
            return GoodClearing.skipped(good, price, totalSupply, totalDemand, 0.0);
        }

        double fillRatio = Math.min(1.0, totalSupply / totalEffective);
        double sellRatio = Math.min(1.0, totalEffective / totalSupply);

        double volume = 0.0;
        for (int i = 0; i < realms.length; i++) {
            RealmEconomy realm = realms[i];
            if (net[i] > 0) {
                double sold = net[i] * sellRatio;
                double revenue = sold * price;
                double tariff = revenue * tariffRate;
                realm.stockpile[g] -= sold;
                realm.treasury += revenue + tariff;
                realm.tradeExports[g] += sold;
                realm.tradeRevenue += revenue;
                realm.tradeTariffsCollected += tariff;
                volume += sold;
            } else if (effective[i] > 0) {
                double bought = effective[i] * fillRatio;
                double cost = bought * unitCost;
                realm.stockpile[g] += bought;
                realm.treasury -= cost;
                realm.tradeImports[g] += bought;
                realm.tradeSpending += cost;
            }
        }

        return new GoodClearing(good, true, price, totalSupply, totalDemand, totalEffective,
            fillRatio, sellRatio, volume);
    }
}
