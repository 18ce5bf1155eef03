package org.carma.feudal.safety;

import org.carma.feudal.event.Event;
import org.carma.feudal.model.*;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationState;

import java.util.*;

/**
 * Post-tick state checks.
 *
 * The runner calls {@link #checkDay(SimulationState)} after every day. Checks:
 * 1. Non-negative stock: county stock, provincial and royal stockpiles, facility buffers
 * 2. Non-negative treasury at every tier
 * 3. Price bounds: every published price lies within the catalog band
 *
 * Every failed check is recorded and published as an
 * {@link org.carma.feudal.event.Event.InvariantViolationEvent}. In strict mode it then throws
 * {@link InvariantViolationException}; in lenient mode the simulation continues.
 */
public class InvariantMonitor {

    /** Float noise tolerated below zero. */
    public static final double TOLERANCE = 1e-9;

    /**
     * Result of one check.
     */
    public static class CheckResult {
        private final String checkName;
        private final boolean passed;
        private final List<String> violations;

        public CheckResult(String checkName, boolean passed, List<String> violations) {
            this.checkName = checkName;
            this.passed = passed;
            this.violations = new ArrayList<>(violations);
        }

        public static CheckResult pass(String checkName) {
            return new CheckResult(checkName, true, Collections.emptyList());
        }

        public static CheckResult fail(String checkName, List<String> violations) {
            return new CheckResult(checkName, false, violations);
        }

        public String getCheckName() { return checkName; }
        public boolean isPassed() { return passed; }
        public List<String> getViolations() { return Collections.unmodifiableList(violations); }

        @Override
        public String toString() {
            return passed
                ? "CheckResult[" + checkName + ": PASS]"
                : "CheckResult[" + checkName + ": FAIL: " + String.join("; ", violations) + "]";
        }
    }

    private final List<CheckResult> failures = new ArrayList<>();
    private int checksRun;
    private boolean strictMode;

    public InvariantMonitor(boolean strictMode) {
        this.strictMode = strictMode;
    }

    public InvariantMonitor setStrictMode(boolean strict) {
        this.strictMode = strict;
        return this;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    // ========================================================================
    // Checks
    // ========================================================================

    public CheckResult checkNonNegativeStock(EconomyState economy) {
        List<String> violations = new ArrayList<>();
        for (CountyEconomy c : economy.counties()) {
            collectNegatives(violations, "county " + c.getCountyId() + " stock", c.stock);
        }
        for (ProvinceEconomy p : economy.provinces()) {
            collectNegatives(violations, "province " + p.getProvinceId() + " stockpile", p.stockpile);
        }
        for (RealmEconomy r : economy.realms()) {
            collectNegatives(violations, "realm " + r.getRealmId() + " stockpile", r.stockpile);
        }
        for (Facility f : economy.facilities()) {
            collectNegatives(violations, "facility " + f.getId() + " input buffer", f.inputBuffer);
            collectNegatives(violations, "facility " + f.getId() + " output buffer", f.outputBuffer);
        }
        return result("non-negative stock", violations);
    }

    public CheckResult checkNonNegativeTreasury(EconomyState economy) {
        List<String> violations = new ArrayList<>();
        for (CountyEconomy c : economy.counties()) {
            if (c.treasury < -TOLERANCE) {
                violations.add(String.format("county %d treasury %.6f", c.getCountyId(), c.treasury));
            }
        }
        for (ProvinceEconomy p : economy.provinces()) {
            if (p.treasury < -TOLERANCE) {
                violations.add(String.format("province %d treasury %.6f", p.getProvinceId(), p.treasury));
            }
        }
        for (RealmEconomy r : economy.realms()) {
            if (r.treasury < -TOLERANCE) {
                violations.add(String.format("realm %d treasury %.6f", r.getRealmId(), r.treasury));
            }
        }
        return result("non-negative treasury", violations);
    }

    public CheckResult checkPriceBounds(EconomyState economy, GoodCatalog catalog) {
        List<String> violations = new ArrayList<>();
        for (GoodType good : catalog.buyPriority()) {
            double price = economy.marketPrices[good.ordinal()];
            if (price < catalog.minPrice(good) - TOLERANCE || price > catalog.maxPrice(good) + TOLERANCE) {
                violations.add(String.format("%s price %.4f outside [%.4f, %.4f]",
                    good, price, catalog.minPrice(good), catalog.maxPrice(good)));
            }
        }
        return result("price bounds", violations);
    }

    /**
     * Run every check against the state at the end of a day.
     *
     * @return the failed checks, empty when the state is sound
     * @throws InvariantViolationException in strict mode, on the first failed check
     */
    public List<CheckResult> checkDay(SimulationState state) {
        EconomyState economy = state.getEconomy();
        List<CheckResult> results = List.of(
            checkNonNegativeStock(economy),
            checkNonNegativeTreasury(economy),
            checkPriceBounds(economy, state.getCatalog()));

        List<CheckResult> failed = new ArrayList<>();
        for (CheckResult r : results) {
            checksRun++;
            if (r.isPassed()) continue;
            failed.add(r);
            failures.add(r);
            state.getEventBus().publish(new Event.InvariantViolationEvent(
                state.getDay(), r.getCheckName(), String.join("; ", r.getViolations())));
            if (strictMode) {
                throw new InvariantViolationException(state.getDay(), r.getCheckName(), r.getViolations());
            }
        }
        return failed;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static void collectNegatives(List<String> violations, String owner, double[] values) {
        for (GoodType good : GoodType.values()) {
            double v = values[good.ordinal()];
            if (v < -TOLERANCE) {
                violations.add(String.format("%s %s = %.6f", owner, good, v));
            }
        }
    }

    private static CheckResult result(String name, List<String> violations) {
        return violations.isEmpty() ? CheckResult.pass(name) : CheckResult.fail(name, violations);
    }

    public List<CheckResult> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public int getChecksRun() {
        return checksRun;
    }

    /**
     * Thrown in strict mode when a post-tick check fails.
     */
    public static class InvariantViolationException extends IllegalStateException {
        private final int day;
        private final String checkName;
        private final List<String> violations;

        public InvariantViolationException(int day, String checkName, List<String> violations) {
            super("Day " + day + ": " + checkName + " violated: " + String.join("; ", violations));
            this.day = day;
            this.checkName = checkName;
            this.violations = List.copyOf(violations);
        }

        public int getDay() { return day; }
        public String getCheckName() { return checkName; }
        public List<String> getViolations() { return violations; }
    }

    @Override
    public String toString() {
        return String.format("InvariantMonitor[strict=%s, %d checks, %d failures]",
            strictMode, checksRun, failures.size());
    }
}
