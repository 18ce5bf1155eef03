package org.carma.feudal.model;

import java.util.Objects;

/**
 * Immutable facility type definition: a one-input, one-output recipe plus labor
 * requirement and placement rule.
 *
 * Amounts are per recipe unit. At full staffing a facility runs
 * {@link #getBaselineOutput()} units per day, which needs
 * {@code laborPerUnit × baselineOutput} workers.
 */
public final class FacilityDef {

    private final String id;
    private final String name;
    private final GoodType inputGood;
    private final double inputAmount;
    private final GoodType outputGood;
    private final double outputAmount;
    private final double laborPerUnit;
    private final double placementMinProductivity;
    private final double maxLaborFraction;
    private final double baselineOutput;

    private FacilityDef(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Facility id cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.inputGood = Objects.requireNonNull(builder.inputGood, "Input good cannot be null for " + id);
        this.outputGood = Objects.requireNonNull(builder.outputGood, "Output good cannot be null for " + id);
        if (inputGood == outputGood) {
            throw new IllegalArgumentException("Recipe " + id + " has identical input and output: " + inputGood);
        }
        if (builder.inputAmount <= 0 || builder.outputAmount <= 0) {
            throw new IllegalArgumentException("Recipe amounts must be positive for " + id);
        }
        if (builder.laborPerUnit < 0 || builder.baselineOutput < 0 || builder.placementMinProductivity < 0) {
            throw new IllegalArgumentException("Labor, output and placement values cannot be negative for " + id);
        }
        if (builder.maxLaborFraction < 0 || builder.maxLaborFraction > 1) {
            throw new IllegalArgumentException("Max labor fraction must be in [0, 1] for " + id);
        }
        this.inputAmount = builder.inputAmount;
        this.outputAmount = builder.outputAmount;
        this.laborPerUnit = builder.laborPerUnit;
        this.placementMinProductivity = builder.placementMinProductivity;
        this.maxLaborFraction = builder.maxLaborFraction;
        this.baselineOutput = builder.baselineOutput;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public GoodType getInputGood() { return inputGood; }
    public double getInputAmount() { return inputAmount; }
    public GoodType getOutputGood() { return outputGood; }
    public double getOutputAmount() { return outputAmount; }
    public double getLaborPerUnit() { return laborPerUnit; }
    public double getPlacementMinProductivity() { return placementMinProductivity; }
    public double getMaxLaborFraction() { return maxLaborFraction; }
    public double getBaselineOutput() { return baselineOutput; }

    /**
     * Workers needed to run at full capacity.
     */
    public double getLaborRequired() {
        return laborPerUnit * baselineOutput;
    }

    /**
     * Recipe units per day at full staffing.
     */
    public double getBaseThroughput() {
        return baselineOutput;
    }

    /**
     * A county can host this facility when it naturally produces the input good
     * at or above the placement minimum.
     */
    public boolean canPlace(CountyEconomy county) {
        double p = county.productivity[inputGood.ordinal()];
        return p > 0 && p >= placementMinProductivity;
    }

    @Override
    public String toString() {
        return String.format("FacilityDef[%s: %.2f %s -> %.2f %s, labor=%.1f, baseline=%.1f]",
            id, inputAmount, inputGood, outputAmount, outputGood, getLaborRequired(), baselineOutput);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final String id;
        private String name;
        private GoodType inputGood;
        private double inputAmount;
        private GoodType outputGood;
        private double outputAmount;
        private double laborPerUnit;
        private double placementMinProductivity;
        private double maxLaborFraction = 0.1;
        private double baselineOutput = 10.0;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) { this.name = name; return this; }

        public Builder input(GoodType good, double amount) {
            this.inputGood = good;
            this.inputAmount = amount;
            return this;
        }

        public Builder output(GoodType good, double amount) {
            this.outputGood = good;
            this.outputAmount = amount;
            return this;
        }

        public Builder laborPerUnit(double labor) { this.laborPerUnit = labor; return this; }
        public Builder placementMinProductivity(double min) { this.placementMinProductivity = min; return this; }
        public Builder maxLaborFraction(double fraction) { this.maxLaborFraction = fraction; return this; }
        public Builder baselineOutput(double units) { this.baselineOutput = units; return this; }

        /**
         * @throws IllegalArgumentException if the recipe is malformed
         */
        public FacilityDef build() {
            return new FacilityDef(this);
        }
    }
}
