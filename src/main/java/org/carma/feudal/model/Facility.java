package org.carma.feudal.model;

import java.util.Objects;

/**
 * A placed facility instance. Runtime state, mutable.
 */
public class Facility {

    public static final double DEFAULT_ALPHA = 0.7;

    private final int id;
    private final FacilityDef def;
    private final int cellId;
    private final int countyId;

    /** Materials waiting to be processed. */
    public final double[] inputBuffer = new double[GoodType.COUNT];

    /** Finished goods waiting for delivery to the county. */
    public final double[] outputBuffer = new double[GoodType.COUNT];

    public double assignedWorkers;
    public boolean active = true;

    /** Recipe units executed on the last tick. */
    public double lastUnits;

    public Facility(int id, FacilityDef def, int cellId, int countyId) {
        if (id <= 0) throw new IllegalArgumentException("Facility ID must be positive: " + id);
        if (countyId < 0) throw new IllegalArgumentException("County ID cannot be negative");
        this.id = id;
        this.def = Objects.requireNonNull(def, "Facility def cannot be null");
        this.cellId = cellId;
        this.countyId = countyId;
    }

    public int getId() { return id; }
    public FacilityDef getDef() { return def; }
    public int getCellId() { return cellId; }
    public int getCountyId() { return countyId; }

    /**
     * Staffing efficiency with diminishing returns below full staffing.
     * {@code (workers / required)^alpha}, 1 when fully staffed or when no labor is required.
     */
    public double efficiency(double alpha) {
        double required = def.getLaborRequired();
        if (required <= 0) return 1.0;
        if (assignedWorkers <= 0) return 0.0;

        double ratio = assignedWorkers / required;
        if (ratio >= 1.0) return 1.0;
        return Math.pow(ratio, alpha);
    }

    public double efficiency() {
        return efficiency(DEFAULT_ALPHA);
    }

    /**
     * Recipe units this facility can run today.
     */
    public double throughput(double alpha) {
        if (!active) return 0.0;
        return def.getBaseThroughput() * efficiency(alpha);
    }

    public double throughput() {
        return throughput(DEFAULT_ALPHA);
    }

    public Facility copy() {
        Facility f = new Facility(id, def, cellId, countyId);
        System.arraycopy(inputBuffer, 0, f.inputBuffer, 0, GoodType.COUNT);
        System.arraycopy(outputBuffer, 0, f.outputBuffer, 0, GoodType.COUNT);
        f.assignedWorkers = assignedWorkers;
        f.active = active;
        f.lastUnits = lastUnits;
        return f;
    }

    @Override
    public String toString() {
        return String.format("Facility[%d %s @county %d: workers=%.1f, active=%s]",
            id, def.getId(), countyId, assignedWorkers, active);
    }
}
