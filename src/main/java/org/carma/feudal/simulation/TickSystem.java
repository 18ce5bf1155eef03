package org.carma.feudal.simulation;

import org.carma.feudal.model.WorldTopology;

/**
 * One stage of the daily pipeline.
 *
 * A system runs on every day divisible by its interval. It may read and mutate the
 * committed tier records in {@link SimulationState} but must not keep scratch state
 * that another system reads.
 */
public interface TickSystem {

    String name();

    /**
     * Days between runs. See {@link TickIntervals}.
     */
    int tickInterval();

    /**
     * Called once before the first tick.
     */
    default void initialize(SimulationState state, WorldTopology topology) {}

    void tick(SimulationState state, WorldTopology topology);
}
