package org.carma.feudal.simulation;

import org.carma.feudal.event.Event;
import org.carma.feudal.mechanism.*;
import org.carma.feudal.model.EconomySnapshot;
import org.carma.feudal.model.WorldTopology;
import org.carma.feudal.safety.InvariantMonitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Drives the ordered tick pipeline one simulated day at a time.
 *
 * Each day:
 * 1. Clear the order ledger
 * 2. Increment the day
 * 3. Run every system whose interval divides the day, in declared order
 * 4. Check state invariants
 * 5. Capture a snapshot into the time series
 */
public class SimulationRunner {

    private final SimulationState state;
    private final WorldTopology topology;
    private final List<TickSystem> systems;
    private final SnapshotAggregator aggregator;
    private final EconomyTimeSeries timeSeries;
    private final InvariantMonitor monitor;
    private boolean initialized;

    public SimulationRunner(SimulationState state, WorldTopology topology) {
        this(state, topology, standardPipeline());
    }

    public SimulationRunner(SimulationState state, WorldTopology topology, List<TickSystem> systems) {
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.topology = Objects.requireNonNull(topology, "Topology cannot be null");
        this.systems = List.copyOf(systems);
        this.aggregator = new SnapshotAggregator(state.getSettings().getDistressThreshold());
        this.timeSeries = new EconomyTimeSeries(state.getSettings().getSnapshotCapacity());
        this.monitor = new InvariantMonitor(state.getSettings().isStrictInvariants());
    }

    /**
     * The standard daily order: local production and consumption, facilities,
     * fiscal redistribution, domestic trade, inter-realm clearing, quotas, spoilage.
     */
    public static List<TickSystem> standardPipeline() {
        List<TickSystem> pipeline = new ArrayList<>();
        pipeline.add(new ProductionSystem());
        pipeline.add(new FacilityProductionSystem());
        pipeline.add(new FiscalSystem());
        pipeline.add(new DomesticTradeSystem());
        pipeline.add(new InterRealmTradeSystem());
        pipeline.add(new FacilityQuotaSystem());
        pipeline.add(new SpoilageSystem());
        return pipeline;
    }

    // ========================================================================
    // Execution
    // ========================================================================

    /**
     * Initialize every system once. Called automatically by the first {@link #advanceDay()}.
     */
    public void initialize() {
        if (initialized) return;
        for (TickSystem system : systems) {
            system.initialize(state, topology);
        }
        initialized = true;
    }

    /**
     * Simulate one day.
     *
     * @return the day's snapshot
     * @throws InvariantMonitor.InvariantViolationException if a strict check fails
     */
    public EconomySnapshot advanceDay() {
        initialize();
        state.getEconomy().ledger().clear();
        int day = state.advanceDay();

        int ran = 0;
        for (TickSystem system : systems) {
            if (day % system.tickInterval() == 0) {
                system.tick(state, topology);
                ran++;
            }
        }

        monitor.checkDay(state);

        EconomySnapshot snapshot = aggregator.capture(state, day);
        timeSeries.record(snapshot);
        state.getEventBus().publish(new Event.DayAdvancedEvent(day, ran));
        return snapshot;
    }

    /**
     * Simulate several days.
     *
     * @return the last day's snapshot, or null when {@code days} is zero
     */
    public EconomySnapshot run(int days) {
        if (days < 0) throw new IllegalArgumentException("Days cannot be negative");
        EconomySnapshot last = null;
        for (int i = 0; i < days; i++) {
            last = advanceDay();
        }
        return last;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public SimulationState getState() { return state; }
    public WorldTopology getTopology() { return topology; }
    public EconomyTimeSeries getTimeSeries() { return timeSeries; }
    public InvariantMonitor getMonitor() { return monitor; }

    public List<TickSystem> getSystems() {
        return Collections.unmodifiableList(systems);
    }

    @Override
    public String toString() {
        return String.format("SimulationRunner[day=%d, systems=%d]", state.getDay(), systems.size());
    }
}
