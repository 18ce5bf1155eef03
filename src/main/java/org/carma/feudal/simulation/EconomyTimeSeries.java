package org.carma.feudal.simulation;

import org.carma.feudal.model.EconomySnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Bounded history of daily snapshots. The oldest snapshot is dropped once full.
 */
public class EconomyTimeSeries {

    private final int capacity;
    private final Deque<EconomySnapshot> snapshots = new ArrayDeque<>();

    public EconomyTimeSeries(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("Capacity must be positive");
        this.capacity = capacity;
    }

    public void record(EconomySnapshot snapshot) {
        if (snapshots.size() == capacity) {
            snapshots.removeFirst();
        }
        snapshots.addLast(snapshot);
    }

    public Optional<EconomySnapshot> latest() {
        return Optional.ofNullable(snapshots.peekLast());
    }

    public List<EconomySnapshot> all() {
        return new ArrayList<>(snapshots);
    }

    /**
     * One metric across the retained history, oldest first.
     */
    public double[] series(ToDoubleFunction<EconomySnapshot> metric) {
        return snapshots.stream().mapToDouble(metric).toArray();
    }

    public int size() {
        return snapshots.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        snapshots.clear();
    }
}
