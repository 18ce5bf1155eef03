package org.carma.feudal.simulation;

import org.carma.feudal.model.EconomySnapshot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EconomyTimeSeriesTest {

    private static EconomySnapshot day(int day, double population) {
        EconomySnapshot.Builder b = EconomySnapshot.builder(day);
        b.population = population;
        return b.build();
    }

    @Test
    void oldestSnapshotIsDroppedWhenFull() {
        EconomyTimeSeries series = new EconomyTimeSeries(3);
        for (int d = 1; d <= 5; d++) series.record(day(d, d * 10));

        assertEquals(3, series.size());
        assertEquals(3, series.all().get(0).getDay());
        assertEquals(5, series.latest().orElseThrow().getDay());
    }

    @Test
    void metricSeriesIsOldestFirst() {
        EconomyTimeSeries series = new EconomyTimeSeries(10);
        series.record(day(1, 100));
        series.record(day(2, 120));
        series.record(day(3, 90));

        assertArrayEquals(new double[]{100, 120, 90}, series.series(EconomySnapshot::getPopulation), 1e-9);
    }

    @Test
    void emptySeriesHasNoLatest() {
        EconomyTimeSeries series = new EconomyTimeSeries(1);
        assertTrue(series.latest().isEmpty());

        series.record(day(1, 1));
        series.clear();
        assertEquals(0, series.size());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new EconomyTimeSeries(0));
    }
}
