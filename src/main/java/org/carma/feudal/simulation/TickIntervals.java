package org.carma.feudal.simulation;

/**
 * Standard tick intervals, in simulated days.
 */
public final class TickIntervals {

    public static final int DAILY = 1;
    public static final int WEEKLY = 7;
    public static final int MONTHLY = 30;
    public static final int YEARLY = 360;

    private TickIntervals() {}
}
