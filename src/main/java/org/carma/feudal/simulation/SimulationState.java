package org.carma.feudal.simulation;

import org.carma.feudal.event.EventBus;
import org.carma.feudal.model.FacilityRegistry;
import org.carma.feudal.model.GoodCatalog;

import java.util.Objects;

/**
 * Everything a tick system can see: the current day, the economy arena and the
 * static catalogs and settings that parameterise it.
 */
public class SimulationState {

    private int day;
    private final EconomyState economy;
    private final GoodCatalog catalog;
    private final FacilityRegistry facilityRegistry;
    private final SimulationSettings settings;
    private final EventBus eventBus;

    public SimulationState(EconomyState economy, GoodCatalog catalog,
                           FacilityRegistry facilityRegistry, SimulationSettings settings) {
        this(economy, catalog, facilityRegistry, settings, new EventBus());
    }

    public SimulationState(EconomyState economy, GoodCatalog catalog, FacilityRegistry facilityRegistry,
                           SimulationSettings settings, EventBus eventBus) {
        this.economy = Objects.requireNonNull(economy, "Economy cannot be null");
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        this.facilityRegistry = Objects.requireNonNull(facilityRegistry, "Facility registry cannot be null");
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
    }

    public int getDay() { return day; }
    public EconomyState getEconomy() { return economy; }
    public GoodCatalog getCatalog() { return catalog; }
    public FacilityRegistry getFacilityRegistry() { return facilityRegistry; }
    public SimulationSettings getSettings() { return settings; }
    public EventBus getEventBus() { return eventBus; }

    /**
     * Move to the next day.
     * @return the new day
     */
    int advanceDay() {
        return ++day;
    }

    /**
     * Independent copy at the same day with a fresh event bus.
     */
    public SimulationState copy() {
        SimulationState copy = new SimulationState(economy.copy(), catalog, facilityRegistry, settings);
        copy.day = day;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("SimulationState[day=%d, %s]", day, economy);
    }
}
