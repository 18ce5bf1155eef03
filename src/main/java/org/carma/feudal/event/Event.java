package org.carma.feudal.event;

import org.carma.feudal.model.GoodType;

/**
 * Base interface for all simulation events.
 * Events carry the simulated day rather than a wall-clock time so that two runs
 * from the same state publish identical histories.
 */
public sealed interface Event permits
        Event.DayAdvancedEvent,
        Event.CurrencyMintedEvent,
        Event.MarketClearedEvent,
        Event.InvariantViolationEvent {

    int day();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * The runner finished every scheduled system for a day.
     */
    record DayAdvancedEvent(
            int day,
            int systemsRun
    ) implements Event {
        public String eventType() { return "DAY_ADVANCED"; }
    }

    /**
     * A realm converted precious ore into crowns.
     */
    record CurrencyMintedEvent(
            int day,
            int realmId,
            double goldKg,
            double silverKg,
            double crowns
    ) implements Event {
        public String eventType() { return "CURRENCY_MINTED"; }
    }

    /**
     * One good traded between realms at a clearing price.
     */
    record MarketClearedEvent(
            int day,
            GoodType good,
            double price,
            double volume,
            double fillRatio,
            double sellRatio
    ) implements Event {
        public String eventType() { return "MARKET_CLEARED"; }
    }

    /**
     * A post-tick state check failed.
     */
    record InvariantViolationEvent(
            int day,
            String checkName,
            String message
    ) implements Event {
        public String eventType() { return "INVARIANT_VIOLATION"; }
    }
}
