package org.carma.feudal.runner;

import org.carma.feudal.config.*;
import org.carma.feudal.config.ScenarioConfigLoader.Scenario;
import org.carma.feudal.config.SimulationConfigLoader.SimulationConfig;
import org.carma.feudal.event.Event;
import org.carma.feudal.model.EconomySnapshot;
import org.carma.feudal.model.GoodType;
import org.carma.feudal.safety.ConfigurationValidator.ValidationWarning;
import org.carma.feudal.simulation.EconomyTimeSeries;
import org.carma.feudal.simulation.SimulationRunner;

import java.io.IOException;
import java.nio.file.*;
import java.util.List;

/**
 * Runs a scenario loaded from configuration files and reports the economy over time.
 *
 * Usage:
 * <pre>
 * ScenarioRunner runner = new ScenarioRunner();
 * ScenarioResult result = runner.run(Paths.get("scenarios/two-kingdoms"), 360);
 * System.out.println(result);
 * </pre>
 */
public class ScenarioRunner {

    private final SimulationConfigLoader simulationLoader;
    private final ScenarioConfigLoader scenarioLoader;

    private boolean verbose = true;
    private int reportEvery = 30;
    private Path simulationConfig;

    public ScenarioRunner() {
        this.simulationLoader = new SimulationConfigLoader();
        this.scenarioLoader = new ScenarioConfigLoader();
    }

    public ScenarioRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    public ScenarioRunner reportEvery(int days) {
        if (days <= 0) throw new IllegalArgumentException("Report interval must be positive");
        this.reportEvery = days;
        return this;
    }

    /**
     * Use a simulation.yaml from disk instead of the bundled one.
     */
    public ScenarioRunner simulationConfig(Path file) {
        this.simulationConfig = file;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Load and run a scenario.
     *
     * @param scenarioPath scenario directory or scenario.yaml
     * @param days number of days to simulate
     */
    public ScenarioResult run(Path scenarioPath, int days) throws ConfigurationException {
        SimulationConfig simulation = simulationConfig != null
            ? simulationLoader.load(simulationConfig)
            : simulationLoader.loadResource(SimulationConfigLoader.DEFAULT_RESOURCE);
        logWarnings(simulation.getValidation().getWarnings());

        log("Loading scenario from: " + scenarioPath);
        Scenario scenario = scenarioLoader.load(scenarioPath, simulation);
        return run(scenario, days);
    }

    /**
     * Run an already loaded scenario.
     */
    public ScenarioResult run(Scenario scenario, int days) {
        log("Scenario: " + scenario.getName());
        log("Description: " + scenario.getDescription());
        log("World: " + scenario.getTopology());
        logWarnings(scenario.getValidation().getWarnings());
        log("");

        SimulationRunner runner = new SimulationRunner(scenario.getState(), scenario.getTopology());
        if (verbose) {
            scenario.getState().getEventBus().subscribe(Event.InvariantViolationEvent.class,
                e -> log("  ! day " + e.day() + " " + e.checkName() + ": " + e.message()));
        }

        log("=== SIMULATION ===");
        for (int i = 0; i < days; i++) {
            EconomySnapshot snapshot = runner.advanceDay();
            if (snapshot.getDay() % reportEvery == 0 || i == days - 1) {
                log("  " + snapshot);
            }
        }
        log("");

        ScenarioResult result = new ScenarioResult(scenario.getName(), days, runner.getTimeSeries(),
            scenario.getState().getEventBus().getEventCount(Event.MarketClearedEvent.class),
            runner.getMonitor().getFailures().size());

        log("=== SUMMARY ===");
        result.getTimeSeries().latest().ifPresent(last -> {
            log("Population: " + String.format("%.0f", last.getPopulation()));
            log("Mean satisfaction: " + String.format("%.3f", last.getMeanSatisfaction()));
            for (GoodType good : GoodType.values()) {
                double stock = last.totalStock(good);
                if (stock > 0) {
                    log(String.format("  %-10s stock=%10.2f price=%7.3f", good, stock, last.marketPrice(good)));
                }
            }
            log("Total treasury: " + String.format("%.2f", last.getTotalTreasury()));
        });
        log("Market clearings: " + result.getMarketClearings());
        return result;
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Outcome of a scenario run.
     */
    public static class ScenarioResult {
        private final String scenarioName;
        private final int days;
        private final EconomyTimeSeries timeSeries;
        private final int marketClearings;
        private final int invariantFailures;

        public ScenarioResult(String scenarioName, int days, EconomyTimeSeries timeSeries,
                              int marketClearings, int invariantFailures) {
            this.scenarioName = scenarioName;
            this.days = days;
            this.timeSeries = timeSeries;
            this.marketClearings = marketClearings;
            this.invariantFailures = invariantFailures;
        }

        public String getScenarioName() { return scenarioName; }
        public int getDays() { return days; }
        public EconomyTimeSeries getTimeSeries() { return timeSeries; }
        public int getMarketClearings() { return marketClearings; }
        public int getInvariantFailures() { return invariantFailures; }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ScenarioResult[").append(scenarioName).append("]\n");
            sb.append("  Days: ").append(days).append("\n");
            sb.append("  Market clearings: ").append(marketClearings).append("\n");
            sb.append("  Invariant failures: ").append(invariantFailures).append("\n");
            timeSeries.latest().ifPresent(s -> sb.append("  Last: ").append(s).append("\n"));
            return sb.toString();
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void log(String message) {
        if (verbose) {
            System.out.println(message);
        }
    }

    private void logWarnings(List<ValidationWarning> warnings) {
        for (ValidationWarning warning : warnings) {
            log("Warning: " + warning);
        }
    }

    public List<String> listScenarios(Path configRoot) throws IOException {
        return scenarioLoader.listScenarios(configRoot);
    }

    /**
     * {@code ScenarioRunner <scenario-dir> [days] [simulation.yaml]}
     */
    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: ScenarioRunner <scenario-dir> [days] [simulation.yaml]");
            System.exit(2);
        }
        int days = args.length > 1 ? Integer.parseInt(args[1]) : 360;
        ScenarioRunner runner = new ScenarioRunner();
        if (args.length > 2) {
            runner.simulationConfig(Paths.get(args[2]));
        }
        try {
            System.out.println(runner.run(Paths.get(args[0]), days));
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            System.exit(1);
        }
    }
}
