package org.carma.feudal.config;

import org.carma.feudal.model.*;
import org.carma.feudal.safety.ConfigurationValidator;
import org.carma.feudal.safety.ConfigurationValidator.ValidationResult;
import org.carma.feudal.simulation.SimulationSettings;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Loads economy-wide settings from {@code simulation.yaml}.
 *
 * The file has three optional sections:
 * <pre>
 * settings:        # rates and windows, see SimulationSettings
 *   ducalTaxRate: 0.2
 * prices:          # per-good price band overrides
 *   food: { base: 1.0, min: 0.1, max: 10.0 }
 * facilities:      # facility types; the standard kiln when omitted
 *   - id: kiln
 *     input: { good: clay, amount: 2 }
 *     output: { good: pottery, amount: 1 }
 *     laborPerUnit: 3
 * </pre>
 * Missing keys keep their defaults. Unknown goods, malformed recipes and
 * inverted price bands are fatal.
 */
public class SimulationConfigLoader {

    public static final String DEFAULT_RESOURCE = "config/simulation.yaml";

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Price band override for one good.
     */
    public static class PriceConfig {
        public String good;
        public double base;
        public double min;
        public double max;

        @Override
        public String toString() {
            return String.format("PriceConfig[%s: %.3f in [%.3f, %.3f]]", good, base, min, max);
        }
    }

    /**
     * Facility type definition.
     */
    public static class FacilityConfig {
        public String id;
        public String name;
        public String inputGood;
        public double inputAmount;
        public String outputGood;
        public double outputAmount;
        public double laborPerUnit;
        public double placementMinProductivity;
        public double maxLaborFraction = 0.1;
        public double baselineOutput = 10.0;

        @Override
        public String toString() {
            return String.format("FacilityConfig[id=%s, %s -> %s]", id, inputGood, outputGood);
        }
    }

    /**
     * Everything loaded from one file, ready for use.
     */
    public static class SimulationConfig {
        private final SimulationSettings settings;
        private final GoodCatalog catalog;
        private final FacilityRegistry facilities;
        private final ValidationResult validation;

        public SimulationConfig(SimulationSettings settings, GoodCatalog catalog,
                                FacilityRegistry facilities, ValidationResult validation) {
            this.settings = settings;
            this.catalog = catalog;
            this.facilities = facilities;
            this.validation = validation;
        }

        public static SimulationConfig defaults() {
            return new SimulationConfig(SimulationSettings.defaults(), GoodCatalog.standard(),
                FacilityRegistry.standard(), ValidationResult.success());
        }

        public SimulationSettings getSettings() { return settings; }
        public GoodCatalog getCatalog() { return catalog; }
        public FacilityRegistry getFacilities() { return facilities; }
        public ValidationResult getValidation() { return validation; }
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;
    private final ConfigurationValidator validator;

    public SimulationConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
        this.validator = new ConfigurationValidator();
    }

    /**
     * Load from a file on disk.
     */
    public SimulationConfig load(Path file) throws ConfigurationException {
        if (!Files.exists(file)) {
            throw new ConfigurationException("Simulation config not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return load(is, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read simulation config: " + file, e);
        }
    }

    /**
     * Load from the classpath.
     */
    public SimulationConfig loadResource(String resource) throws ConfigurationException {
        InputStream is = SimulationConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigurationException("Simulation config resource not found: " + resource);
        }
        try (is) {
            return load(is, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read simulation config: " + resource, e);
        }
    }

    public SimulationConfig load(InputStream is, String source) throws ConfigurationException {
        Map<String, Object> raw;
        try {
            raw = yaml.load(is);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Malformed YAML in " + source + ": " + e.getMessage(), e);
        }
        if (raw == null) raw = Collections.emptyMap();
        return parse(raw, source);
    }

    @SuppressWarnings("unchecked")
    private SimulationConfig parse(Map<String, Object> raw, String source) throws ConfigurationException {
        List<PriceConfig> prices;
        List<FacilityConfig> facilityConfigs;
        SimulationSettings settings;
        try {
            settings = parseSettings((Map<String, Object>) raw.get("settings"));
            prices = parsePrices((Map<String, Object>) raw.get("prices"));
            facilityConfigs = parseFacilities((List<Map<String, Object>>) raw.get("facilities"));
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid value in " + source + ": " + e.getMessage(), e);
        }

        ValidationResult validation = validator.validateSimulation(prices, facilityConfigs);
        if (!validation.isValid()) {
            throw new ConfigurationException(source, validation.errorMessages());
        }

        return new SimulationConfig(settings, buildCatalog(prices),
            facilityConfigs == null ? FacilityRegistry.standard() : buildRegistry(facilityConfigs), validation);
    }

    private SimulationSettings parseSettings(Map<String, Object> map) {
        SimulationSettings s = SimulationSettings.defaults();
        if (map == null) return s;

        s.setSatisfactionWindow(getInt(map, "satisfactionWindow", s.getSatisfactionWindow()));
        s.setDistressThreshold(getDouble(map, "distressThreshold", s.getDistressThreshold()));
        s.setEfficiencyAlpha(getDouble(map, "efficiencyAlpha", s.getEfficiencyAlpha()));
        s.setSurplusDays(getDouble(map, "surplusDays", s.getSurplusDays()));
        s.setDucalTaxRate(getDouble(map, "ducalTaxRate", s.getDucalTaxRate()));
        s.setRoyalTaxRate(getDouble(map, "royalTaxRate", s.getRoyalTaxRate()));
        s.setProductionTaxRate(getDouble(map, "productionTaxRate", s.getProductionTaxRate()));
        s.setRoyalRevenueShare(getDouble(map, "royalRevenueShare", s.getRoyalRevenueShare()));
        s.setGranaryDaysBuffer(getDouble(map, "granaryDaysBuffer", s.getGranaryDaysBuffer()));
        s.setGranaryDiscount(getDouble(map, "granaryDiscount", s.getGranaryDiscount()));
        s.setGranaryFillRate(getDouble(map, "granaryFillRate", s.getGranaryFillRate()));
        s.setCrossProvinceTollRate(getDouble(map, "crossProvinceTollRate", s.getCrossProvinceTollRate()));
        s.setCrossRealmTariffRate(getDouble(map, "crossRealmTariffRate", s.getCrossRealmTariffRate()));
        s.setGoldSmeltingYield(getDouble(map, "goldSmeltingYield", s.getGoldSmeltingYield()));
        s.setSilverSmeltingYield(getDouble(map, "silverSmeltingYield", s.getSilverSmeltingYield()));
        s.setCrownsPerKgGold(getDouble(map, "crownsPerKgGold", s.getCrownsPerKgGold()));
        s.setCrownsPerKgSilver(getDouble(map, "crownsPerKgSilver", s.getCrownsPerKgSilver()));
        s.setSnapshotCapacity(getInt(map, "snapshotCapacity", s.getSnapshotCapacity()));
        s.setStrictInvariants(getBoolean(map, "strictInvariants", s.isStrictInvariants()));
        return s;
    }

    @SuppressWarnings("unchecked")
    private List<PriceConfig> parsePrices(Map<String, Object> map) {
        List<PriceConfig> prices = new ArrayList<>();
        if (map == null) return prices;
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            Map<String, Object> band = (Map<String, Object>) entry.getValue();
            PriceConfig pc = new PriceConfig();
            pc.good = entry.getKey();
            pc.base = getDouble(band, "base", Double.NaN);
            pc.min = getDouble(band, "min", Double.NaN);
            pc.max = getDouble(band, "max", Double.NaN);
            prices.add(pc);
        }
        return prices;
    }

    @SuppressWarnings("unchecked")
    private List<FacilityConfig> parseFacilities(List<Map<String, Object>> list) {
        if (list == null) return null;
        List<FacilityConfig> facilities = new ArrayList<>();
        for (Map<String, Object> map : list) {
            FacilityConfig fc = new FacilityConfig();
            fc.id = getString(map, "id");
            fc.name = getString(map, "name", fc.id);
            Map<String, Object> input = (Map<String, Object>) map.get("input");
            if (input != null) {
                fc.inputGood = getString(input, "good");
                fc.inputAmount = getDouble(input, "amount", 0.0);
            }
            Map<String, Object> output = (Map<String, Object>) map.get("output");
            if (output != null) {
                fc.outputGood = getString(output, "good");
                fc.outputAmount = getDouble(output, "amount", 0.0);
            }
            fc.laborPerUnit = getDouble(map, "laborPerUnit", 0.0);
            fc.placementMinProductivity = getDouble(map, "placementMinProductivity", 0.0);
            fc.maxLaborFraction = getDouble(map, "maxLaborFraction", fc.maxLaborFraction);
            fc.baselineOutput = getDouble(map, "baselineOutput", fc.baselineOutput);
            facilities.add(fc);
        }
        return facilities;
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    /**
     * Standard catalog with validated overrides applied.
     */
    public GoodCatalog buildCatalog(List<PriceConfig> prices) {
        GoodCatalog.Builder builder = GoodCatalog.standard().toBuilder();
        for (PriceConfig pc : prices) {
            builder.price(GoodType.fromKey(pc.good), pc.base, pc.min, pc.max);
        }
        return builder.build();
    }

    public FacilityRegistry buildRegistry(List<FacilityConfig> configs) {
        FacilityRegistry registry = new FacilityRegistry();
        for (FacilityConfig fc : configs) {
            registry.register(FacilityDef.builder(fc.id)
                .name(fc.name)
                .input(GoodType.fromKey(fc.inputGood), fc.inputAmount)
                .output(GoodType.fromKey(fc.outputGood), fc.outputAmount)
                .laborPerUnit(fc.laborPerUnit)
                .placementMinProductivity(fc.placementMinProductivity)
                .maxLaborFraction(fc.maxLaborFraction)
                .baselineOutput(fc.baselineOutput)
                .build());
        }
        return registry;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    static String getString(Map<String, Object> map, String key) {
        return getString(map, key, null);
    }

    static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            throw new IllegalArgumentException(key + " must be a number, got: " + value);
        }
        return defaultValue;
    }

    static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value != null) {
            throw new IllegalArgumentException(key + " must be a number, got: " + value);
        }
        return defaultValue;
    }

    static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }
}
