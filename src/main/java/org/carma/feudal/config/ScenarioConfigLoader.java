package org.carma.feudal.config;

import org.carma.feudal.config.SimulationConfigLoader.SimulationConfig;
import org.carma.feudal.model.*;
import org.carma.feudal.safety.ConfigurationValidator;
import org.carma.feudal.safety.ConfigurationValidator.ValidationResult;
import org.carma.feudal.simulation.EconomyState;
import org.carma.feudal.simulation.SimulationState;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.*;
import java.nio.file.*;
import java.util.*;

import static org.carma.feudal.config.SimulationConfigLoader.getDouble;
import static org.carma.feudal.config.SimulationConfigLoader.getInt;
import static org.carma.feudal.config.SimulationConfigLoader.getString;

/**
 * Loads a starting world from {@code scenario.yaml}.
 *
 * Tiers are declared flat and linked by name; ids follow declaration order:
 * <pre>
 * scenarios/
 *   two-kingdoms/
 *     scenario.yaml
 *
 * realms:
 *   - name: Albion
 *     treasury: 2000
 *     seedStock: { food: 500 }     # listed by a seed seller on day 0
 * provinces:
 *   - name: Northmarch
 *     realm: Albion
 * counties:
 *   - name: Ashford
 *     province: Northmarch
 *     population: 1200
 *     productivity: { food: 1.2, clay: 0.1 }
 *     stock: { food: 300 }
 *     facilities: [ kiln ]
 * </pre>
 */
public class ScenarioConfigLoader {

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    public static class ScenarioConfig {
        public String name;
        public String description;
        public List<RealmConfig> realms = new ArrayList<>();
        public List<ProvinceConfig> provinces = new ArrayList<>();
        public List<CountyConfig> counties = new ArrayList<>();

        @Override
        public String toString() {
            return String.format("ScenarioConfig[name=%s, realms=%d, provinces=%d, counties=%d]",
                name, realms.size(), provinces.size(), counties.size());
        }
    }

    public static class RealmConfig {
        public String name;
        public double treasury;
        public Map<String, Double> stockpile = new LinkedHashMap<>();
        public Map<String, Double> seedStock = new LinkedHashMap<>();
    }

    public static class ProvinceConfig {
        public String name;
        public String realm;
        public double treasury;
        public Map<String, Double> stockpile = new LinkedHashMap<>();
    }

    public static class CountyConfig {
        public String name;
        public String province;
        public double population;
        public double treasury;
        public int seatCell = -1;
        public Map<String, Double> productivity = new LinkedHashMap<>();
        public Map<String, Double> stock = new LinkedHashMap<>();
        public List<String> facilities = new ArrayList<>();
    }

    /**
     * A loaded world, ready to run.
     */
    public static class Scenario {
        private final String name;
        private final String description;
        private final WorldTopology topology;
        private final SimulationState state;
        private final ValidationResult validation;

        public Scenario(String name, String description, WorldTopology topology,
                        SimulationState state, ValidationResult validation) {
            this.name = name;
            this.description = description;
            this.topology = topology;
            this.state = state;
            this.validation = validation;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
        public WorldTopology getTopology() { return topology; }
        public SimulationState getState() { return state; }
        public ValidationResult getValidation() { return validation; }

        @Override
        public String toString() {
            return String.format("Scenario[%s, %s]", name, topology);
        }
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;
    private final ConfigurationValidator validator;

    public ScenarioConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
        this.validator = new ConfigurationValidator();
    }

    /**
     * Load {@code scenario.yaml} from a scenario directory, or a scenario file directly.
     */
    public Scenario load(Path path, SimulationConfig simulation) throws ConfigurationException {
        Path file = Files.isDirectory(path) ? path.resolve("scenario.yaml") : path;
        if (!Files.exists(file)) {
            throw new ConfigurationException("scenario.yaml not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return load(is, file.toString(), simulation);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read scenario: " + file, e);
        }
    }

    /**
     * Load a scenario from the classpath.
     */
    public Scenario loadResource(String resource, SimulationConfig simulation) throws ConfigurationException {
        InputStream is = ScenarioConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigurationException("Scenario resource not found: " + resource);
        }
        try (is) {
            return load(is, resource, simulation);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read scenario: " + resource, e);
        }
    }

    public Scenario load(InputStream is, String source, SimulationConfig simulation) throws ConfigurationException {
        ScenarioConfig config = parse(is, source);

        ValidationResult validation = validator.validateScenario(config, simulation.getFacilities());
        if (!validation.isValid()) {
            throw new ConfigurationException(source, validation.errorMessages());
        }
        return build(config, simulation, validation);
    }

    /**
     * Parse raw YAML into a ScenarioConfig without validating references.
     */
    @SuppressWarnings("unchecked")
    public ScenarioConfig parse(InputStream is, String source) throws ConfigurationException {
        try {
            Map<String, Object> raw = yaml.load(is);
            if (raw == null) {
                throw new ConfigurationException("Empty scenario: " + source);
            }
            ScenarioConfig config = new ScenarioConfig();
            config.name = getString(raw, "name", "unnamed");
            config.description = getString(raw, "description", "");

            for (Map<String, Object> map : listOf(raw, "realms")) {
                RealmConfig rc = new RealmConfig();
                rc.name = getString(map, "name");
                rc.treasury = getDouble(map, "treasury", 0.0);
                rc.stockpile = goods(map, "stockpile");
                rc.seedStock = goods(map, "seedStock");
                config.realms.add(rc);
            }
            for (Map<String, Object> map : listOf(raw, "provinces")) {
                ProvinceConfig pc = new ProvinceConfig();
                pc.name = getString(map, "name");
                pc.realm = getString(map, "realm");
                pc.treasury = getDouble(map, "treasury", 0.0);
                pc.stockpile = goods(map, "stockpile");
                config.provinces.add(pc);
            }
            for (Map<String, Object> map : listOf(raw, "counties")) {
                CountyConfig cc = new CountyConfig();
                cc.name = getString(map, "name");
                cc.province = getString(map, "province");
                cc.population = getDouble(map, "population", 0.0);
                cc.treasury = getDouble(map, "treasury", 0.0);
                cc.seatCell = getInt(map, "seatCell", -1);
                cc.productivity = goods(map, "productivity");
                cc.stock = goods(map, "stock");
                List<Object> facilities = (List<Object>) map.get("facilities");
                if (facilities != null) {
                    for (Object f : facilities) cc.facilities.add(f.toString());
                }
                config.counties.add(cc);
            }
            return config;
        } catch (YAMLException | ClassCastException | IllegalArgumentException e) {
            throw new ConfigurationException("Malformed scenario " + source + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOf(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        return value == null ? Collections.emptyList() : (List<Map<String, Object>>) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Double> goods(Map<String, Object> raw, String key) {
        Map<String, Double> result = new LinkedHashMap<>();
        Map<String, Object> map = (Map<String, Object>) raw.get(key);
        if (map == null) return result;
        for (String good : map.keySet()) {
            result.put(good, getDouble(map, good, 0.0));
        }
        return result;
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    /**
     * Build topology and starting state from a validated config.
     */
    public Scenario build(ScenarioConfig config, SimulationConfig simulation, ValidationResult validation) {
        WorldTopology.Builder topo = WorldTopology.builder();
        Map<String, Integer> realmIds = new HashMap<>();
        Map<String, Integer> provinceIds = new HashMap<>();

        for (RealmConfig rc : config.realms) {
            realmIds.put(rc.name, topo.addRealm());
        }
        for (ProvinceConfig pc : config.provinces) {
            provinceIds.put(pc.name, topo.addProvince(realmIds.get(pc.realm)));
        }
        for (CountyConfig cc : config.counties) {
            topo.addCounty(provinceIds.get(cc.province), cc.seatCell);
        }
        WorldTopology topology = topo.build();

        EconomyState economy = EconomyState.create(topology, simulation.getCatalog());

        for (int r = 0; r < config.realms.size(); r++) {
            RealmConfig rc = config.realms.get(r);
            RealmEconomy realm = economy.realm(r);
            realm.treasury = rc.treasury;
            fill(realm.stockpile, rc.stockpile);
            for (Map.Entry<String, Double> e : rc.seedStock.entrySet()) {
                GoodType good = GoodType.fromKey(e.getKey());
                realm.stockpile[good.ordinal()] += e.getValue();
                economy.ledger().list(new ConsignmentLot(
                    new MarketParticipant.SeedSeller(r), good, e.getValue(), 0));
            }
        }
        for (int p = 0; p < config.provinces.size(); p++) {
            ProvinceConfig pc = config.provinces.get(p);
            economy.province(p).treasury = pc.treasury;
            fill(economy.province(p).stockpile, pc.stockpile);
        }
        for (int c = 0; c < config.counties.size(); c++) {
            CountyConfig cc = config.counties.get(c);
            CountyEconomy county = economy.county(c);
            county.population = cc.population;
            county.treasury = cc.treasury;
            fill(county.productivity, cc.productivity);
            fill(county.stock, cc.stock);
            for (String facilityId : cc.facilities) {
                economy.addFacility(simulation.getFacilities().get(facilityId), c, cc.seatCell);
            }
        }

        SimulationState state = new SimulationState(economy, simulation.getCatalog(),
            simulation.getFacilities(), simulation.getSettings());
        return new Scenario(config.name, config.description, topology, state, validation);
    }

    private static void fill(double[] target, Map<String, Double> amounts) {
        for (Map.Entry<String, Double> e : amounts.entrySet()) {
            target[GoodType.fromKey(e.getKey()).ordinal()] = e.getValue();
        }
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List scenario directories under {@code configRoot/scenarios}.
     */
    public List<String> listScenarios(Path configRoot) throws IOException {
        Path scenariosDir = configRoot.resolve("scenarios");
        if (!Files.exists(scenariosDir)) {
            return Collections.emptyList();
        }

        List<String> scenarios = new ArrayList<>();
        try (var stream = Files.list(scenariosDir)) {
            stream.filter(Files::isDirectory)
                  .filter(p -> Files.exists(p.resolve("scenario.yaml")))
                  .map(p -> p.getFileName().toString())
                  .sorted()
                  .forEach(scenarios::add);
        }
        return scenarios;
    }
}
