package org.carma.feudal.config;

import org.carma.feudal.config.SimulationConfigLoader.SimulationConfig;
import org.carma.feudal.model.FacilityDef;
import org.carma.feudal.model.GoodType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigLoaderTest {

    private final SimulationConfigLoader loader = new SimulationConfigLoader();

    private SimulationConfig loadString(String yaml) throws ConfigurationException {
        return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    @Test
    void bundledConfigLoads() throws Exception {
        SimulationConfig config = loader.loadResource(SimulationConfigLoader.DEFAULT_RESOURCE);

        assertTrue(config.getValidation().isValid());
        assertEquals(0.2, config.getSettings().getDucalTaxRate(), 1e-9);
        assertEquals(1.0, config.getCatalog().basePrice(GoodType.FOOD), 1e-9);
        assertEquals(30.0, config.getFacilities().get("kiln").getLaborRequired(), 1e-9);
    }

    @Test
    void overridesApplyAndOmittedKeysKeepDefaults() throws Exception {
        SimulationConfig config = loader.loadResource("config/two-facilities.yaml");

        assertEquals(0.25, config.getSettings().getDucalTaxRate(), 1e-9);
        assertEquals(0.1, config.getSettings().getCrossRealmTariffRate(), 1e-9);
        assertFalse(config.getSettings().isStrictInvariants());
        assertEquals(0.2, config.getSettings().getRoyalTaxRate(), 1e-9);

        assertEquals(4.0, config.getCatalog().basePrice(GoodType.SALT), 1e-9);
        assertEquals(12.0, config.getCatalog().maxPrice(GoodType.SALT), 1e-9);
        assertEquals(GoodType.FOOD.getDefaultBasePrice(), config.getCatalog().basePrice(GoodType.FOOD), 1e-9);

        FacilityDef brewery = config.getFacilities().get("brewery");
        assertEquals("Brewery", brewery.getName());
        assertEquals(GoodType.ALE, brewery.getOutputGood());
        assertEquals(20.0, brewery.getBaselineOutput(), 1e-9);
        assertEquals(0.1, brewery.getMaxLaborFraction(), 1e-9);
        assertEquals(2, config.getFacilities().size());
    }

    @Test
    void emptyDocumentMeansDefaults() throws Exception {
        SimulationConfig config = loadString("");

        assertEquals(0.013, config.getSettings().getProductionTaxRate(), 1e-9);
        assertEquals(1, config.getFacilities().size());
    }

    @Test
    void unknownGoodIsFatal() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> loader.loadResource("config/unknown-good.yaml"));

        assertTrue(e.getErrors().stream().anyMatch(m -> m.contains("unknown good: mithril")), e.getMessage());
    }

    @Test
    void recipeWithSameInputAndOutputIsFatal() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> loader.loadResource("config/identical-recipe.yaml"));

        assertTrue(e.getMessage().contains("input and output are the same good"), e.getMessage());
    }

    @Test
    void invertedPriceBoundsAreFatal() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> loader.loadResource("config/inverted-prices.yaml"));

        assertTrue(e.getMessage().contains("bounds out of order"), e.getMessage());
    }

    @Test
    void duplicateKeysAreFatal() {
        assertThrows(ConfigurationException.class, () -> loader.loadResource("config/duplicate-keys.yaml"));
    }

    @Test
    void outOfRangeOrNonNumericSettingsAreFatal() {
        assertThrows(ConfigurationException.class, () -> loadString("settings:\n  royalTaxRate: 2.0\n"));
        assertThrows(ConfigurationException.class, () -> loadString("settings:\n  surplusDays: lots\n"));
        assertThrows(ConfigurationException.class, () -> loadString("- just\n- a list\n"));
    }

    @Test
    void missingFileIsFatal(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> loader.load(dir.resolve("simulation.yaml")));
        assertThrows(ConfigurationException.class, () -> loader.loadResource("config/nowhere.yaml"));
    }

    @Test
    void loadsFromDisk(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("simulation.yaml");
        Files.writeString(file, "settings:\n  granaryFillRate: 0.1\n");

        assertEquals(0.1, loader.load(file).getSettings().getGranaryFillRate(), 1e-9);
    }
}
