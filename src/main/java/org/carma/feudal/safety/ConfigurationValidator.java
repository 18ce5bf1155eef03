package org.carma.feudal.safety;

import org.carma.feudal.config.ScenarioConfigLoader.*;
import org.carma.feudal.config.SimulationConfigLoader.FacilityConfig;
import org.carma.feudal.config.SimulationConfigLoader.PriceConfig;
import org.carma.feudal.model.FacilityDef;
import org.carma.feudal.model.FacilityRegistry;
import org.carma.feudal.model.GoodType;

import java.util.*;

/**
 * Load-time validation of simulation and scenario configuration.
 *
 * Validates:
 * - Every good key names a known good
 * - Price bands satisfy 0 ≤ min ≤ base ≤ max
 * - Recipes use two distinct known goods with positive amounts
 * - Scenario references (county → province → realm, facility ids) resolve
 * - Populations, treasuries and stocks are non-negative
 * - Placed facilities meet their placement threshold
 *
 * Errors make a configuration unusable. Warnings flag shapes that load but are
 * probably not intended, such as a realm without provinces.
 */
public class ConfigurationValidator {

    /**
     * Result of configuration validation.
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<ValidationError> errors;
        private final List<ValidationWarning> warnings;

        public ValidationResult(boolean valid, List<ValidationError> errors,
                                List<ValidationWarning> warnings) {
            this.valid = valid;
            this.errors = Collections.unmodifiableList(errors);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public static ValidationResult success() {
            return new ValidationResult(true, Collections.emptyList(), Collections.emptyList());
        }

        static ValidationResult of(List<ValidationError> errors, List<ValidationWarning> warnings) {
            return new ValidationResult(errors.isEmpty(), new ArrayList<>(errors), new ArrayList<>(warnings));
        }

        public boolean isValid() { return valid; }
        public List<ValidationError> getErrors() { return errors; }
        public List<ValidationWarning> getWarnings() { return warnings; }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        public List<String> errorMessages() {
            List<String> messages = new ArrayList<>();
            for (ValidationError e : errors) messages.add(e.toString());
            return messages;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(valid ? "VALID" : "INVALID");
            if (!errors.isEmpty()) {
                sb.append(" (").append(errors.size()).append(" errors)");
            }
            if (!warnings.isEmpty()) {
                sb.append(" (").append(warnings.size()).append(" warnings)");
            }
            return sb.toString();
        }

        public String toDetailedString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ValidationResult: ").append(valid ? "VALID" : "INVALID").append("\n");
            if (!errors.isEmpty()) {
                sb.append("Errors:\n");
                for (ValidationError error : errors) {
                    sb.append("  x ").append(error).append("\n");
                }
            }
            if (!warnings.isEmpty()) {
                sb.append("Warnings:\n");
                for (ValidationWarning warning : warnings) {
                    sb.append("  ! ").append(warning).append("\n");
                }
            }
            return sb.toString();
        }
    }

    public static class ValidationError {
        private final String category;
        private final String field;
        private final String message;

        public ValidationError(String category, String field, String message) {
            this.category = category;
            this.field = field;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s: %s", category, field, message);
        }
    }

    public static class ValidationWarning {
        private final String category;
        private final String message;

        public ValidationWarning(String category, String message) {
            this.category = category;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s", category, message);
        }
    }

    // ========================================================================
    // Simulation config
    // ========================================================================

    /**
     * @param facilities facility definitions, or null when the standard registry is used
     */
    public ValidationResult validateSimulation(List<PriceConfig> prices, List<FacilityConfig> facilities) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        for (PriceConfig pc : prices) {
            String field = "prices." + pc.good;
            Optional<GoodType> good = resolveGood(pc.good, field, "PRICE", errors);
            if (good.isEmpty()) continue;
            if (Double.isNaN(pc.base) || Double.isNaN(pc.min) || Double.isNaN(pc.max)) {
                errors.add(new ValidationError("PRICE", field, "base, min and max are all required"));
            } else if (pc.min < 0 || pc.min > pc.base || pc.base > pc.max) {
                errors.add(new ValidationError("PRICE", field, String.format(
                    "bounds out of order: min=%.4f base=%.4f max=%.4f", pc.min, pc.base, pc.max)));
            }
            if (!good.get().isTradeable()) {
                warnings.add(new ValidationWarning("PRICE", pc.good + " is never traded; its price is unused"));
            }
        }

        if (facilities != null) {
            Set<String> ids = new HashSet<>();
            for (FacilityConfig fc : facilities) {
                validateFacility(fc, ids, errors, warnings);
            }
        }

        return ValidationResult.of(errors, warnings);
    }

    private void validateFacility(FacilityConfig fc, Set<String> ids,
                                  List<ValidationError> errors, List<ValidationWarning> warnings) {
        String field = "facilities." + fc.id;
        if (fc.id == null || fc.id.isBlank()) {
            errors.add(new ValidationError("FACILITY", "facilities", "facility without id"));
            return;
        }
        if (!ids.add(fc.id)) {
            errors.add(new ValidationError("FACILITY", field, "duplicate id"));
        }
        Optional<GoodType> input = resolveGood(fc.inputGood, field + ".input", "FACILITY", errors);
        Optional<GoodType> output = resolveGood(fc.outputGood, field + ".output", "FACILITY", errors);
        if (input.isPresent() && output.isPresent() && input.get() == output.get()) {
            errors.add(new ValidationError("FACILITY", field, "input and output are the same good"));
        }
        if (fc.inputAmount <= 0 || fc.outputAmount <= 0) {
            errors.add(new ValidationError("FACILITY", field, "recipe amounts must be positive"));
        }
        if (fc.laborPerUnit < 0 || fc.placementMinProductivity < 0 || fc.baselineOutput < 0) {
            errors.add(new ValidationError("FACILITY", field, "labor, placement and output cannot be negative"));
        }
        if (fc.maxLaborFraction < 0 || fc.maxLaborFraction > 1) {
            errors.add(new ValidationError("FACILITY", field, "maxLaborFraction must be in [0, 1]"));
        }
        if (fc.baselineOutput == 0 || fc.maxLaborFraction == 0) {
            warnings.add(new ValidationWarning("FACILITY", fc.id + " can never produce"));
        }
    }

    // ========================================================================
    // Scenario config
    // ========================================================================

    public ValidationResult validateScenario(ScenarioConfig scenario, FacilityRegistry registry) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        if (scenario.realms.isEmpty()) {
            errors.add(new ValidationError("TOPOLOGY", "realms", "scenario defines no realms"));
        }

        Set<String> realmNames = new HashSet<>();
        for (RealmConfig rc : scenario.realms) {
            String field = "realms." + rc.name;
            if (!realmNames.add(rc.name)) {
                errors.add(new ValidationError("TOPOLOGY", field, "duplicate realm name"));
            }
            checkNonNegative(rc.treasury, field + ".treasury", errors);
            validateGoods(rc.stockpile, field + ".stockpile", errors);
            validateGoods(rc.seedStock, field + ".seedStock", errors);
        }

        Set<String> provinceNames = new HashSet<>();
        Set<String> realmsWithProvinces = new HashSet<>();
        for (ProvinceConfig pc : scenario.provinces) {
            String field = "provinces." + pc.name;
            if (!provinceNames.add(pc.name)) {
                errors.add(new ValidationError("TOPOLOGY", field, "duplicate province name"));
            }
            if (!realmNames.contains(pc.realm)) {
                errors.add(new ValidationError("TOPOLOGY", field + ".realm", "unknown realm: " + pc.realm));
            }
            realmsWithProvinces.add(pc.realm);
            checkNonNegative(pc.treasury, field + ".treasury", errors);
            validateGoods(pc.stockpile, field + ".stockpile", errors);
        }

        Set<String> countyNames = new HashSet<>();
        Set<String> provincesWithCounties = new HashSet<>();
        for (CountyConfig cc : scenario.counties) {
            String field = "counties." + cc.name;
            if (!countyNames.add(cc.name)) {
                errors.add(new ValidationError("TOPOLOGY", field, "duplicate county name"));
            }
            if (!provinceNames.contains(cc.province)) {
                errors.add(new ValidationError("TOPOLOGY", field + ".province", "unknown province: " + cc.province));
            }
            provincesWithCounties.add(cc.province);
            checkNonNegative(cc.population, field + ".population", errors);
            checkNonNegative(cc.treasury, field + ".treasury", errors);
            validateGoods(cc.productivity, field + ".productivity", errors);
            validateGoods(cc.stock, field + ".stock", errors);
            if (cc.population == 0) {
                warnings.add(new ValidationWarning("TOPOLOGY", cc.name + " has no population"));
            }
            validatePlacements(cc, field, registry, errors);
        }

        for (RealmConfig rc : scenario.realms) {
            if (!realmsWithProvinces.contains(rc.name)) {
                warnings.add(new ValidationWarning("TOPOLOGY", "realm " + rc.name + " has no provinces"));
            }
        }
        for (ProvinceConfig pc : scenario.provinces) {
            if (!provincesWithCounties.contains(pc.name)) {
                warnings.add(new ValidationWarning("TOPOLOGY", "province " + pc.name + " has no counties"));
            }
        }

        return ValidationResult.of(errors, warnings);
    }

    private void validatePlacements(CountyConfig cc, String field, FacilityRegistry registry,
                                    List<ValidationError> errors) {
        for (String facilityId : cc.facilities) {
            Optional<FacilityDef> def = registry.find(facilityId);
            if (def.isEmpty()) {
                errors.add(new ValidationError("FACILITY", field + ".facilities", "unknown facility: " + facilityId));
                continue;
            }
            GoodType input = def.get().getInputGood();
            double productivity = 0.0;
            for (Map.Entry<String, Double> e : cc.productivity.entrySet()) {
                if (matches(e.getKey(), input)) productivity = e.getValue();
            }
            if (productivity <= 0 || productivity < def.get().getPlacementMinProductivity()) {
                errors.add(new ValidationError("FACILITY", field + ".facilities", String.format(
                    "%s needs %s productivity >= %.3f, county has %.3f",
                    facilityId, input, def.get().getPlacementMinProductivity(), productivity)));
            }
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Optional<GoodType> resolveGood(String key, String field, String category,
                                           List<ValidationError> errors) {
        if (key == null) {
            errors.add(new ValidationError(category, field, "good is required"));
            return Optional.empty();
        }
        try {
            return Optional.of(GoodType.fromKey(key));
        } catch (IllegalArgumentException e) {
            errors.add(new ValidationError(category, field, "unknown good: " + key));
            return Optional.empty();
        }
    }

    private void validateGoods(Map<String, Double> amounts, String field, List<ValidationError> errors) {
        for (Map.Entry<String, Double> e : amounts.entrySet()) {
            if (resolveGood(e.getKey(), field, "GOODS", errors).isPresent()) {
                checkNonNegative(e.getValue(), field + "." + e.getKey(), errors);
            }
        }
    }

    private void checkNonNegative(double value, String field, List<ValidationError> errors) {
        if (value < 0 || Double.isNaN(value)) {
            errors.add(new ValidationError("VALUE", field, "must be non-negative, got " + value));
        }
    }

    private static boolean matches(String key, GoodType good) {
        try {
            return GoodType.fromKey(key) == good;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
