package org.carma.feudal.model;

import java.util.*;

/**
 * Ordered set of facility definitions, keyed by id.
 * Iteration order is registration order.
 */
public class FacilityRegistry {

    private final Map<String, FacilityDef> defs = new LinkedHashMap<>();

    /**
     * Registry holding the kiln: 2 clay to 1 pottery, 3 workers per unit.
     */
    public static FacilityRegistry standard() {
        FacilityRegistry registry = new FacilityRegistry();
        registry.register(FacilityDef.builder("kiln")
            .name("Kiln")
            .input(GoodType.CLAY, 2.0)
            .output(GoodType.POTTERY, 1.0)
            .laborPerUnit(3)
            .placementMinProductivity(0.05)
            .maxLaborFraction(0.1)
            .baselineOutput(10)
            .build());
        return registry;
    }

    /**
     * @throws IllegalArgumentException if the id is already registered
     */
    public FacilityRegistry register(FacilityDef def) {
        if (defs.containsKey(def.getId())) {
            throw new IllegalArgumentException("Duplicate facility id: " + def.getId());
        }
        defs.put(def.getId(), def);
        return this;
    }

    public Optional<FacilityDef> find(String id) {
        return Optional.ofNullable(defs.get(id));
    }

    /**
     * @throws IllegalArgumentException if no def has this id
     */
    public FacilityDef get(String id) {
        FacilityDef def = defs.get(id);
        if (def == null) {
            throw new IllegalArgumentException("Unknown facility id: " + id);
        }
        return def;
    }

    public List<FacilityDef> all() {
        return List.copyOf(defs.values());
    }

    /**
     * Goods produced by at least one registered facility.
     */
    public Set<GoodType> outputGoods() {
        Set<GoodType> outputs = EnumSet.noneOf(GoodType.class);
        for (FacilityDef def : defs.values()) outputs.add(def.getOutputGood());
        return outputs;
    }

    public int size() {
        return defs.size();
    }

    @Override
    public String toString() {
        return "FacilityRegistry" + defs.keySet();
    }
}
