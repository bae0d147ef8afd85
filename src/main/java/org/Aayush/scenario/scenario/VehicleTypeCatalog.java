package org.Aayush.scenario.scenario;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of vehicle types written at the top of every routes document.
 */
public final class VehicleTypeCatalog {
    private static final VehicleTypeCatalog STANDARD = new VehicleTypeCatalog(List.of(
            VehicleType.builder().id("car")
                    .accel(2.6).decel(4.5).sigma(0.5).length(5.0).minGap(2.5).maxSpeed(16.67)
                    .guiShape("passenger").build(),
            VehicleType.builder().id("motorcycle")
                    .accel(3.0).decel(5.0).sigma(0.5).length(2.5).minGap(1.5).maxSpeed(20.83)
                    .guiShape("motorcycle").build(),
            VehicleType.builder().id("bus")
                    .accel(1.2).decel(4.5).sigma(0.5).length(12.0).minGap(3.0).maxSpeed(13.89)
                    .guiShape("bus").build(),
            VehicleType.builder().id("truck")
                    .accel(1.3).decel(4.5).sigma(0.5).length(8.0).minGap(3.0).maxSpeed(11.11)
                    .guiShape("truck").build()
    ));

    private final Map<String, VehicleType> types;

    public VehicleTypeCatalog(List<VehicleType> types) {
        Objects.requireNonNull(types, "types");
        LinkedHashMap<String, VehicleType> byId = new LinkedHashMap<>();
        for (VehicleType type : types) {
            if (byId.putIfAbsent(type.getId(), type) != null) {
                throw new IllegalArgumentException("Duplicate vehicle type: " + type.getId());
            }
        }
        this.types = byId;
    }

    /**
     * car, motorcycle, bus, truck.
     */
    public static VehicleTypeCatalog standard() {
        return STANDARD;
    }

    public List<VehicleType> types() {
        return List.copyOf(types.values());
    }

    public Optional<VehicleType> find(String id) {
        return Optional.ofNullable(types.get(id));
    }

    public boolean contains(String id) {
        return types.containsKey(id);
    }
}
