package io.storvix.core.fleet;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * Latest telemetry snapshot of one storage system in the fleet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageSystem(
    String hostId,
    String name,
    String company,
    String unitId,
    double capacityTb,
    double usedTb,
    Double healthScore,
    boolean sendingTelemetry,
    Instant lastSeenAt
) {
    public StorageSystem {
        hostId = hostId == null ? "" : hostId.trim();
        name = name == null || name.isBlank() ? hostId : name.trim();
        company = company == null ? "" : company.trim();
        unitId = unitId == null ? "" : unitId.trim();
    }

    @JsonIgnore
    public double usedPercent() {
        if (capacityTb <= 0) {
            return 0;
        }
        return usedTb * 100.0 / capacityTb;
    }
}
