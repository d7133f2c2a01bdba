package io.storvix.core.fleet;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface FleetInventory {
    List<StorageSystem> systems() throws IOException;

    default Optional<StorageSystem> findByHost(String hostId) throws IOException {
        return systems().stream().filter(system -> system.hostId().equals(hostId)).findFirst();
    }
}
