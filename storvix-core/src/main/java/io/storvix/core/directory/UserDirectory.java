package io.storvix.core.directory;

import java.io.IOException;
import java.util.Optional;

public interface UserDirectory {
    /**
     * Delivery address of a user; empty when the user is unknown or has no address on file.
     */
    Optional<String> emailOf(String userId) throws IOException;
}
