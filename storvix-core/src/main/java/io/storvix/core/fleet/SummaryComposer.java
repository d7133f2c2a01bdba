package io.storvix.core.fleet;

import java.io.IOException;
import java.util.List;

public interface SummaryComposer {
    /**
     * Builds an HTML status summary for the given companies; an empty list means the whole fleet.
     */
    String compose(List<String> companies) throws IOException;
}
