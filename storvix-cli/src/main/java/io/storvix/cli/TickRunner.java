package io.storvix.cli;

import io.storvix.core.scheduler.TickReport;
import java.util.List;

@FunctionalInterface
public interface TickRunner {
    /**
     * Runs one tick of every configured poller and returns their reports in poller order.
     */
    List<TickReport> tickOnce() throws Exception;
}
