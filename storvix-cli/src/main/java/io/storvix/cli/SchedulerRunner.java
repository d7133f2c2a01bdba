package io.storvix.cli;

@FunctionalInterface
public interface SchedulerRunner {
    int run(Integer portOverride) throws Exception;
}
