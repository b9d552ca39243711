package com.tollgate.core.runner;

import com.tollgate.core.model.GateType;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Options for one gate run.
 *
 * @param dryRun    also consider disabled gates, recording each as skipped
 * @param gateTypes restrict the run to these gate types; empty means all
 */
public record RunOptions(boolean dryRun, Set<GateType> gateTypes) {

    public static final RunOptions DEFAULTS = new RunOptions(false, Set.of());

    public RunOptions {
        gateTypes = gateTypes == null || gateTypes.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(gateTypes));
    }

    public static RunOptions dryRunOptions() {
        return new RunOptions(true, Set.of());
    }

    public static RunOptions only(GateType... types) {
        return new RunOptions(false, Set.copyOf(Arrays.asList(types)));
    }

    public boolean includes(GateType type) {
        return gateTypes.isEmpty() || gateTypes.contains(type);
    }
}
