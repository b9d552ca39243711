package com.tollgate.core.model;

import java.util.Collection;

/**
 * Issue tallies by severity, as stored on a {@link GateExecution}.
 */
public record IssueCounts(int critical, int high, int medium, int low) {

    public static final IssueCounts ZERO = new IssueCounts(0, 0, 0, 0);

    public static IssueCounts of(Collection<GateIssue> issues) {
        int critical = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (GateIssue issue : issues) {
            switch (issue.severity()) {
                case CRITICAL -> critical++;
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }
        return new IssueCounts(critical, high, medium, low);
    }

    public int total() {
        return critical + high + medium + low;
    }
}
