package com.tollgate.core.checker;

import com.tollgate.core.model.GateType;
import com.tollgate.core.registry.GateRegistry;

/**
 * The initialization routine for the built-in checkers: one checker per
 * {@link GateType}, chosen by an exhaustive switch so a new gate type does not
 * compile until it has a checker.
 */
public final class BuiltInCheckers {

    private BuiltInCheckers() {}

    public static GateChecker forType(GateType type) {
        return switch (type) {
            case LINT -> new LintChecker();
            case COVERAGE -> new CoverageChecker();
            case SECURITY -> new SecurityChecker();
            case PERFORMANCE -> new PerformanceChecker();
            case CONTRACT -> new ContractChecker();
            case COMPLEXITY -> new ComplexityChecker();
            case TYPE_CHECK -> new TypeCheckChecker();
        };
    }

    public static void registerAll(GateRegistry registry) {
        for (GateType type : GateType.values()) {
            registry.register(type, forType(type));
        }
    }
}
