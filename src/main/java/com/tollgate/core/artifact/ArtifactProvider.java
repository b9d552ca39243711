package com.tollgate.core.artifact;

import com.tollgate.core.model.EvaluationTarget;
import com.tollgate.core.model.GateType;

/**
 * Supplies the evidence bundle a checker needs for one target and gate type.
 * Producing that evidence (running linters, scanners, load tests) happens elsewhere.
 */
public interface ArtifactProvider {

    /**
     * @throws ArtifactFormatException                        if the evidence is missing or malformed
     * @throws com.tollgate.core.model.GateEnvironmentException if the provider itself is unavailable
     */
    ExecutionArtifact getArtifact(EvaluationTarget target, GateType gateType);
}
