package com.tollgate.core.checker;

import com.tollgate.core.artifact.ExecutionArtifact;
import com.tollgate.core.model.GateResult;
import com.tollgate.core.model.GateType;

/**
 * Decides pass/fail for one gate type from already-produced evidence.
 * <p>
 * Implementations are pure: the same artifact and thresholds always yield an
 * equal {@link GateResult}, nothing is written anywhere, and a single instance
 * is called concurrently for unrelated targets.
 */
public interface GateChecker {

    GateType gateType();

    /**
     * @throws ConfigException if a required threshold key is missing or invalid
     * @throws com.tollgate.core.artifact.ArtifactFormatException if the evidence is malformed
     */
    GateResult evaluate(ExecutionArtifact artifact, ThresholdConfig thresholds);
}
