package com.tollgate.core.registry;

import com.tollgate.core.checker.GateChecker;
import com.tollgate.core.model.GateType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-wide mapping from gate type to checker.
 * <p>
 * Filled once at startup, then {@link #seal() sealed}; after that it is read-only
 * and safe to share across gate worker threads.
 */
public class GateRegistry {

    private static final Logger log = LoggerFactory.getLogger(GateRegistry.class);

    private final Map<GateType, GateChecker> checkers = new EnumMap<>(GateType.class);
    private volatile boolean sealed;

    public synchronized void register(GateType gateType, GateChecker checker) {
        Objects.requireNonNull(gateType, "gateType must not be null");
        Objects.requireNonNull(checker, "checker must not be null");
        if (sealed) {
            throw new GateRegistrationException(
                    "Registry is sealed; cannot register checker for '" + gateType.value() + "'");
        }
        if (checkers.containsKey(gateType)) {
            throw new GateRegistrationException(
                    "Checker already registered for gate type '" + gateType.value() + "'");
        }
        checkers.put(gateType, checker);
        log.debug("Registered {} for gate type {}", checker.getClass().getSimpleName(), gateType.value());
    }

    /**
     * @throws CheckerNotRegisteredException if no checker exists for {@code gateType}
     */
    public GateChecker lookup(GateType gateType) {
        GateChecker checker = sealed ? checkers.get(gateType) : lookupUnsealed(gateType);
        if (checker == null) {
            throw new CheckerNotRegisteredException(gateType);
        }
        return checker;
    }

    public synchronized void seal() {
        if (!sealed) {
            sealed = true;
            log.info("Gate registry sealed with {} checkers: {}", checkers.size(), registeredTypes());
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    public synchronized Set<GateType> registeredTypes() {
        return checkers.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(checkers.keySet()));
    }

    /**
     * Fails fast when any of the given (persisted, active) gate types has no checker.
     *
     * @throws GateRegistrationException naming every missing type
     */
    public void verifyCoverage(Collection<GateType> activeTypes) {
        Set<GateType> registered = registeredTypes();
        var missing = new TreeSet<String>();
        for (GateType type : activeTypes) {
            if (!registered.contains(type)) {
                missing.add(type.value());
            }
        }
        if (!missing.isEmpty()) {
            throw new GateRegistrationException("Active gate configs reference gate types with no registered checker: " + missing);
        }
    }

    private synchronized GateChecker lookupUnsealed(GateType gateType) {
        return checkers.get(gateType);
    }
}
