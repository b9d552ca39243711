package com.tollgate.core.registry;

import com.tollgate.core.persistence.GateConfigStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Refuses to start when an enabled gate config names a gate type the registry
 * cannot evaluate.
 */
@Component
public class GateStartupVerifier {

    private static final Logger log = LoggerFactory.getLogger(GateStartupVerifier.class);

    private final GateRegistry registry;
    private final GateConfigStore store;

    public GateStartupVerifier(GateRegistry registry, GateConfigStore store) {
        this.registry = registry;
        this.store = store;
    }

    @PostConstruct
    public void verify() {
        var active = store.activeGateTypes();
        registry.verifyCoverage(active);
        log.info("Verified checkers for {} active gate types", active.size());
    }
}
